package com.qubicescrow.verification.domain;

/**
 * Confidence in the combined verdict. Signals that agree with each other give high confidence.
 */
public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW;

    public static ConfidenceLevel fromStandardDeviation(double standardDeviation) {
        if (standardDeviation < 10) {
            return HIGH;
        } else if (standardDeviation < 20) {
            return MEDIUM;
        } else {
            return LOW;
        }
    }
}
