package com.qubicescrow.verification.domain;

/**
 * Payment recommendation derived from the overall score and flag count
 */
public enum Recommendation {
    APPROVED_FOR_PAYMENT,           // Passed with no flags
    APPROVED_WITH_MINOR_CONCERNS,   // Passed with at most two flags
    APPROVED_BUT_MONITOR,           // Passed with more than two flags
    MANUAL_REVIEW_RECOMMENDED,      // Below pass threshold, score >= 80
    HOLD_PAYMENT_PENDING_REVIEW,    // Score >= 60
    REJECT_PAYMENT_FRAUD_DETECTED;  // Everything else

    public boolean isApproved() {
        return this == APPROVED_FOR_PAYMENT
                || this == APPROVED_WITH_MINOR_CONCERNS
                || this == APPROVED_BUT_MONITOR;
    }

    /**
     * Whether escrowed funds may be released without a human in the loop
     */
    public boolean releasesPayment() {
        return this == APPROVED_FOR_PAYMENT || this == APPROVED_WITH_MINOR_CONCERNS;
    }
}
