package com.qubicescrow.verification.service.signal;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding and bounds shared by the signal analyzers
 */
public final class SignalScores {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 100.0;

    private SignalScores() {
    }

    public static double clamp(double score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    public static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Share of {@code part} in {@code total} as a percentage, 0 for an empty total
     */
    public static double percentage(int part, int total) {
        return total == 0 ? 0.0 : (double) part / total * 100;
    }
}
