package com.qubicescrow.verification.dto;

import lombok.Builder;
import lombok.Value;

/**
 * One signal's share of the overall score
 */
@Value
@Builder
public class SignalBreakdown {
    double score;
    double weight;
    double weightedContribution;

    /**
     * Configured minimum for this signal. Informational, does not affect the verdict.
     */
    double minimumScore;

    boolean belowMinimum;
    SignalResult details;
}
