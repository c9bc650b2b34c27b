package com.qubicescrow.verification.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class VelocityAnalysisResult implements SignalResult {
    double score;

    /**
     * Weighted engagement per hour since posting
     */
    double currentVelocity;

    /**
     * Baseline engagement per hour after the division guard
     */
    double historicalAverage;

    double velocityRatio;
    double standardDeviations;
    double timeSincePostHours;
    boolean anomalous;
    List<String> flags;
}
