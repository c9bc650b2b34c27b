package com.qubicescrow.verification.dto;

import com.qubicescrow.verification.domain.SignalType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Active thresholds and weights of an engine, for callers that display or audit them
 */
@Value
@Builder
public class ThresholdSummary {
    double overallPassScore;
    double velocityAnomalyMax;
    Map<SignalType, Double> minimumScores;
    Map<SignalType, Double> weights;
}
