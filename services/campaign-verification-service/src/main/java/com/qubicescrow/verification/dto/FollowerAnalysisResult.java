package com.qubicescrow.verification.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FollowerAnalysisResult implements SignalResult {
    double score;
    int realCount;
    int botCount;
    int suspiciousCount;
    int totalAnalyzed;
    double authenticityPercentage;
    List<String> flags;
}
