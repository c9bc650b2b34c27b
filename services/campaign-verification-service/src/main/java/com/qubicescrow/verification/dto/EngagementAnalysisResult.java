package com.qubicescrow.verification.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EngagementAnalysisResult implements SignalResult {
    double score;
    int authenticCount;
    int spamCount;
    int genericCount;
    int duplicateCount;
    int totalAnalyzed;
    double qualityPercentage;
    List<String> flags;
}
