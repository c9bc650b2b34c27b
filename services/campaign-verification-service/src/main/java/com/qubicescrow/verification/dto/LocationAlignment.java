package com.qubicescrow.verification.dto;

import lombok.Builder;
import lombok.Value;

/**
 * How much of a location distribution falls inside the expected regions
 */
@Value
@Builder
public class LocationAlignment {
    double score;
    int alignedCount;
    double percentage;
    int total;
}
