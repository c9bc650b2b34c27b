package com.qubicescrow.verification.dto;

import java.util.List;

/**
 * Output of one signal analyzer
 */
public interface SignalResult {

    /**
     * Signal score, always within [0, 100]
     */
    double getScore();

    /**
     * Human-readable anomaly descriptions in detection order
     */
    List<String> getFlags();
}
