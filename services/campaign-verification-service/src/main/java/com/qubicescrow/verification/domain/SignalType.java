package com.qubicescrow.verification.domain;

/**
 * The four independent fraud signals, in report order
 */
public enum SignalType {
    FOLLOWER_AUTHENTICITY("follower_authenticity"),
    ENGAGEMENT_QUALITY("engagement_quality"),
    VELOCITY_CHECK("velocity_check"),
    GEO_ALIGNMENT("geo_alignment");

    private final String key;

    SignalType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
