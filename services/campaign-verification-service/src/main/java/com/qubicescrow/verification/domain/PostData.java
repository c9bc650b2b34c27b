package com.qubicescrow.verification.domain;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Everything the fraud detector needs about one campaign post.
 * Materialized in memory by the data-fetching collaborator before verification starts.
 */
@Value
@Builder(toBuilder = true)
public class PostData {

    public static final double DEFAULT_HISTORICAL_AVG_ENGAGEMENT = 5.0;
    public static final String UNKNOWN_LOCATION = "Unknown";

    String postUrl;

    @NotNull
    @Valid
    @Singular
    List<FollowerProfile> followers;

    @NotNull(message = "engagement is required")
    @Valid
    EngagementBundle engagement;

    @PositiveOrZero
    @Builder.Default
    double historicalAvgEngagement = DEFAULT_HISTORICAL_AVG_ENGAGEMENT;

    @NotNull(message = "postTimestamp is required")
    Instant postTimestamp;

    String influencerLocation;

    public String getInfluencerLocation() {
        return influencerLocation != null ? influencerLocation : UNKNOWN_LOCATION;
    }
}
