package com.qubicescrow.verification.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class GeoAnalysisResult implements SignalResult {
    double score;
    LocationAlignment followerAlignment;
    LocationAlignment engagementAlignment;
    int botFarmFollowers;
    int botFarmEngagement;

    /**
     * Five most common follower locations, most common first
     */
    Map<String, Integer> topFollowerCountries;

    /**
     * Five most common commenter locations, most common first
     */
    Map<String, Integer> topEngagementCountries;

    String influencerLocation;
    List<String> expectedRegions;
    List<String> flags;
}
