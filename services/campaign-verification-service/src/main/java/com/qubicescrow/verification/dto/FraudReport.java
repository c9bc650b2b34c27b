package com.qubicescrow.verification.dto;

import com.qubicescrow.verification.domain.ConfidenceLevel;
import com.qubicescrow.verification.domain.Recommendation;
import com.qubicescrow.verification.domain.SignalType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Final verdict for one campaign post.
 *
 * The breakdown always holds all four signals, iterated in {@link SignalType} order.
 * Fraud flags are the analyzers' flags concatenated in the same order.
 */
@Value
@Builder
public class FraudReport {
    double overallScore;
    double passThreshold;
    boolean passed;
    Recommendation recommendation;
    ConfidenceLevel confidence;
    Map<SignalType, SignalBreakdown> breakdown;
    List<String> fraudFlags;
    String summary;

    public SignalBreakdown getSignal(SignalType signal) {
        return breakdown.get(signal);
    }

    public FollowerAnalysisResult getFollowerResult() {
        return (FollowerAnalysisResult) breakdown.get(SignalType.FOLLOWER_AUTHENTICITY).getDetails();
    }

    public EngagementAnalysisResult getEngagementResult() {
        return (EngagementAnalysisResult) breakdown.get(SignalType.ENGAGEMENT_QUALITY).getDetails();
    }

    public VelocityAnalysisResult getVelocityResult() {
        return (VelocityAnalysisResult) breakdown.get(SignalType.VELOCITY_CHECK).getDetails();
    }

    public GeoAnalysisResult getGeoResult() {
        return (GeoAnalysisResult) breakdown.get(SignalType.GEO_ALIGNMENT).getDetails();
    }
}
