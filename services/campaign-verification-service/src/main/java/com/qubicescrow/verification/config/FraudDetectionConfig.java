package com.qubicescrow.verification.config;

import com.qubicescrow.verification.domain.SignalType;
import com.qubicescrow.verification.exception.FraudConfigurationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable, validated fraud detection configuration.
 *
 * Created once per engine from {@link FraudDetectionProperties}. Analyzers and the
 * detector receive it through their constructors, so differently configured
 * engines can run side by side in one process.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FraudDetectionConfig {

    static final double WEIGHT_SUM_TOLERANCE = 0.001;

    Map<SignalType, Double> weights;
    Map<SignalType, Double> minimumScores;
    double passThreshold;
    double velocityAnomalyThreshold;
    double earlyActivityFraction;
    List<Pattern> botUsernamePatterns;
    List<String> spamPhrases;
    Set<String> suspiciousLocations;
    Set<String> botFarmLocations;
    Map<String, List<String>> expectedRegions;

    /**
     * Validates the properties and freezes them.
     *
     * @throws FraudConfigurationException when weights do not sum to 1.0, a pattern does not
     *                                     compile or a threshold is out of range
     */
    public static FraudDetectionConfig from(FraudDetectionProperties properties) {
        FraudDetectionProperties.Weights w = properties.getWeights();
        double weightSum = w.sum();
        if (Math.abs(weightSum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw FraudConfigurationException.invalidWeightSum(weightSum);
        }

        FraudDetectionProperties.Thresholds t = properties.getThresholds();
        if (t.getOverallPassScore() < 0 || t.getOverallPassScore() > 100) {
            throw FraudConfigurationException.invalidValue("verification.fraud-detection.thresholds.overall-pass-score",
                    String.valueOf(t.getOverallPassScore()), "must be within [0, 100]");
        }
        if (t.getVelocityAnomalyMax() <= 0) {
            throw FraudConfigurationException.invalidValue("verification.fraud-detection.thresholds.velocity-anomaly-max",
                    String.valueOf(t.getVelocityAnomalyMax()), "must be positive");
        }
        double earlyFraction = properties.getVelocity().getEarlyActivityFraction();
        if (earlyFraction <= 0 || earlyFraction > 1) {
            throw FraudConfigurationException.invalidValue("verification.fraud-detection.velocity.early-activity-fraction",
                    String.valueOf(earlyFraction), "must be within (0, 1]");
        }

        Map<SignalType, Double> weights = new EnumMap<>(SignalType.class);
        weights.put(SignalType.FOLLOWER_AUTHENTICITY, w.getFollowerAuthenticity());
        weights.put(SignalType.ENGAGEMENT_QUALITY, w.getEngagementQuality());
        weights.put(SignalType.VELOCITY_CHECK, w.getVelocityCheck());
        weights.put(SignalType.GEO_ALIGNMENT, w.getGeoAlignment());

        Map<SignalType, Double> minimums = new EnumMap<>(SignalType.class);
        minimums.put(SignalType.FOLLOWER_AUTHENTICITY, t.getFollowerAuthenticityMin());
        minimums.put(SignalType.ENGAGEMENT_QUALITY, t.getEngagementQualityMin());
        // The velocity signal is bounded by sigma, not by a minimum percentage
        minimums.put(SignalType.VELOCITY_CHECK, 0.0);
        minimums.put(SignalType.GEO_ALIGNMENT, t.getGeoAlignmentMin());

        List<Pattern> patterns = new ArrayList<>();
        for (String regex : properties.getBotUsernamePatterns()) {
            try {
                patterns.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw FraudConfigurationException.invalidPattern(
                        "verification.fraud-detection.bot-username-patterns", regex, e);
            }
        }

        List<String> spamPhrases = properties.getSpamCommentPhrases().stream()
                .map(phrase -> phrase.toLowerCase(Locale.ROOT))
                .toList();

        Map<String, List<String>> regions = new LinkedHashMap<>();
        properties.getExpectedRegions().forEach((location, expected) -> regions.put(location, List.copyOf(expected)));

        return new FraudDetectionConfig(
                Collections.unmodifiableMap(weights),
                Collections.unmodifiableMap(minimums),
                t.getOverallPassScore(),
                t.getVelocityAnomalyMax(),
                earlyFraction,
                List.copyOf(patterns),
                spamPhrases,
                Collections.unmodifiableSet(new LinkedHashSet<>(properties.getSuspiciousLocations())),
                Collections.unmodifiableSet(new LinkedHashSet<>(properties.getBotFarmLocations())),
                Collections.unmodifiableMap(regions)
        );
    }

    public static FraudDetectionConfig defaults() {
        return from(new FraudDetectionProperties());
    }

    public double weightOf(SignalType signal) {
        return weights.get(signal);
    }

    public double minimumScoreOf(SignalType signal) {
        return minimumScores.get(signal);
    }

    /**
     * Regions an influencer's audience is expected to come from. Unknown influencer
     * locations only expect their own location.
     */
    public List<String> expectedRegionsFor(String influencerLocation) {
        return expectedRegions.getOrDefault(influencerLocation, List.of(influencerLocation));
    }
}
