package com.qubicescrow.verification.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fraud detection configuration properties.
 *
 * Bound once at startup and converted into an immutable {@link FraudDetectionConfig}
 * by {@link FraudDetectionConfig#from(FraudDetectionProperties)}. Defaults match the
 * production tuning so an empty configuration still yields a working engine.
 *
 * CONFIGURATION:
 * verification:
 *   fraud-detection:
 *     weights:
 *       follower-authenticity: 0.30
 *       engagement-quality: 0.35
 *       velocity-check: 0.20
 *       geo-alignment: 0.15
 *     thresholds:
 *       overall-pass-score: 95
 *       velocity-anomaly-max: 2.5
 */
@Data
@Validated
@ConfigurationProperties(prefix = "verification.fraud-detection")
public class FraudDetectionProperties {

    /**
     * Per-signal weights, must sum to 1.0
     */
    @Valid
    private Weights weights = new Weights();

    /**
     * Pass score, per-signal minimums and the velocity anomaly threshold
     */
    @Valid
    private Thresholds thresholds = new Thresholds();

    /**
     * Follower usernames matching any of these patterns are treated as bots
     */
    @NotEmpty
    private List<String> botUsernamePatterns = new ArrayList<>(List.of(
            "^[a-z]+\\d{4,}$",
            "^\\d+[a-z]+\\d+$",
            "^user\\d{6,}$"
    ));

    /**
     * Comment phrases counted as spam (case-insensitive substring match)
     */
    @NotNull
    private List<String> spamCommentPhrases = new ArrayList<>(List.of(
            "great post", "nice", "cool", "awesome",
            "❤️", "🔥", "👍", "😍",
            "check my bio", "follow me", "dm me"
    ));

    /**
     * Follower locations that mark an account as a definite bot
     */
    @NotNull
    private List<String> suspiciousLocations = new ArrayList<>(List.of("Unknown", "Bot Farm", "Multiple"));

    /**
     * Locations counted as bot farms by the geographic check. Kept separate from
     * {@link #suspiciousLocations}; the two lists are tuned independently.
     */
    @NotNull
    private List<String> botFarmLocations = new ArrayList<>(List.of("Unknown", "Bot Farm", "Multiple"));

    /**
     * Audience regions expected for an influencer location.
     * Keys containing spaces need bracket notation in YAML, e.g. "[United States]".
     */
    @NotNull
    private Map<String, List<String>> expectedRegions = defaultExpectedRegions();

    @Valid
    private Velocity velocity = new Velocity();

    @Valid
    private Executor executor = new Executor();

    @Data
    public static class Weights {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double followerAuthenticity = 0.30;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double engagementQuality = 0.35;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double velocityCheck = 0.20;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double geoAlignment = 0.15;

        public double sum() {
            return followerAuthenticity + engagementQuality + velocityCheck + geoAlignment;
        }
    }

    @Data
    public static class Thresholds {
        /**
         * Minimum percentage of real followers
         */
        @DecimalMin("0.0") @DecimalMax("100.0")
        private double followerAuthenticityMin = 85;

        /**
         * Minimum percentage of authentic engagement
         */
        @DecimalMin("0.0") @DecimalMax("100.0")
        private double engagementQualityMin = 80;

        /**
         * Maximum standard deviations before velocity is anomalous
         */
        @DecimalMin(value = "0.0", inclusive = false)
        private double velocityAnomalyMax = 2.5;

        /**
         * Minimum percentage of target audience
         */
        @DecimalMin("0.0") @DecimalMax("100.0")
        private double geoAlignmentMin = 60;

        /**
         * Minimum overall score to pass
         */
        @DecimalMin("0.0") @DecimalMax("100.0")
        private double overallPassScore = 95;
    }

    @Data
    public static class Velocity {
        /**
         * Share of eventual engagement expected in the first two hours.
         * Heuristic, not measured; used by the post-spike drop-off check.
         */
        @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0")
        private double earlyActivityFraction = 0.2;
    }

    @Data
    public static class Executor {
        @Min(1)
        private int corePoolSize = 4;

        @Min(1)
        private int maxPoolSize = 16;

        @Min(0)
        private int queueCapacity = 200;
    }

    private static Map<String, List<String>> defaultExpectedRegions() {
        Map<String, List<String>> regions = new LinkedHashMap<>();
        regions.put("United States", List.of("United States", "Canada", "UK", "Australia"));
        regions.put("United Kingdom", List.of("UK", "United States", "Europe", "Australia"));
        regions.put("Canada", List.of("Canada", "United States", "UK"));
        regions.put("Australia", List.of("Australia", "UK", "United States", "New Zealand"));
        regions.put("Europe", List.of("UK", "Germany", "France", "Spain", "Italy"));
        return regions;
    }
}
