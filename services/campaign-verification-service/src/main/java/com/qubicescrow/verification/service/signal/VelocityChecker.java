package com.qubicescrow.verification.service.signal;

import com.qubicescrow.verification.config.FraudDetectionConfig;
import com.qubicescrow.verification.domain.CommentRecord;
import com.qubicescrow.verification.domain.EngagementBundle;
import com.qubicescrow.verification.dto.VelocityAnalysisResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Velocity Check
 *
 * Compares engagement per hour since posting with the account's historical average.
 * Engagement is modeled as normally distributed with a standard deviation of 30% of
 * the average; the score drops with every sigma of deviation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VelocityChecker {

    private static final int LIKE_WEIGHT = 1;
    private static final int COMMENT_WEIGHT = 3;
    private static final int SHARE_WEIGHT = 5;
    private static final int SAVE_WEIGHT = 2;

    private static final double MIN_HOURS_ELAPSED = 1.0;
    private static final double MIN_HISTORICAL_AVERAGE = 1.0;
    private static final double RELATIVE_STD_DEV = 0.3;

    private static final double INSTANT_SPIKE_WINDOW_HOURS = 2;
    private static final double INSTANT_SPIKE_MULTIPLIER = 2;
    private static final double DROPOFF_MIN_HOURS = 12;
    private static final Duration EARLY_WINDOW = Duration.ofHours(2);
    private static final double DROPOFF_MULTIPLIER = 1.5;
    private static final double SUSTAINED_MIN_HOURS = 6;
    private static final double SUSTAINED_BONUS = 10;

    private final FraudDetectionConfig config;
    private final Clock clock;

    public VelocityAnalysisResult analyze(EngagementBundle engagement, double historicalAvg, Instant postTimestamp) {
        double currentEngagement = weightedEngagement(engagement);

        double hoursSincePost = Duration.between(postTimestamp, clock.instant()).toMillis() / 3_600_000.0;
        hoursSincePost = Math.max(MIN_HOURS_ELAPSED, hoursSincePost);

        double currentVelocity = currentEngagement / hoursSincePost;
        double baseline = Math.max(historicalAvg, MIN_HISTORICAL_AVERAGE);
        double velocityRatio = currentVelocity / baseline;

        double stdDev = baseline * RELATIVE_STD_DEV;
        double deviation = Math.abs(currentVelocity - baseline) / stdDev;

        List<String> flags = new ArrayList<>();
        boolean anomalous = false;

        if (deviation > config.getVelocityAnomalyThreshold()) {
            anomalous = true;
            if (currentVelocity > baseline) {
                flags.add(String.format(Locale.ROOT, "Unusually high engagement spike: %.1fσ above normal", deviation));
            } else {
                flags.add(String.format(Locale.ROOT, "Unusually low engagement: %.1fσ below normal", deviation));
            }
        }

        if (hoursSincePost < INSTANT_SPIKE_WINDOW_HOURS && currentVelocity > baseline * INSTANT_SPIKE_MULTIPLIER) {
            flags.add("Suspicious instant spike pattern (possible bot purchase)");
        }

        if (hoursSincePost > DROPOFF_MIN_HOURS) {
            double earlyEngagement = estimateEarlyEngagement(engagement, postTimestamp);
            if (earlyEngagement > currentEngagement * DROPOFF_MULTIPLIER) {
                flags.add("Engagement dropped significantly after initial spike");
            }
        }

        double score;
        if (deviation <= 1) {
            score = 100;
        } else if (deviation <= 2) {
            score = 80;
        } else if (deviation <= 3) {
            score = 60;
        } else {
            score = 40;
        }

        // Sustained, normal engagement over time
        if (hoursSincePost > SUSTAINED_MIN_HOURS && !anomalous) {
            score = Math.min(SignalScores.MAX_SCORE, score + SUSTAINED_BONUS);
        }

        log.info("Velocity analysis: {}/hr vs {}/hr avg ({}σ)",
                String.format(Locale.ROOT, "%.2f", currentVelocity),
                String.format(Locale.ROOT, "%.2f", baseline),
                String.format(Locale.ROOT, "%.2f", deviation));

        return VelocityAnalysisResult.builder()
                .score(SignalScores.round(SignalScores.clamp(score)))
                .currentVelocity(SignalScores.round(currentVelocity))
                .historicalAverage(SignalScores.round(baseline))
                .velocityRatio(SignalScores.round(velocityRatio))
                .standardDeviations(SignalScores.round(deviation))
                .timeSincePostHours(SignalScores.round(hoursSincePost))
                .anomalous(anomalous)
                .flags(List.copyOf(flags))
                .build();
    }

    double weightedEngagement(EngagementBundle engagement) {
        return (double) engagement.getLikes() * LIKE_WEIGHT
                + (double) engagement.getCommentCount() * COMMENT_WEIGHT
                + (double) engagement.getShares() * SHARE_WEIGHT
                + (double) engagement.getSaves() * SAVE_WEIGHT;
    }

    /**
     * Projects total engagement from the share of comments posted in the first two hours.
     * Without time-series data the comment timestamps are the only early-activity proxy.
     */
    double estimateEarlyEngagement(EngagementBundle engagement, Instant postTimestamp) {
        double totalEngagement = weightedEngagement(engagement);
        List<CommentRecord> comments = engagement.getComments();
        if (comments.isEmpty()) {
            return totalEngagement;
        }

        Instant earlyCutoff = postTimestamp.plus(EARLY_WINDOW);
        long earlyComments = comments.stream()
                .filter(c -> c.getTimestamp().isBefore(earlyCutoff))
                .count();
        double earlyRatio = (double) earlyComments / comments.size();

        return totalEngagement * earlyRatio / config.getEarlyActivityFraction();
    }
}
