package com.qubicescrow.verification.service.signal;

import com.qubicescrow.verification.config.FraudDetectionConfig;
import com.qubicescrow.verification.domain.CommentRecord;
import com.qubicescrow.verification.domain.EngagementBundle;
import com.qubicescrow.verification.domain.FollowerProfile;
import com.qubicescrow.verification.dto.GeoAnalysisResult;
import com.qubicescrow.verification.dto.LocationAlignment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Geographic Location Check
 *
 * Measures how much of the follower base and of the commenters come from the regions
 * an influencer's audience is expected in, and penalizes bot-farm locations.
 * Followers weigh 60% of the score, engagement 40%.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeoLocationChecker {

    private static final double FOLLOWER_WEIGHT = 0.6;
    private static final double ENGAGEMENT_WEIGHT = 0.4;
    private static final double MAX_BOT_FARM_PENALTY = 30;
    private static final double BOT_FARM_FLAG_RATIO = 0.2;
    private static final double POOR_ALIGNMENT_PERCENTAGE = 50;
    private static final double CONCENTRATION_RATIO = 0.5;
    private static final double NEUTRAL_ALIGNMENT_SCORE = 50;
    private static final int TOP_LOCATIONS = 5;

    private final FraudDetectionConfig config;

    public GeoAnalysisResult analyze(List<FollowerProfile> followers, EngagementBundle engagement,
                                     String influencerLocation) {
        List<CommentRecord> comments = engagement.getComments();

        Map<String, Integer> followerLocationCounts = countLocations(
                followers.stream().map(FollowerProfile::getLocation).toList());
        Map<String, Integer> engagementLocationCounts = countLocations(
                comments.stream().map(CommentRecord::getLocation).toList());

        List<String> expected = config.expectedRegionsFor(influencerLocation);

        LocationAlignment followerAlignment =
                calculateAlignment(followerLocationCounts, expected, followers.size());
        LocationAlignment engagementAlignment =
                calculateAlignment(engagementLocationCounts, expected, comments.size());

        int botFarmFollowers = countIn(followerLocationCounts, config.getBotFarmLocations());
        int botFarmEngagement = countIn(engagementLocationCounts, config.getBotFarmLocations());

        List<String> flags = new ArrayList<>();

        if (botFarmFollowers > followers.size() * BOT_FARM_FLAG_RATIO) {
            flags.add(String.format(Locale.ROOT, "High bot farm follower presence: %.1f%%",
                    SignalScores.percentage(botFarmFollowers, followers.size())));
        }
        if (botFarmEngagement > comments.size() * BOT_FARM_FLAG_RATIO) {
            flags.add(String.format(Locale.ROOT, "High bot farm engagement: %.1f%%",
                    SignalScores.percentage(botFarmEngagement, comments.size())));
        }
        if (followerAlignment.getTotal() > 0 && followerAlignment.getPercentage() < POOR_ALIGNMENT_PERCENTAGE) {
            flags.add(String.format(Locale.ROOT, "Poor follower location alignment: only %.1f%% from target regions",
                    followerAlignment.getPercentage()));
        }
        if (engagementAlignment.getTotal() > 0 && engagementAlignment.getPercentage() < POOR_ALIGNMENT_PERCENTAGE) {
            flags.add(String.format(Locale.ROOT, "Poor engagement location alignment: only %.1f%% from target regions",
                    engagementAlignment.getPercentage()));
        }

        // Single non-target country dominating the follower base
        if (!followerLocationCounts.isEmpty()) {
            Map.Entry<String, Integer> top = topLocations(followerLocationCounts, 1).entrySet().iterator().next();
            if (!expected.contains(top.getKey()) && top.getValue() > followers.size() * CONCENTRATION_RATIO) {
                flags.add(String.format(Locale.ROOT, "Suspicious concentration: %d followers (%.1f%%) from %s",
                        top.getValue(), SignalScores.percentage(top.getValue(), followers.size()), top.getKey()));
            }
        }

        double overallScore = followerAlignment.getScore() * FOLLOWER_WEIGHT
                + engagementAlignment.getScore() * ENGAGEMENT_WEIGHT;

        int pooledTotal = followers.size() + comments.size();
        if (pooledTotal > 0) {
            double botFarmFraction = (double) (botFarmFollowers + botFarmEngagement) / pooledTotal;
            overallScore -= Math.min(MAX_BOT_FARM_PENALTY, botFarmFraction * 100);
        }
        overallScore = Math.max(SignalScores.MIN_SCORE, overallScore);

        log.info("Geo analysis: Follower {}% aligned, Engagement {}% aligned",
                String.format(Locale.ROOT, "%.1f", followerAlignment.getPercentage()),
                String.format(Locale.ROOT, "%.1f", engagementAlignment.getPercentage()));

        return GeoAnalysisResult.builder()
                .score(SignalScores.round(SignalScores.clamp(overallScore)))
                .followerAlignment(followerAlignment)
                .engagementAlignment(engagementAlignment)
                .botFarmFollowers(botFarmFollowers)
                .botFarmEngagement(botFarmEngagement)
                .topFollowerCountries(topLocations(followerLocationCounts, TOP_LOCATIONS))
                .topEngagementCountries(topLocations(engagementLocationCounts, TOP_LOCATIONS))
                .influencerLocation(influencerLocation)
                .expectedRegions(expected)
                .flags(List.copyOf(flags))
                .build();
    }

    LocationAlignment calculateAlignment(Map<String, Integer> locationCounts, List<String> expectedRegions,
                                         int total) {
        if (total == 0) {
            return LocationAlignment.builder()
                    .score(NEUTRAL_ALIGNMENT_SCORE)
                    .alignedCount(0)
                    .percentage(0)
                    .total(0)
                    .build();
        }

        int alignedCount = countIn(locationCounts, expectedRegions);
        double percentage = SignalScores.percentage(alignedCount, total);

        double score;
        if (percentage >= 80) {
            score = 100;
        } else if (percentage >= 60) {
            score = 90;
        } else if (percentage >= 40) {
            score = 70;
        } else if (percentage >= 20) {
            score = 50;
        } else {
            score = 30;
        }

        return LocationAlignment.builder()
                .score(score)
                .alignedCount(alignedCount)
                .percentage(SignalScores.round(percentage))
                .total(total)
                .build();
    }

    private static Map<String, Integer> countLocations(List<String> locations) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String location : locations) {
            counts.merge(location, 1, Integer::sum);
        }
        return counts;
    }

    private static int countIn(Map<String, Integer> locationCounts, Collection<String> locations) {
        return locationCounts.entrySet().stream()
                .filter(e -> locations.contains(e.getKey()))
                .mapToInt(Map.Entry::getValue)
                .sum();
    }

    /**
     * Most common locations first; ties keep first-seen order
     */
    private static Map<String, Integer> topLocations(Map<String, Integer> locationCounts, int limit) {
        Map<String, Integer> top = new LinkedHashMap<>();
        locationCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(limit)
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return Collections.unmodifiableMap(top);
    }
}
