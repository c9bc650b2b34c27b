package com.qubicescrow.verification.service.signal;

import com.qubicescrow.verification.config.FraudDetectionConfig;
import com.qubicescrow.verification.domain.FollowerProfile;
import com.qubicescrow.verification.dto.FollowerAnalysisResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Follower Authenticity Check
 *
 * Classifies each follower as real, suspicious or bot:
 * 1. Definite bot: bot username pattern, zero posts, suspicious location
 * 2. Suspicious: no profile picture, follow ratio above 10, new account following
 *    more than 1000, empty bio
 * 3. Three or more suspicious reasons escalate to definite bot
 *
 * Real followers count fully, suspicious ones half, bots not at all.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FollowerAuthenticityChecker {

    static final String NO_FOLLOWERS_FLAG = "No followers to analyze";

    private static final double SUSPICIOUS_CREDIT = 0.5;
    private static final double BOT_FLAG_RATIO = 0.3;
    private static final double SUSPICIOUS_FLAG_RATIO = 0.2;
    private static final double MAX_FOLLOW_RATIO = 10;
    private static final int NEW_ACCOUNT_AGE_DAYS = 30;
    private static final int HIGH_FOLLOWING_COUNT = 1000;
    private static final int ESCALATION_REASON_COUNT = 3;

    private final FraudDetectionConfig config;

    public FollowerAnalysisResult analyze(List<FollowerProfile> followers) {
        if (followers.isEmpty()) {
            // An account nobody follows cannot vouch for a campaign
            return FollowerAnalysisResult.builder()
                    .score(0)
                    .flags(List.of(NO_FOLLOWERS_FLAG))
                    .build();
        }

        int total = followers.size();
        int botCount = 0;
        int suspiciousCount = 0;

        for (FollowerProfile follower : followers) {
            BotSignals signals = checkBotSignals(follower);
            if (signals.definiteBot()) {
                botCount++;
            } else if (signals.suspicious()) {
                suspiciousCount++;
            }
        }

        int realCount = total - botCount - suspiciousCount;
        double weightedScore = (realCount + suspiciousCount * SUSPICIOUS_CREDIT) / total * 100;

        List<String> flags = new ArrayList<>();
        if (botCount > total * BOT_FLAG_RATIO) {
            flags.add(String.format(Locale.ROOT, "High bot presence: %d bots (%.1f%%)",
                    botCount, SignalScores.percentage(botCount, total)));
        }
        if (suspiciousCount > total * SUSPICIOUS_FLAG_RATIO) {
            flags.add(String.format(Locale.ROOT, "Many suspicious accounts: %d (%.1f%%)",
                    suspiciousCount, SignalScores.percentage(suspiciousCount, total)));
        }

        log.info("Follower analysis: {} real, {} suspicious, {} bots", realCount, suspiciousCount, botCount);

        return FollowerAnalysisResult.builder()
                .score(SignalScores.round(SignalScores.clamp(weightedScore)))
                .realCount(realCount)
                .botCount(botCount)
                .suspiciousCount(suspiciousCount)
                .totalAnalyzed(total)
                .authenticityPercentage(SignalScores.round(SignalScores.percentage(realCount, total)))
                .flags(List.copyOf(flags))
                .build();
    }

    BotSignals checkBotSignals(FollowerProfile follower) {
        boolean definiteBot = false;
        int suspiciousReasons = 0;

        // Definite signals
        String username = follower.getUsername();
        if (config.getBotUsernamePatterns().stream().anyMatch(p -> p.matcher(username).lookingAt())) {
            definiteBot = true;
        }
        if (follower.getPostCount() == 0) {
            definiteBot = true;
        }
        if (config.getSuspiciousLocations().contains(follower.getLocation())) {
            definiteBot = true;
        }

        // Suspicious signals
        if (!follower.hasProfilePic()) {
            suspiciousReasons++;
        }
        int following = follower.getFollowingCount();
        int followerCount = follower.getFollowerCount();
        if (following > 0 && followerCount > 0 && (double) following / followerCount > MAX_FOLLOW_RATIO) {
            suspiciousReasons++;
        }
        if (follower.getAccountAgeDays() < NEW_ACCOUNT_AGE_DAYS && following > HIGH_FOLLOWING_COUNT) {
            suspiciousReasons++;
        }
        if (follower.getBioLength() == 0) {
            suspiciousReasons++;
        }

        if (suspiciousReasons >= ESCALATION_REASON_COUNT) {
            definiteBot = true;
        }

        return new BotSignals(definiteBot, suspiciousReasons > 0, suspiciousReasons);
    }

    record BotSignals(boolean definiteBot, boolean suspicious, int suspiciousReasons) {
    }
}
