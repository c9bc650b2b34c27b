package com.qubicescrow.verification.service.signal;

import com.qubicescrow.verification.config.FraudDetectionConfig;
import com.qubicescrow.verification.config.FraudDetectionProperties;
import com.qubicescrow.verification.domain.CommentRecord;
import com.qubicescrow.verification.domain.EngagementBundle;
import com.qubicescrow.verification.dto.VelocityAnalysisResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.qubicescrow.verification.TestDataBuilder.FIXED_CLOCK;
import static com.qubicescrow.verification.TestDataBuilder.NOW;
import static com.qubicescrow.verification.TestDataBuilder.genuineComment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Velocity Checker Tests")
class VelocityCheckerTest {

    private VelocityChecker checker;

    @BeforeEach
    void setUp() {
        checker = new VelocityChecker(FraudDetectionConfig.defaults(), FIXED_CLOCK);
    }

    private static Instant hoursAgo(double hours) {
        return NOW.minus(Duration.ofMinutes(Math.round(hours * 60)));
    }

    private static EngagementBundle likes(int likes) {
        return EngagementBundle.builder().likes(likes).build();
    }

    /**
     * Comments posted {@code minutesAfterPost} minutes after the post, no other engagement
     */
    private static EngagementBundle commentsAt(Instant posted, long... minutesAfterPost) {
        List<CommentRecord> comments = new ArrayList<>();
        for (int i = 0; i < minutesAfterPost.length; i++) {
            comments.add(genuineComment(i, posted.plus(Duration.ofMinutes(minutesAfterPost[i])), "UK"));
        }
        return EngagementBundle.builder().comments(comments).build();
    }

    @Nested
    @DisplayName("Deviation Scoring Tests")
    class DeviationScoringTests {

        @Test
        @DisplayName("Should give full score to engagement matching the baseline")
        void shouldGiveFullScoreAtBaseline() {
            // Given - 300 likes over 3 hours against 100/hr
            VelocityAnalysisResult result = checker.analyze(likes(300), 100, hoursAgo(3));

            // Then
            assertThat(result.getScore()).isEqualTo(100.0);
            assertThat(result.getCurrentVelocity()).isEqualTo(100.0);
            assertThat(result.getVelocityRatio()).isEqualTo(1.0);
            assertThat(result.getStandardDeviations()).isZero();
            assertThat(result.isAnomalous()).isFalse();
            assertThat(result.getFlags()).isEmpty();
        }

        @Test
        @DisplayName("Should score 80 between one and two sigma")
        void shouldScore80WithinTwoSigma() {
            VelocityAnalysisResult result = checker.analyze(likes(145), 100, hoursAgo(1));

            assertThat(result.getStandardDeviations()).isEqualTo(1.5);
            assertThat(result.getScore()).isEqualTo(80.0);
            assertThat(result.isAnomalous()).isFalse();
        }

        @Test
        @DisplayName("Should score 60 between two sigma and the anomaly threshold")
        void shouldScore60BelowAnomalyThreshold() {
            VelocityAnalysisResult result = checker.analyze(likes(170), 100, hoursAgo(1));

            assertThat(result.getStandardDeviations()).isEqualTo(2.33);
            assertThat(result.getScore()).isEqualTo(60.0);
            assertThat(result.isAnomalous()).isFalse();
            assertThat(result.getFlags()).isEmpty();
        }

        @Test
        @DisplayName("Should flag a spike above the anomaly threshold")
        void shouldFlagSpike() {
            // Given - 1000 likes within the first hour against 100/hr
            VelocityAnalysisResult result = checker.analyze(likes(1000), 100, hoursAgo(1));

            // Then
            assertThat(result.getScore()).isEqualTo(40.0);
            assertThat(result.isAnomalous()).isTrue();
            assertThat(result.getFlags()).containsExactly(
                    "Unusually high engagement spike: 30.0σ above normal",
                    "Suspicious instant spike pattern (possible bot purchase)");
        }

        @Test
        @DisplayName("Should flag unusually low engagement")
        void shouldFlagLowEngagement() {
            VelocityAnalysisResult result = checker.analyze(likes(10), 100, hoursAgo(2));

            assertThat(result.getScore()).isEqualTo(40.0);
            assertThat(result.isAnomalous()).isTrue();
            assertThat(result.getFlags()).containsExactly("Unusually low engagement: 3.2σ below normal");
        }

        @Test
        @DisplayName("Should add a bonus for sustained normal engagement after six hours")
        void shouldAddSustainedBonus() {
            // Given - 150/hr against 100/hr over 8 hours, 1.67 sigma
            VelocityAnalysisResult result = checker.analyze(likes(1200), 100, hoursAgo(8));

            // Then
            assertThat(result.getScore()).isEqualTo(90.0);
            assertThat(result.getTimeSincePostHours()).isEqualTo(8.0);
        }

        @Test
        @DisplayName("Should not add a bonus to anomalous engagement")
        void shouldNotAddBonusWhenAnomalous() {
            VelocityAnalysisResult result = checker.analyze(likes(8000), 100, hoursAgo(8));

            assertThat(result.getScore()).isEqualTo(40.0);
        }
    }

    @Nested
    @DisplayName("Input Normalization Tests")
    class InputNormalizationTests {

        @Test
        @DisplayName("Should weight likes, comments, shares and saves")
        void shouldWeightEngagementTypes() {
            EngagementBundle engagement = EngagementBundle.builder()
                    .likes(10)
                    .comment(genuineComment(1, NOW, "UK"))
                    .comment(genuineComment(2, NOW, "UK"))
                    .shares(3)
                    .saves(4)
                    .build();

            assertThat(checker.weightedEngagement(engagement)).isEqualTo(39.0);
        }

        @Test
        @DisplayName("Should not overflow on very large engagement counts")
        void shouldNotOverflowOnLargeCounts() {
            EngagementBundle engagement = EngagementBundle.builder()
                    .likes(Integer.MAX_VALUE)
                    .shares(500_000_000)
                    .saves(Integer.MAX_VALUE)
                    .build();

            assertThat(checker.weightedEngagement(engagement))
                    .isEqualTo(Integer.MAX_VALUE * 3.0 + 2_500_000_000.0);
        }

        @Test
        @DisplayName("Should treat posts younger than an hour as one hour old")
        void shouldFloorElapsedTimeAtOneHour() {
            VelocityAnalysisResult result = checker.analyze(likes(100), 100, NOW.minus(Duration.ofMinutes(10)));

            assertThat(result.getTimeSincePostHours()).isEqualTo(1.0);
            assertThat(result.getCurrentVelocity()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Should floor the historical baseline at one")
        void shouldFloorHistoricalBaseline() {
            VelocityAnalysisResult result = checker.analyze(likes(1), 0, hoursAgo(1));

            assertThat(result.getHistoricalAverage()).isEqualTo(1.0);
            assertThat(result.getScore()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Should treat a post timestamp in the future as one hour old")
        void shouldHandleFuturePostTimestamp() {
            VelocityAnalysisResult result = checker.analyze(likes(5), 5, NOW.plus(Duration.ofHours(3)));

            assertThat(result.getTimeSincePostHours()).isEqualTo(1.0);
            assertThat(result.getScore()).isEqualTo(100.0);
        }
    }

    @Nested
    @DisplayName("Drop-off Tests")
    class DropOffTests {

        @Test
        @DisplayName("Should flag engagement concentrated in the first two hours of an old post")
        void shouldFlagDropOffAfterSpike() {
            // Given - all 10 comments in the first hour of a 24 hour old post, 30 weighted over 24h
            Instant posted = hoursAgo(24);
            EngagementBundle engagement = commentsAt(posted, 5, 10, 15, 20, 25, 30, 35, 40, 45, 50);

            // When
            VelocityAnalysisResult result = checker.analyze(engagement, 1.25, posted);

            // Then
            assertThat(result.isAnomalous()).isFalse();
            assertThat(result.getFlags()).containsExactly("Engagement dropped significantly after initial spike");
        }

        @Test
        @DisplayName("Should not flag steady engagement over the day")
        void shouldNotFlagSteadyEngagement() {
            Instant posted = hoursAgo(24);
            EngagementBundle engagement = commentsAt(posted, 60, 180, 300, 420, 540, 660, 780, 900, 1020, 1140);

            VelocityAnalysisResult result = checker.analyze(engagement, 1.25, posted);

            assertThat(result.getFlags()).isEmpty();
        }

        @Test
        @DisplayName("Should not count comments at exactly two hours as early")
        void shouldExcludeCommentsAtCutoff() {
            Instant posted = hoursAgo(24);
            EngagementBundle engagement = commentsAt(posted, 120, 120, 120, 120, 120, 120, 120, 120, 120, 120);

            assertThat(checker.estimateEarlyEngagement(engagement, posted)).isZero();
        }

        @Test
        @DisplayName("Should estimate total engagement when there are no comments")
        void shouldEstimateTotalWithoutComments() {
            assertThat(checker.estimateEarlyEngagement(likes(500), hoursAgo(24))).isEqualTo(500.0);
        }

        @Test
        @DisplayName("Should project early engagement with the configured activity fraction")
        void shouldUseConfiguredEarlyActivityFraction() {
            // Given - 4 of 10 comments early, fraction 0.5
            FraudDetectionProperties properties = new FraudDetectionProperties();
            properties.getVelocity().setEarlyActivityFraction(0.5);
            VelocityChecker tuned = new VelocityChecker(FraudDetectionConfig.from(properties), FIXED_CLOCK);
            Instant posted = hoursAgo(24);
            EngagementBundle engagement = commentsAt(posted, 10, 20, 30, 40, 300, 400, 500, 600, 700, 800);

            // When
            double early = tuned.estimateEarlyEngagement(engagement, posted);

            // Then - 30 * 0.4 / 0.5
            assertThat(early).isCloseTo(24.0, within(1e-9));
            assertThat(checker.estimateEarlyEngagement(engagement, posted))
                    .isCloseTo(60.0, within(1e-9));
        }
    }
}
