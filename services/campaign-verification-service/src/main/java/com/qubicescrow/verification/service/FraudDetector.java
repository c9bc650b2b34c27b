package com.qubicescrow.verification.service;

import com.qubicescrow.verification.config.FraudDetectionConfig;
import com.qubicescrow.verification.domain.ConfidenceLevel;
import com.qubicescrow.verification.domain.PostData;
import com.qubicescrow.verification.domain.Recommendation;
import com.qubicescrow.verification.domain.SignalType;
import com.qubicescrow.verification.dto.EngagementAnalysisResult;
import com.qubicescrow.verification.dto.FollowerAnalysisResult;
import com.qubicescrow.verification.dto.FraudReport;
import com.qubicescrow.verification.dto.GeoAnalysisResult;
import com.qubicescrow.verification.dto.SignalBreakdown;
import com.qubicescrow.verification.dto.SignalResult;
import com.qubicescrow.verification.dto.ThresholdSummary;
import com.qubicescrow.verification.dto.VelocityAnalysisResult;
import com.qubicescrow.verification.exception.SignalAnalysisException;
import com.qubicescrow.verification.service.signal.EngagementQualityChecker;
import com.qubicescrow.verification.service.signal.FollowerAuthenticityChecker;
import com.qubicescrow.verification.service.signal.GeoLocationChecker;
import com.qubicescrow.verification.service.signal.SignalScores;
import com.qubicescrow.verification.service.signal.VelocityChecker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Campaign Fraud Detector
 *
 * Runs the four signal analyzers on one post and turns their scores into a verdict:
 * 1. Follower authenticity
 * 2. Engagement quality
 * 3. Engagement velocity
 * 4. Geographic alignment
 *
 * The analyzers share nothing but the read-only configuration, so they run in
 * parallel on the signal analysis executor and are joined before scoring.
 * Identical post data and configuration always produce an identical report.
 */
@Slf4j
@Service
public class FraudDetector {

    private static final double MANUAL_REVIEW_SCORE = 80;
    private static final double HOLD_SCORE = 60;
    private static final int MINOR_CONCERN_FLAG_LIMIT = 2;

    private final FollowerAuthenticityChecker followerChecker;
    private final EngagementQualityChecker engagementChecker;
    private final VelocityChecker velocityChecker;
    private final GeoLocationChecker geoChecker;
    private final PostDataValidator postDataValidator;
    private final FraudDetectionConfig config;
    private final Executor signalAnalysisExecutor;
    private final MeterRegistry meterRegistry;

    public FraudDetector(
            FollowerAuthenticityChecker followerChecker,
            EngagementQualityChecker engagementChecker,
            VelocityChecker velocityChecker,
            GeoLocationChecker geoChecker,
            PostDataValidator postDataValidator,
            FraudDetectionConfig config,
            @Qualifier("signalAnalysisExecutor") Executor signalAnalysisExecutor,
            MeterRegistry meterRegistry) {
        this.followerChecker = followerChecker;
        this.engagementChecker = engagementChecker;
        this.velocityChecker = velocityChecker;
        this.geoChecker = geoChecker;
        this.postDataValidator = postDataValidator;
        this.config = config;
        this.signalAnalysisExecutor = signalAnalysisExecutor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Scores a campaign post for fraud risk
     *
     * @param postData post, followers and engagement to verify
     * @return complete fraud report with all four signal breakdowns
     * @throws com.qubicescrow.verification.exception.InvalidPostDataException if required fields are missing
     * @throws SignalAnalysisException if an analyzer fails
     */
    public FraudReport detect(PostData postData) {
        postDataValidator.validate(postData);

        Timer.Sample sample = Timer.start(meterRegistry);

        log.info("FRAUD_VERIFICATION_STARTED | postUrl={} | followers={} | comments={} | location={}",
                postData.getPostUrl(),
                postData.getFollowers().size(),
                postData.getEngagement().getCommentCount(),
                postData.getInfluencerLocation());

        CompletableFuture<FollowerAnalysisResult> followerFuture = CompletableFuture.supplyAsync(
                () -> followerChecker.analyze(postData.getFollowers()), signalAnalysisExecutor);
        CompletableFuture<EngagementAnalysisResult> engagementFuture = CompletableFuture.supplyAsync(
                () -> engagementChecker.analyze(postData.getEngagement()), signalAnalysisExecutor);
        CompletableFuture<VelocityAnalysisResult> velocityFuture = CompletableFuture.supplyAsync(
                () -> velocityChecker.analyze(postData.getEngagement(),
                        postData.getHistoricalAvgEngagement(),
                        postData.getPostTimestamp()), signalAnalysisExecutor);
        CompletableFuture<GeoAnalysisResult> geoFuture = CompletableFuture.supplyAsync(
                () -> geoChecker.analyze(postData.getFollowers(),
                        postData.getEngagement(),
                        postData.getInfluencerLocation()), signalAnalysisExecutor);

        try {
            CompletableFuture.allOf(followerFuture, engagementFuture, velocityFuture, geoFuture).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Signal analysis failed for post: {}", postData.getPostUrl(), cause);
            meterRegistry.counter("campaign.verification.error").increment();
            throw new SignalAnalysisException("Signal analysis failed: " + cause.getMessage(), cause);
        }

        FraudReport report = buildReport(
                followerFuture.join(), engagementFuture.join(), velocityFuture.join(), geoFuture.join());

        sample.stop(meterRegistry.timer("campaign.verification.duration"));
        recordMetrics(report);

        log.info("FRAUD_VERIFICATION_COMPLETED | postUrl={} | score={} | recommendation={} | confidence={} | flags={}",
                postData.getPostUrl(),
                String.format(Locale.ROOT, "%.2f", report.getOverallScore()),
                report.getRecommendation(),
                report.getConfidence(),
                report.getFraudFlags().size());

        return report;
    }

    /**
     * Thresholds and weights this detector scores with
     */
    public ThresholdSummary getThresholdSummary() {
        return ThresholdSummary.builder()
                .overallPassScore(config.getPassThreshold())
                .velocityAnomalyMax(config.getVelocityAnomalyThreshold())
                .minimumScores(config.getMinimumScores())
                .weights(config.getWeights())
                .build();
    }

    FraudReport buildReport(FollowerAnalysisResult followerResult,
                            EngagementAnalysisResult engagementResult,
                            VelocityAnalysisResult velocityResult,
                            GeoAnalysisResult geoResult) {

        Map<SignalType, SignalResult> results = new EnumMap<>(SignalType.class);
        results.put(SignalType.FOLLOWER_AUTHENTICITY, followerResult);
        results.put(SignalType.ENGAGEMENT_QUALITY, engagementResult);
        results.put(SignalType.VELOCITY_CHECK, velocityResult);
        results.put(SignalType.GEO_ALIGNMENT, geoResult);

        Map<SignalType, SignalBreakdown> breakdown = new EnumMap<>(SignalType.class);
        List<String> allFlags = new ArrayList<>();
        double weightedSum = 0;

        for (Map.Entry<SignalType, SignalResult> entry : results.entrySet()) {
            SignalType signal = entry.getKey();
            SignalResult result = entry.getValue();
            double weight = config.weightOf(signal);
            double minimum = config.minimumScoreOf(signal);

            weightedSum += result.getScore() * weight;
            allFlags.addAll(result.getFlags());

            breakdown.put(signal, SignalBreakdown.builder()
                    .score(result.getScore())
                    .weight(weight)
                    .weightedContribution(SignalScores.round(result.getScore() * weight))
                    .minimumScore(minimum)
                    .belowMinimum(result.getScore() < minimum)
                    .details(result)
                    .build());
        }

        // Pass/fail is decided on the reported score so the two never disagree
        double overallScore = SignalScores.round(SignalScores.clamp(weightedSum));
        double passThreshold = config.getPassThreshold();

        return FraudReport.builder()
                .overallScore(overallScore)
                .passThreshold(passThreshold)
                .passed(overallScore >= passThreshold)
                .recommendation(recommend(overallScore, allFlags.size()))
                .confidence(calculateConfidence(results.values()))
                .breakdown(Collections.unmodifiableMap(breakdown))
                .fraudFlags(List.copyOf(allFlags))
                .summary(generateSummary(overallScore, followerResult, engagementResult))
                .build();
    }

    Recommendation recommend(double score, int flagCount) {
        if (score >= config.getPassThreshold()) {
            if (flagCount == 0) {
                return Recommendation.APPROVED_FOR_PAYMENT;
            } else if (flagCount <= MINOR_CONCERN_FLAG_LIMIT) {
                return Recommendation.APPROVED_WITH_MINOR_CONCERNS;
            } else {
                return Recommendation.APPROVED_BUT_MONITOR;
            }
        } else if (score >= MANUAL_REVIEW_SCORE) {
            return Recommendation.MANUAL_REVIEW_RECOMMENDED;
        } else if (score >= HOLD_SCORE) {
            return Recommendation.HOLD_PAYMENT_PENDING_REVIEW;
        } else {
            return Recommendation.REJECT_PAYMENT_FRAUD_DETECTED;
        }
    }

    /**
     * Low spread between the signal scores means the signals agree, hence high confidence
     */
    ConfidenceLevel calculateConfidence(Collection<SignalResult> results) {
        double[] scores = results.stream().mapToDouble(SignalResult::getScore).toArray();
        double populationStdDev = new StandardDeviation(false).evaluate(scores);
        return ConfidenceLevel.fromStandardDeviation(populationStdDev);
    }

    String generateSummary(double overallScore, FollowerAnalysisResult followerResult,
                           EngagementAnalysisResult engagementResult) {
        if (overallScore >= 95) {
            return String.format(Locale.ROOT,
                    "Excellent authenticity score (%.1f/100). Campaign shows %d genuine followers "
                            + "with %d authentic interactions. All metrics within expected ranges.",
                    overallScore, followerResult.getRealCount(), engagementResult.getAuthenticCount());
        } else if (overallScore >= 80) {
            return String.format(Locale.ROOT,
                    "Good authenticity score (%.1f/100). Some quality concerns detected but overall legitimate. "
                            + "Manual review recommended before payment release.",
                    overallScore);
        } else if (overallScore >= 60) {
            return String.format(Locale.ROOT,
                    "Moderate authenticity score (%.1f/100). Detected %d potential bot followers "
                            + "and %d spam comments. Hold payment pending further investigation.",
                    overallScore, followerResult.getBotCount(), engagementResult.getSpamCount());
        } else {
            return String.format(Locale.ROOT,
                    "Low authenticity score (%.1f/100). Strong indicators of fraud: %d bot followers, "
                            + "%d spam comments. Payment should be blocked and refunded to brand.",
                    overallScore, followerResult.getBotCount(), engagementResult.getSpamCount());
        }
    }

    private void recordMetrics(FraudReport report) {
        meterRegistry.counter("campaign.verification.total",
                "recommendation", report.getRecommendation().name()).increment();
        meterRegistry.summary("campaign.verification.score").record(report.getOverallScore());
    }
}
