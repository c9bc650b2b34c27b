package com.qubicescrow.verification.service.signal;

import com.qubicescrow.verification.config.FraudDetectionConfig;
import com.qubicescrow.verification.domain.CommentRecord;
import com.qubicescrow.verification.domain.EngagementBundle;
import com.qubicescrow.verification.dto.EngagementAnalysisResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Engagement Quality Check
 *
 * Sorts comments into spam, generic and authentic buckets (first match wins, in that
 * order), penalizes duplicated comment text and looks for bot comment patterns:
 * repeat commenters, bot-like usernames and bursts of comments in a few minutes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngagementQualityChecker {

    static final String NO_COMMENTS_FLAG = "No comments to analyze";

    private static final double NEUTRAL_SCORE = 50;
    private static final double GENERIC_CREDIT = 0.4;
    private static final double DUPLICATE_RATIO_LIMIT = 0.1;
    private static final double MAX_DUPLICATE_PENALTY = 20;
    private static final double DUPLICATE_PENALTY_FACTOR = 50;
    private static final double SPAM_FLAG_RATIO = 0.3;
    private static final double GENERIC_FLAG_RATIO = 0.4;

    private static final int MIN_COMMENT_LENGTH = 10;
    private static final int MAX_GENERIC_WORDS = 2;
    private static final int MIN_WORD_CHARACTERS = 3;

    private static final double MULTI_COMMENTER_RATIO = 0.1;
    private static final int MAX_COMMENTS_PER_USER = 2;
    private static final double BOT_COMMENTER_RATIO = 0.2;
    private static final int TIMING_MIN_SAMPLE = 10;
    private static final int TIMING_MIN_COMMENTS = 20;
    private static final double TIMING_WINDOW_MINUTES = 5;

    private static final List<String> PROMOTIONAL_KEYWORDS = List.of(
            "check my bio", "follow me", "dm me", "link in bio",
            "click here", "visit my", "free followers"
    );

    private static final Pattern NON_WORD_CHARACTERS =
            Pattern.compile("[^\\p{L}\\p{N}_\\s]", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<Pattern> GENERIC_PATTERNS = List.of(
            Pattern.compile("^(nice|cool|awesome|great|amazing|love it|perfect)!*$"),
            Pattern.compile("^(this is|so) (nice|cool|awesome|great|amazing)!*$"),
            Pattern.compile("^love (this|it)!*$")
    );

    private static final Pattern BOT_COMMENTER_USERNAME = Pattern.compile("^user\\d{5,}$");

    private final FraudDetectionConfig config;

    public EngagementAnalysisResult analyze(EngagementBundle engagement) {
        List<CommentRecord> comments = engagement.getComments();

        if (comments.isEmpty()) {
            return EngagementAnalysisResult.builder()
                    .score(NEUTRAL_SCORE)
                    .flags(List.of(NO_COMMENTS_FLAG))
                    .build();
        }

        int total = comments.size();
        int spamCount = 0;
        int genericCount = 0;

        for (CommentRecord comment : comments) {
            String text = comment.getText().toLowerCase(Locale.ROOT).strip();
            if (isSpam(text)) {
                spamCount++;
            } else if (isGeneric(text)) {
                genericCount++;
            }
        }

        int authenticCount = total - spamCount - genericCount;
        int duplicateCount = countDuplicates(comments);

        List<String> flags = new ArrayList<>();
        double weightedScore = (authenticCount + genericCount * GENERIC_CREDIT) / total * 100;

        if (duplicateCount > total * DUPLICATE_RATIO_LIMIT) {
            double duplicateRatio = (double) duplicateCount / total;
            weightedScore -= Math.min(MAX_DUPLICATE_PENALTY, duplicateRatio * DUPLICATE_PENALTY_FACTOR);
            flags.add(String.format(Locale.ROOT, "High duplicate comments: %d (%.1f%%)", duplicateCount, duplicateRatio * 100));
        }

        if (spamCount > total * SPAM_FLAG_RATIO) {
            flags.add(String.format(Locale.ROOT, "High spam presence: %d comments (%.1f%%)",
                    spamCount, SignalScores.percentage(spamCount, total)));
        }
        if (genericCount > total * GENERIC_FLAG_RATIO) {
            flags.add(String.format(Locale.ROOT, "Many generic comments: %d (%.1f%%)",
                    genericCount, SignalScores.percentage(genericCount, total)));
        }

        flags.addAll(checkBotPatterns(comments));

        log.info("Engagement analysis: {} authentic, {} generic, {} spam", authenticCount, genericCount, spamCount);

        return EngagementAnalysisResult.builder()
                .score(SignalScores.round(SignalScores.clamp(weightedScore)))
                .authenticCount(authenticCount)
                .spamCount(spamCount)
                .genericCount(genericCount)
                .duplicateCount(duplicateCount)
                .totalAnalyzed(total)
                .qualityPercentage(SignalScores.round(SignalScores.percentage(authenticCount, total)))
                .flags(List.copyOf(flags))
                .build();
    }

    /**
     * @param text lowercased, trimmed comment text
     */
    boolean isSpam(String text) {
        if (config.getSpamPhrases().stream().anyMatch(text::contains)) {
            return true;
        }
        if (PROMOTIONAL_KEYWORDS.stream().anyMatch(text::contains)) {
            return true;
        }

        // Emoji or punctuation only
        String wordsOnly = NON_WORD_CHARACTERS.matcher(text).replaceAll("").strip();
        return codePointLength(wordsOnly) < MIN_WORD_CHARACTERS && codePointLength(text) > MIN_WORD_CHARACTERS;
    }

    /**
     * @param text lowercased, trimmed comment text
     */
    boolean isGeneric(String text) {
        if (codePointLength(text) < MIN_COMMENT_LENGTH) {
            return true;
        }
        if (wordCount(text) <= MAX_GENERIC_WORDS) {
            return true;
        }
        return GENERIC_PATTERNS.stream().anyMatch(p -> p.matcher(text).matches());
    }

    int countDuplicates(List<CommentRecord> comments) {
        Map<String, Integer> occurrences = new LinkedHashMap<>();
        for (CommentRecord comment : comments) {
            occurrences.merge(comment.getText().toLowerCase(Locale.ROOT), 1, Integer::sum);
        }
        return occurrences.values().stream()
                .filter(count -> count > 1)
                .mapToInt(count -> count - 1)
                .sum();
    }

    List<String> checkBotPatterns(List<CommentRecord> comments) {
        List<String> flags = new ArrayList<>();

        // Repeat commenters
        Map<String, Integer> commentsPerUser = new LinkedHashMap<>();
        for (CommentRecord comment : comments) {
            commentsPerUser.merge(comment.getUsername(), 1, Integer::sum);
        }
        long multiCommenters = commentsPerUser.values().stream()
                .filter(count -> count > MAX_COMMENTS_PER_USER)
                .count();
        if (multiCommenters > commentsPerUser.size() * MULTI_COMMENTER_RATIO) {
            flags.add(String.format(Locale.ROOT, "%d users posted multiple comments (bot behavior)", multiCommenters));
        }

        // Bot-like usernames
        long botCommenters = comments.stream()
                .filter(c -> BOT_COMMENTER_USERNAME.matcher(c.getUsername()).matches())
                .count();
        if (botCommenters > comments.size() * BOT_COMMENTER_RATIO) {
            flags.add(String.format(Locale.ROOT, "%d comments from bot-like usernames", botCommenters));
        }

        // Comments packed into a short window
        if (comments.size() >= TIMING_MIN_SAMPLE) {
            List<Instant> timestamps = comments.stream()
                    .map(CommentRecord::getTimestamp)
                    .sorted()
                    .toList();
            double spanMinutes = Duration.between(timestamps.get(0), timestamps.get(timestamps.size() - 1))
                    .toMillis() / 60_000.0;
            if (spanMinutes < TIMING_WINDOW_MINUTES && comments.size() > TIMING_MIN_COMMENTS) {
                flags.add(String.format(Locale.ROOT, "Suspicious timing: %d comments in %.1f minutes", comments.size(), spanMinutes));
            }
        }

        return flags;
    }

    private static int wordCount(String text) {
        return text.isEmpty() ? 0 : WHITESPACE.split(text).length;
    }

    private static int codePointLength(String text) {
        return text.codePointCount(0, text.length());
    }
}
