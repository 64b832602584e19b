package com.unifiedcalendar.backend.classifier;

import com.unifiedcalendar.backend.classifier.ExtractedDateTime.DateCandidate;
import com.unifiedcalendar.backend.config.ClassifierConfig;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides whether an email denotes a scheduled event.
 *
 * <p>The heuristic score gates everything: below the meeting threshold the email
 * is rejected and the oracle is never asked. Between the meeting and
 * high-confidence thresholds the oracle (when available) gets a yes/no question.
 * Whatever tier accepts the email, the date and time are read from the literal
 * text only, never from the oracle's answer.
 */
@Service
@Slf4j
public class MeetingClassifier {

    private static final Pattern REPLY_PREFIX = Pattern.compile("^(?:\\s*(?:re|fwd?|fw)\\s*:\\s*)+",
            Pattern.CASE_INSENSITIVE);

    private final HeuristicScorer scorer;
    private final InferenceOracle oracle;
    private final ClassifierConfig config;
    private final Clock clock;

    public MeetingClassifier(HeuristicScorer scorer, InferenceOracle oracle, ClassifierConfig config, Clock clock) {
        this.scorer = scorer;
        this.oracle = oracle;
        this.config = config;
        this.clock = clock;
    }

    public MeetingClassification classify(String subject, String snippet, String from, LocalDateTime emailTime) {
        HeuristicScore heuristic = scorer.score(subject, snippet, from);
        int score = heuristic.getScore();
        List<String> signals = heuristic.getSignals();

        if (score < config.getMeetingThreshold()) {
            return MeetingClassification.rejected(score, signals, "score " + score + " below threshold");
        }

        Confidence confidence;
        ClassificationTier tier = ClassificationTier.HEURISTIC;
        String verdict = null;

        if (score >= config.getHighConfidenceThreshold()) {
            confidence = Confidence.HIGH;
        } else {
            confidence = Confidence.MEDIUM;
            if (oracle.isAvailable()) {
                verdict = askIsMeeting(subject, snippet);
                if (isYes(verdict)) {
                    tier = ClassificationTier.ORACLE;
                } else if (isNo(verdict)) {
                    return MeetingClassification.rejected(score, signals, "oracle answered no");
                }
            }
        }

        String text = (subject == null ? "" : subject) + "\n" + (snippet == null ? "" : snippet);
        LocalDate reference = emailTime != null ? emailTime.toLocalDate() : LocalDate.now(clock);
        ExtractedDateTime extracted = new DateTimeExtractor(LocalDate.now(clock).getYear(), reference).extract(text);

        if (extracted.isFabricatedTime()) {
            return MeetingClassification.rejected(score, signals,
                    "time '" + extracted.getTimeSpan() + "' is not on a 5 minute boundary");
        }
        if (!extracted.hasDate()) {
            return MeetingClassification.rejected(score, signals, "no literal date in text");
        }

        extracted = verifyStartDate(text, extracted);

        Integer duration = extracted.getDurationMinutes() != null
                ? extracted.getDurationMinutes()
                : Integer.valueOf(config.getDefaultDurationMinutes());

        return MeetingClassification.builder()
                .meeting(true)
                .title(cleanTitle(subject))
                .date(extracted.getDate())
                .endDate(extracted.getEndDate())
                .time(extracted.getTime())
                .durationMinutes(extracted.getTime() != null ? duration : null)
                .confidence(confidence)
                .tier(tier)
                .score(score)
                .signals(signals)
                .dateSpan(extracted.getDateSpan())
                .timeSpan(extracted.getTimeSpan())
                .oracleVerdict(verdict)
                .build();
    }

    private String askIsMeeting(String subject, String snippet) {
        String question = "Email: \"Subject: " + nullToEmpty(subject) + ". Snippet: " + nullToEmpty(snippet) + "\"\n"
                + "Is this email about a specific scheduled event? Answer YES or NO.";
        try {
            return oracle.ask(question);
        } catch (OracleUnavailableException e) {
            log.debug("Oracle unavailable, using heuristic verdict: {}", e.getMessage());
            return null;
        }
    }

    /**
     * When the text holds more than one date, asks the oracle which one is the start.
     * A different answer is only taken if the chosen span is literally in the text.
     */
    private ExtractedDateTime verifyStartDate(String text, ExtractedDateTime extracted) {
        if (extracted.getAlternatives().isEmpty() || !oracle.isAvailable()) {
            return extracted;
        }
        DateCandidate alternative = extracted.getAlternatives().get(0);
        String question = "Text: \"" + text.replace('\n', ' ') + "\"\n"
                + "Which date is when the event starts? A: \"" + extracted.getDateSpan()
                + "\" B: \"" + alternative.getSpan() + "\". Answer A or B.";
        String answer;
        try {
            answer = oracle.ask(question);
        } catch (OracleUnavailableException e) {
            log.debug("Oracle unavailable for start date check: {}", e.getMessage());
            return extracted;
        }

        String normalized = answer == null ? "" : answer.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("B") && text.contains(alternative.getSpan())) {
            log.debug("Start date moved from '{}' to '{}'", extracted.getDateSpan(), alternative.getSpan());
            return extracted.toBuilder()
                    .date(alternative.getDate())
                    .dateSpan(alternative.getSpan())
                    .build();
        }
        return extracted;
    }

    static String cleanTitle(String subject) {
        if (subject == null || subject.isBlank()) {
            return "Meeting";
        }
        String cleaned = REPLY_PREFIX.matcher(subject).replaceFirst("").trim();
        return cleaned.isEmpty() ? "Meeting" : cleaned;
    }

    private static boolean isYes(String verdict) {
        return verdict != null && verdict.trim().toUpperCase(Locale.ROOT).startsWith("YES");
    }

    private static boolean isNo(String verdict) {
        return verdict != null && verdict.trim().toUpperCase(Locale.ROOT).startsWith("NO");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
