package com.unifiedcalendar.backend.classifier;

import com.unifiedcalendar.backend.config.ClassifierConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * First classifier tier: weighted lexical signals over subject, snippet and sender.
 */
@Component
public class HeuristicScorer {

    private static final Pattern WITH_PERSON = Pattern.compile("\\bwith\\s+[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?");

    private final ClassifierConfig config;

    public HeuristicScorer(ClassifierConfig config) {
        this.config = config;
    }

    public HeuristicScore score(String subject, String snippet, String from) {
        String safeSubject = subject == null ? "" : subject;
        String safeSnippet = snippet == null ? "" : snippet;
        String text = (safeSubject + " " + safeSnippet).toLowerCase(Locale.ROOT);

        int score = 0;
        List<String> signals = new ArrayList<>();

        String keyword = firstWordMatch(text, config.getSchedulingKeywords());
        if (keyword != null) {
            score += config.getSchedulingWeight();
            signals.add("scheduling:" + keyword);
        }

        String platform = firstSubstringMatch(text, config.getPlatformKeywords());
        if (platform != null) {
            score += config.getPlatformWeight();
            signals.add("platform:" + platform);
        }

        if (DateTimePatterns.containsTime(safeSubject)) {
            score += config.getSubjectTimeWeight();
            signals.add("subject-time");
        }

        if (DateTimePatterns.containsDate(safeSubject)) {
            score += config.getSubjectDateWeight();
            signals.add("subject-date");
        }

        if (WITH_PERSON.matcher(safeSubject).find() || WITH_PERSON.matcher(safeSnippet).find()) {
            score += config.getWithPersonWeight();
            signals.add("with-person");
        }

        boolean automated = isAutomatedSender(from);
        if (automated) {
            score -= config.getAutomatedSenderPenalty();
            signals.add("automated-sender");
        }

        return new HeuristicScore(score, List.copyOf(signals), automated);
    }

    boolean isAutomatedSender(String from) {
        if (from == null || from.isBlank()) {
            return false;
        }
        return firstSubstringMatch(from.toLowerCase(Locale.ROOT), config.getAutomatedSenderPatterns()) != null;
    }

    private static String firstWordMatch(String text, List<String> words) {
        for (String word : words) {
            Pattern pattern = Pattern.compile("\\b" + Pattern.quote(word.toLowerCase(Locale.ROOT)) + "\\b");
            if (pattern.matcher(text).find()) {
                return word;
            }
        }
        return null;
    }

    private static String firstSubstringMatch(String text, List<String> fragments) {
        for (String fragment : fragments) {
            if (text.contains(fragment.toLowerCase(Locale.ROOT))) {
                return fragment;
            }
        }
        return null;
    }
}
