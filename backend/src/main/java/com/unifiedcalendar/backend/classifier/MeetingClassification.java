package com.unifiedcalendar.backend.classifier;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Verdict for a single email. Never persisted; a positive verdict is turned
 * into a tentative entry by the normalizer.
 */
@Value
@Builder
public class MeetingClassification {

    boolean meeting;
    String title;
    LocalDate date;
    LocalDate endDate;
    LocalTime time;
    Integer durationMinutes;
    Confidence confidence;
    ClassificationTier tier;
    int score;
    List<String> signals;
    String dateSpan;
    String timeSpan;
    String oracleVerdict;
    String rejectionReason;

    public static MeetingClassification rejected(int score, List<String> signals, String reason) {
        return MeetingClassification.builder()
                .meeting(false)
                .confidence(Confidence.LOW)
                .score(score)
                .signals(signals)
                .rejectionReason(reason)
                .build();
    }

    public boolean isMultiDay() {
        return endDate != null && !endDate.equals(date);
    }
}
