package com.unifiedcalendar.backend.entry.entity;

import com.unifiedcalendar.backend.classifier.ClassificationTier;
import com.unifiedcalendar.backend.classifier.Confidence;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Why an email was turned into a tentative entry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifierEvidence {
    private ClassificationTier tier;
    private int score;
    private List<String> signals;
    private Confidence confidence;
    // Literal text that placed the entry in time
    private String dateSpan;
    private String timeSpan;
    private String oracleVerdict;
}
