package com.unifiedcalendar.backend.classifier;

/**
 * Which tier of the classifier accepted a candidate
 */
public enum ClassificationTier {
    HEURISTIC,
    ORACLE
}
