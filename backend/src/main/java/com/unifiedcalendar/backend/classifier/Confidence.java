package com.unifiedcalendar.backend.classifier;

public enum Confidence {
    LOW,
    MEDIUM,
    HIGH
}
