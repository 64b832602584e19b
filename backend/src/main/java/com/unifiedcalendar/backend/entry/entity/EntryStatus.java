package com.unifiedcalendar.backend.entry.entity;

public enum EntryStatus {
    // Read straight from a calendar, treated as ground truth
    CONFIRMED,
    // Inferred from email content, may be wrong
    TENTATIVE
}
