package com.unifiedcalendar.backend.entry.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum SourceKind {
    CALENDAR("cal"),
    EMAIL("email");

    // Prefix of entry identifiers derived from this kind of source
    private final String idPrefix;
}
