package com.unifiedcalendar.backend.entry.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Where a {@link CalendarEntry} came from. Exactly one of the two variants;
 * consumers switch on {@link #getKind()} and cast.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CalendarSource.class, name = "calendar"),
        @JsonSubTypes.Type(value = EmailSource.class, name = "email")
})
public abstract sealed class EntrySource permits CalendarSource, EmailSource {

    @JsonIgnore
    public abstract SourceKind getKind();
}
