package com.unifiedcalendar.backend.entry.normalize;

import com.unifiedcalendar.backend.entry.entity.SourceKind;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import org.springframework.util.DigestUtils;

/**
 * Entry identifiers. The id is a pure function of (account, source kind, natural key),
 * so a rescan of the same event overwrites the stored row.
 */
public final class EntryIdentity {

    private EntryIdentity() {
    }

    public static String entryId(String accountId, SourceKind kind, String naturalKey) {
        String material = accountId + "|" + kind.name() + "|" + naturalKey;
        String digest = DigestUtils.md5DigestAsHex(material.getBytes(StandardCharsets.UTF_8));
        return kind.getIdPrefix() + "-" + digest;
    }

    /** Natural key for calendar events that carry no native identifier. */
    public static String titleAndStart(String title, LocalDateTime start) {
        return (title == null ? "" : title.trim()) + "|" + start;
    }
}
