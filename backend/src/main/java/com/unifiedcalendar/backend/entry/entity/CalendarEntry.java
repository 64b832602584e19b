package com.unifiedcalendar.backend.entry.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "calendar_entries", indexes = {
        @Index(name = "idx_entry_account_kind", columnList = "accountId,sourceKind"),
        @Index(name = "idx_entry_start", columnList = "startTime")
})
public class CalendarEntry {
    // Derived from (account, source kind, natural key); stable across rescans
    @Id
    @Column(length = 128)
    private String id;

    @Column(nullable = false, length = 64)
    private String accountId;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(nullable = false)
    private LocalDateTime startTime;

    @Column(nullable = false)
    private LocalDateTime endTime;

    @Column(nullable = false)
    @Builder.Default
    private Boolean allDay = false;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EntryStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SourceKind sourceKind;

    @Convert(converter = EntrySourceConverter.class)
    @Column(columnDefinition = "TEXT")
    private EntrySource source;

    // Ids of entries whose interval overlaps this one, kept symmetric
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "entry_conflicts", joinColumns = @JoinColumn(name = "entry_id"))
    @OrderColumn(name = "position")
    @Column(name = "conflicting_entry_id", length = 128)
    @Builder.Default
    private List<String> conflicts = new ArrayList<>();

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    void syncSourceKind() {
        if (source != null) {
            sourceKind = source.getKind();
        }
    }
}
