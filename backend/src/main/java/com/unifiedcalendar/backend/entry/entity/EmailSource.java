package com.unifiedcalendar.backend.entry.entity;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public final class EmailSource extends EntrySource {
    private String subject;
    private String snippet;
    private String threadId;
    private LocalDateTime emailTime;
    private ClassifierEvidence classifierEvidence;

    @Override
    public SourceKind getKind() {
        return SourceKind.EMAIL;
    }
}
