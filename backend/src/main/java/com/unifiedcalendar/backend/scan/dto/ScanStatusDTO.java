package com.unifiedcalendar.backend.scan.dto;

import com.unifiedcalendar.backend.scan.ScanPhase;
import com.unifiedcalendar.backend.scan.ScanStatus;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time copy of the scan state handed to callers and observers
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanStatusDTO {
    private ScanStatus status;
    private ScanPhase phase;
    private Integer current;
    private Integer total;
    private String currentItem;
    private Integer accountsTotal;
    private Integer accountsDone;
    private Integer entriesSaved;
    private Integer lookbackDays;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private String error;

    public static ScanStatusDTO idle() {
        return ScanStatusDTO.builder().status(ScanStatus.IDLE).build();
    }
}
