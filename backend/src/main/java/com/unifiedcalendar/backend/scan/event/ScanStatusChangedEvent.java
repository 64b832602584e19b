package com.unifiedcalendar.backend.scan.event;

import com.unifiedcalendar.backend.scan.dto.ScanStatusDTO;
import lombok.Value;

@Value
public class ScanStatusChangedEvent {
    ScanStatusDTO status;
}
