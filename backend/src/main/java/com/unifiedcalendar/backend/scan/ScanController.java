package com.unifiedcalendar.backend.scan;

import com.unifiedcalendar.backend.config.ScanConfig;
import com.unifiedcalendar.backend.scan.dto.ScanStatusDTO;
import com.unifiedcalendar.backend.scan.event.ScanEventBroadcaster;
import com.unifiedcalendar.backend.scan.log.ScanLog;
import com.unifiedcalendar.backend.scan.log.ScanLogService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST controller for starting, pausing, cancelling and watching scans
 */
@RestController
@RequestMapping("/api/scan")
@RequiredArgsConstructor
@Slf4j
@Validated
public class ScanController {

    private final ScanService scanService;
    private final ScanLogService scanLogService;
    private final ScanEventBroadcaster broadcaster;
    private final ScanConfig scanConfig;

    /**
     * Start a scan over all configured accounts. Returns immediately.
     */
    @PostMapping("/start")
    public ResponseEntity<?> startScan(
            @RequestParam(required = false) @Min(1) @Max(365) Integer lookbackDays) {

        int days = lookbackDays != null ? lookbackDays : scanConfig.getDefaultLookbackDays();
        try {
            log.info("Scan requested with lookback {} days", days);
            ScanStatusDTO status = scanService.startScan(new ScanOptions(days));

            return ResponseEntity.accepted().body(Map.of(
                    "message", "Scan started",
                    "status", status,
                    "checkStatusAt", "/api/scan/status"
            ));

        } catch (AlreadyScanningException e) {
            return error(HttpStatus.CONFLICT, "Scan already in progress", e);
        } catch (NoAccountsException e) {
            return error(HttpStatus.BAD_REQUEST, "No accounts configured", e);
        } catch (Exception e) {
            log.error("Error starting scan", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to start scan", e);
        }
    }

    @PostMapping("/pause")
    public ResponseEntity<?> pauseScan() {
        if (!scanService.pauseScan()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "error", "No scan to pause",
                    "timestamp", LocalDateTime.now()
            ));
        }
        return ResponseEntity.ok(Map.of(
                "paused", true,
                "status", scanService.getScanStatus()
        ));
    }

    @PostMapping("/cancel")
    public ResponseEntity<?> cancelScan() {
        boolean cancelled = scanService.cancelScan();
        return ResponseEntity.ok(Map.of(
                "cancelled", cancelled,
                "status", scanService.getScanStatus()
        ));
    }

    @GetMapping("/status")
    public ResponseEntity<ScanStatusDTO> getStatus() {
        return ResponseEntity.ok(scanService.getScanStatus());
    }

    /**
     * Most recent scan log records, newest first
     */
    @GetMapping("/logs")
    public ResponseEntity<?> getLogs(
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(required = false) String accountId) {
        try {
            List<ScanLog> logs = accountId == null || accountId.isBlank()
                    ? scanLogService.recent(limit)
                    : scanLogService.recentForAccount(accountId, limit);
            return ResponseEntity.ok(logs);
        } catch (Exception e) {
            log.error("Error reading scan logs", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read scan logs", e);
        }
    }

    /**
     * Server-Sent-Event stream of scan-status, new-entry and scan-complete events
     */
    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return broadcaster.subscribe();
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, Exception e) {
        return ResponseEntity.status(status).body(Map.of(
                "error", error,
                "message", String.valueOf(e.getMessage()),
                "timestamp", LocalDateTime.now()
        ));
    }
}
