package com.unifiedcalendar.backend.entry;

import com.unifiedcalendar.backend.entry.entity.CalendarEntry;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/entries")
@RequiredArgsConstructor
@Slf4j
public class EntryController {

    private final EntryService entryService;

    /**
     * Entries in a time range, sorted by start
     */
    @GetMapping
    public ResponseEntity<?> getEntries(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end) {
        try {
            List<CalendarEntry> entries = entryService.getEntries(start, end);
            return ResponseEntity.ok(entries);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Invalid range",
                    "message", e.getMessage(),
                    "timestamp", LocalDateTime.now()
            ));
        } catch (Exception e) {
            log.error("Error reading entries between {} and {}", start, end, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                    "error", "Failed to read entries",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", LocalDateTime.now()
            ));
        }
    }

    @GetMapping("/all")
    public ResponseEntity<?> getAllEntries() {
        try {
            return ResponseEntity.ok(entryService.getAllEntries());
        } catch (Exception e) {
            log.error("Error reading entries", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                    "error", "Failed to read entries",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", LocalDateTime.now()
            ));
        }
    }

    @DeleteMapping
    public ResponseEntity<?> clearAll() {
        try {
            long deleted = entryService.clearAll();
            return ResponseEntity.ok(Map.of(
                    "message", "All entries cleared",
                    "deleted", deleted
            ));
        } catch (Exception e) {
            log.error("Error clearing entries", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                    "error", "Failed to clear entries",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", LocalDateTime.now()
            ));
        }
    }
}
