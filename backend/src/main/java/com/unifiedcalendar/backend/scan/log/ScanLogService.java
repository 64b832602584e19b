package com.unifiedcalendar.backend.scan.log;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.unifiedcalendar.backend.config.ScanConfig;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Diagnostic records of what each scan did per account. Writing a record never
 * fails the scan.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScanLogService {

    private final ScanLogRepository scanLogRepository;
    private final ObjectMapper objectMapper;
    private final ScanConfig scanConfig;

    public void record(String accountId, ScanAction action, Map<String, ?> details) {
        try {
            scanLogRepository.save(ScanLog.builder()
                    .accountId(accountId)
                    .action(action)
                    .details(toJson(details))
                    .build());
        } catch (RuntimeException e) {
            log.warn("Could not write scan log {} for account {}: {}", action.code(), accountId, e.getMessage());
        }
    }

    public List<ScanLog> recent(int limit) {
        return scanLogRepository.findAllByOrderByIdDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    public List<ScanLog> recentForAccount(String accountId, int limit) {
        return scanLogRepository.findByAccountIdOrderByIdDesc(accountId, PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Deletes everything older than the newest {@code scan.log-retention} rows.
     */
    public long prune() {
        int keep = scanConfig.getLogRetention();
        List<Long> kept = scanLogRepository.findIdsNewestFirst(PageRequest.of(0, keep));
        if (kept.size() < keep) {
            return 0;
        }
        long oldestKept = kept.get(kept.size() - 1);
        long deleted = scanLogRepository.deleteByIdLessThan(oldestKept);
        if (deleted > 0) {
            log.debug("Pruned {} scan log rows", deleted);
        }
        return deleted;
    }

    private String toJson(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            return String.valueOf(details);
        }
    }
}
