package com.unifiedcalendar.backend.startup;

import com.unifiedcalendar.backend.account.AccountService;
import com.unifiedcalendar.backend.config.ScanConfig;
import com.unifiedcalendar.backend.scan.AlreadyScanningException;
import com.unifiedcalendar.backend.scan.NoAccountsException;
import com.unifiedcalendar.backend.scan.ScanOptions;
import com.unifiedcalendar.backend.scan.ScanService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AutoStartupService {

    private final AccountService accountService;
    private final ScanService scanService;
    private final ScanConfig scanConfig;

    private volatile boolean startupComplete = false;

    /**
     * Cleans up duplicate accounts left behind by earlier runs
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("🚀 APPLICATION READY - checking configured accounts");
        try {
            int removed = accountService.deduplicateByEmail();
            if (removed > 0) {
                log.info("🧹 Removed {} duplicate account(s)", removed);
            }
        } catch (Exception e) {
            log.error("❌ Account cleanup failed: {}", e.getMessage(), e);
        }
        startupComplete = true;
        log.info("📅 {} account(s) configured, scheduled rescans {}",
                accountService.getAllAccounts().size(),
                scanConfig.getSchedule().isEnabled() ? "every " + scanConfig.getSchedule().getInterval() : "disabled");
    }

    /**
     * Periodic rescan of all accounts
     */
    @Scheduled(fixedRateString = "${scan.schedule.interval:PT4H}",
            initialDelayString = "${scan.schedule.interval:PT4H}")
    public void scheduledScan() {
        if (!scanConfig.getSchedule().isEnabled()) {
            return;
        }
        if (!startupComplete) {
            log.info("⏳ Skipping scheduled scan - startup still in progress");
            return;
        }

        try {
            log.info("⏰ SCHEDULED SCAN STARTED");
            scanService.startScan(new ScanOptions(scanConfig.getDefaultLookbackDays()));
        } catch (AlreadyScanningException e) {
            log.info("⏭️ Skipping scheduled scan - a scan is already in progress");
        } catch (NoAccountsException e) {
            log.debug("Skipping scheduled scan - no accounts configured");
        } catch (Exception e) {
            log.error("❌ Scheduled scan failed to start: {}", e.getMessage(), e);
        }
    }
}
