package com.unifiedcalendar.backend.scan;

import com.unifiedcalendar.backend.account.Account;
import com.unifiedcalendar.backend.account.AccountRepository;
import com.unifiedcalendar.backend.conflict.ConflictService;
import com.unifiedcalendar.backend.scan.dto.ScanStatusDTO;
import com.unifiedcalendar.backend.scan.event.ScanEventPublisher;
import com.unifiedcalendar.backend.scan.log.ScanAction;
import com.unifiedcalendar.backend.scan.log.ScanLogService;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives scans: accounts strictly in order, calendar phase then email phase for each,
 * then one conflict pass over every stored entry.
 *
 * <p>A fault inside one account's phases is logged against that account and the scan
 * moves on. Only a fault in the driver itself ends the scan in {@link ScanStatus#ERROR}.
 * Pause is recorded for observers but does not hold the driver back.
 *
 * <p>Conflict lists are recomputed however the scan ends, because the phases
 * re-create entries with empty lists.
 */
@Service
@Slf4j
public class ScanService {

    private final ScanState scanState;
    private final AccountRepository accountRepository;
    private final CalendarPhase calendarPhase;
    private final EmailPhase emailPhase;
    private final ConflictService conflictService;
    private final ScanLogService scanLogService;
    private final ScanEventPublisher events;
    private final Clock clock;
    private final Executor scanTaskExecutor;

    private volatile CancellationToken currentToken;

    public ScanService(ScanState scanState,
                       AccountRepository accountRepository,
                       CalendarPhase calendarPhase,
                       EmailPhase emailPhase,
                       ConflictService conflictService,
                       ScanLogService scanLogService,
                       ScanEventPublisher events,
                       Clock clock,
                       @Qualifier("scanTaskExecutor") Executor scanTaskExecutor) {
        this.scanState = scanState;
        this.accountRepository = accountRepository;
        this.calendarPhase = calendarPhase;
        this.emailPhase = emailPhase;
        this.conflictService = conflictService;
        this.scanLogService = scanLogService;
        this.events = events;
        this.clock = clock;
        this.scanTaskExecutor = scanTaskExecutor;
    }

    /**
     * Starts a scan over every configured account, in creation order.
     */
    public ScanStatusDTO startScan(ScanOptions options) {
        if (scanState.isRunning()) {
            throw new AlreadyScanningException();
        }
        return startScan(accountRepository.findAllByOrderByCreatedAtAsc(), options);
    }

    /**
     * Claims the scan slot and hands the driver to the scan executor.
     *
     * @throws AlreadyScanningException if a scan driver is still running; the state is left as it was
     * @throws NoAccountsException if {@code accounts} is empty
     */
    public ScanStatusDTO startScan(List<Account> accounts, ScanOptions options) {
        if (scanState.isRunning()) {
            throw new AlreadyScanningException();
        }
        if (accounts == null || accounts.isEmpty()) {
            throw new NoAccountsException();
        }
        if (!scanState.tryBegin(accounts.size(), options.getLookbackDays())) {
            throw new AlreadyScanningException();
        }

        CancellationToken token = new CancellationToken();
        currentToken = token;
        ScanContext ctx = new ScanContext(scanState, token, options);
        List<Account> snapshot = List.copyOf(accounts);
        events.statusChanged();

        try {
            scanTaskExecutor.execute(() -> runScan(snapshot, ctx));
        } catch (RejectedExecutionException e) {
            log.error("Scan executor rejected the scan: {}", e.getMessage());
            scanState.fail("Scan could not be scheduled");
            scanState.release();
            events.statusChanged();
            throw new ScanException("Scan could not be scheduled: " + e.getMessage());
        }
        return scanState.snapshot();
    }

    /**
     * @return false if there was no scan in {@code SCANNING} to pause
     */
    public boolean pauseScan() {
        boolean paused = scanState.pause();
        if (paused) {
            log.info("⏸️ Scan paused (advisory; the running scan continues)");
            events.statusChanged();
        }
        return paused;
    }

    /**
     * Raises the cancellation flag. The driver stops after the item it is working on.
     *
     * @return false if no scan was running
     */
    public boolean cancelScan() {
        CancellationToken token = currentToken;
        if (token != null) {
            token.cancel();
        }
        boolean cancelled = scanState.cancel();
        if (cancelled) {
            log.info("🛑 Scan cancellation requested");
            events.statusChanged();
        }
        return cancelled;
    }

    public ScanStatusDTO getScanStatus() {
        return scanState.snapshot();
    }

    void runScan(List<Account> accounts, ScanContext ctx) {
        log.info("🚀 Scan started over {} account(s), lookback {} days",
                accounts.size(), ctx.getOptions().getLookbackDays());
        boolean conflictsFresh = false;
        try {
            for (Account account : accounts) {
                if (ctx.isCancelled()) {
                    break;
                }
                scanAccount(account, ctx);
            }

            if (ctx.isCancelled()) {
                scanState.cancelled();
                log.info("🛑 Scan cancelled after {} entries", scanState.getEntriesSaved());
                return;
            }

            scanState.enterPhase(ScanPhase.ANALYZING, "Detecting conflicts");
            events.statusChanged();
            int pairs = conflictService.refresh();
            conflictsFresh = true;

            int saved = scanState.getEntriesSaved();
            if (!scanState.complete()) {
                scanState.cancelled();
                log.info("🛑 Scan cancelled while detecting conflicts");
                return;
            }
            scanLogService.record(null, ScanAction.SCAN_COMPLETE,
                    Map.of("entries", saved, "accounts", accounts.size(), "conflictingPairs", pairs));
            events.completed(saved, accounts.size(), pairs);
        } catch (RuntimeException e) {
            log.error("❌ Scan failed: {}", e.getMessage(), e);
            scanState.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            scanLogService.record(null, ScanAction.SCAN_ERROR, Map.of("error", String.valueOf(e.getMessage())));
        } finally {
            if (!conflictsFresh) {
                refreshConflictsAfterEarlyStop();
            }
            scanState.release();
            events.statusChanged();
            try {
                scanLogService.prune();
            } catch (RuntimeException e) {
                log.warn("Scan log pruning failed: {}", e.getMessage());
            }
        }
    }

    private void scanAccount(Account account, ScanContext ctx) {
        try {
            calendarPhase.run(account, ctx);
            if (ctx.isCancelled()) {
                return;
            }
            emailPhase.run(account, ctx);
            if (ctx.isCancelled()) {
                return;
            }
            account.setLastScanAt(LocalDateTime.now(clock));
            accountRepository.save(account);
        } catch (RuntimeException e) {
            ScanPhase phase = ctx.getState().snapshot().getPhase();
            ScanAction action = phase == ScanPhase.EMAIL ? ScanAction.EMAIL_ERROR : ScanAction.CALENDAR_ERROR;
            log.error("❌ {} phase failed for account {}: {}", phase, account.getName(), e.getMessage(), e);
            scanLogService.record(account.getId(), action, Map.of("error", String.valueOf(e.getMessage())));
        } finally {
            scanState.accountDone();
        }
    }

    private void refreshConflictsAfterEarlyStop() {
        try {
            conflictService.refresh();
        } catch (RuntimeException e) {
            log.warn("Conflict refresh after an unfinished scan failed: {}", e.getMessage());
        }
    }
}
