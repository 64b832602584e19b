package com.unifiedcalendar.backend.scan;

import com.unifiedcalendar.backend.account.Account;
import com.unifiedcalendar.backend.account.AccountPlatform;
import com.unifiedcalendar.backend.classifier.InferenceOracle;
import com.unifiedcalendar.backend.classifier.MeetingClassification;
import com.unifiedcalendar.backend.classifier.MeetingClassifier;
import com.unifiedcalendar.backend.config.ScanConfig;
import com.unifiedcalendar.backend.entry.CalendarEntryRepository;
import com.unifiedcalendar.backend.entry.entity.CalendarEntry;
import com.unifiedcalendar.backend.entry.entity.SourceKind;
import com.unifiedcalendar.backend.entry.normalize.EmailDateParser;
import com.unifiedcalendar.backend.entry.normalize.EntryNormalizer;
import com.unifiedcalendar.backend.scan.event.ScanEventPublisher;
import com.unifiedcalendar.backend.scan.log.ScanAction;
import com.unifiedcalendar.backend.scan.log.ScanLogService;
import com.unifiedcalendar.backend.scraper.EmailScraper;
import com.unifiedcalendar.backend.scraper.RawEmail;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Email phase for one account: clears the account's email-derived entries, reads the
 * mail list, and turns every email the classifier accepts into a tentative entry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmailPhase {

    private final EmailScraper emailScraper;
    private final EmailDateParser emailDateParser;
    private final MeetingClassifier classifier;
    private final InferenceOracle oracle;
    private final EntryNormalizer normalizer;
    private final CalendarEntryRepository entryRepository;
    private final ScanLogService scanLogService;
    private final ScanEventPublisher events;
    private final ScanConfig scanConfig;

    public static boolean appliesTo(Account account) {
        AccountPlatform platform = account.getPlatform() != null ? account.getPlatform() : AccountPlatform.GOOGLE;
        return !account.usesFeed() && platform.isSupportsEmailScan();
    }

    /**
     * @return number of tentative entries saved
     */
    public int run(Account account, ScanContext ctx) {
        if (!appliesTo(account)) {
            log.info("Skipping email scan for {} (no mail scraper for this account type)", account.getName());
            return 0;
        }

        ctx.getState().enterPhase(ScanPhase.EMAIL, "Opening mail: " + account.getName());
        events.statusChanged();

        entryRepository.deleteByAccountIdAndSourceKind(account.getId(), SourceKind.EMAIL);

        int lookbackDays = ctx.getOptions().getLookbackDays();
        RetryPolicy retry = RetryPolicy.from(scanConfig);
        Optional<List<RawEmail>> rows = retry.execute("Mail scan for " + account.getName(), ctx.getToken(),
                () -> emailScraper.scanVisibleEmails(account, lookbackDays),
                list -> list != null && !list.isEmpty());

        if (rows.isEmpty()) {
            if (!ctx.isCancelled()) {
                log.warn("⚠️ No emails readable for {} after {} attempts", account.getName(), retry.getMaxAttempts());
                scanLogService.record(account.getId(), ScanAction.EMAIL_ERROR,
                        Map.of("error", "source unavailable after " + retry.getMaxAttempts() + " attempts"));
            }
            return 0;
        }

        List<DatedEmail> candidates = withinLookback(rows.get(), lookbackDays);
        log.info("📬 {} of {} emails for {} fall within {} days", candidates.size(), rows.get().size(),
                account.getName(), lookbackDays);

        int processed = 0;
        int saved = 0;
        for (int i = 0; i < candidates.size(); i++) {
            if (ctx.isCancelled()) {
                log.info("Email phase for {} stopped by cancellation after {} emails", account.getName(), processed);
                break;
            }
            DatedEmail candidate = candidates.get(i);
            RawEmail email = candidate.email;
            ctx.getState().progress(i + 1, candidates.size(), email.getSubject());
            events.statusChanged();
            processed++;

            try {
                MeetingClassification classification = classifier.classify(
                        email.getSubject(), email.getSnippet(), email.getFrom(), candidate.sentAt);
                if (!classification.isMeeting()) {
                    log.debug("Not a meeting: '{}' ({})", email.getSubject(), classification.getRejectionReason());
                    continue;
                }

                CalendarEntry entry = normalizer.fromEmail(account.getId(), email, candidate.sentAt, classification);
                CalendarEntry stored = entryRepository.save(entry);
                ctx.getState().entrySaved();
                events.newEntry(stored != null ? stored : entry);
                saved++;
            } catch (RuntimeException e) {
                log.debug("Skipping email '{}' for {}: {}", email.getSubject(), account.getName(), e.getMessage());
                scanLogService.record(account.getId(), ScanAction.CANDIDATE_SKIPPED,
                        Map.of("subject", String.valueOf(email.getSubject()), "reason", String.valueOf(e.getMessage())));
            }
        }

        scanLogService.record(account.getId(), ScanAction.EMAILS_SCANNED,
                Map.of("emailsProcessed", processed, "meetings", saved, "oracleUsed", oracle.isAvailable()));
        log.info("📬 {} tentative entries saved for {} from {} emails", saved, account.getName(), processed);
        return saved;
    }

    private List<DatedEmail> withinLookback(List<RawEmail> emails, int lookbackDays) {
        LocalDateTime cutoff = emailDateParser.lookbackCutoff(lookbackDays);
        List<DatedEmail> result = new ArrayList<>();
        for (RawEmail email : emails) {
            if (result.size() >= scanConfig.getMaxEmailsPerAccount()) {
                break;
            }
            LocalDateTime sentAt = emailDateParser.parse(email.getTimestampText());
            if (sentAt == null) {
                log.debug("Dropping email with unreadable timestamp '{}'", email.getTimestampText());
            } else if (!sentAt.isBefore(cutoff)) {
                result.add(new DatedEmail(email, sentAt));
            }
        }
        return result;
    }

    private static final class DatedEmail {
        private final RawEmail email;
        private final LocalDateTime sentAt;

        private DatedEmail(RawEmail email, LocalDateTime sentAt) {
            this.email = email;
            this.sentAt = sentAt;
        }
    }
}
