package com.unifiedcalendar.backend.scan;

import com.unifiedcalendar.backend.account.Account;
import com.unifiedcalendar.backend.config.ScanConfig;
import com.unifiedcalendar.backend.entry.CalendarEntryRepository;
import com.unifiedcalendar.backend.entry.entity.CalendarEntry;
import com.unifiedcalendar.backend.entry.entity.SourceKind;
import com.unifiedcalendar.backend.entry.normalize.EntryNormalizer;
import com.unifiedcalendar.backend.entry.normalize.MalformedCandidateException;
import com.unifiedcalendar.backend.feed.FeedClient;
import com.unifiedcalendar.backend.feed.IcsEvent;
import com.unifiedcalendar.backend.feed.IcsParser;
import com.unifiedcalendar.backend.scan.event.ScanEventPublisher;
import com.unifiedcalendar.backend.scan.log.ScanAction;
import com.unifiedcalendar.backend.scan.log.ScanLogService;
import com.unifiedcalendar.backend.scraper.CalendarScraper;
import com.unifiedcalendar.backend.scraper.CalendarView;
import com.unifiedcalendar.backend.scraper.RawCalendarEvent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Calendar phase for one account: clears the account's calendar entries, then
 * repopulates them from the structured feed or from the calendar web UI.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CalendarPhase {

    private final CalendarScraper calendarScraper;
    private final FeedClient feedClient;
    private final IcsParser icsParser;
    private final EntryNormalizer normalizer;
    private final CalendarEntryRepository entryRepository;
    private final ScanLogService scanLogService;
    private final ScanEventPublisher events;
    private final ScanConfig scanConfig;

    /**
     * @return number of entries saved
     */
    public int run(Account account, ScanContext ctx) {
        ctx.getState().enterPhase(ScanPhase.CALENDAR, "Fetching calendar: " + account.getName());
        events.statusChanged();

        long cleared = entryRepository.deleteByAccountIdAndSourceKind(account.getId(), SourceKind.CALENDAR);
        log.debug("Cleared {} calendar entries for {}", cleared, account.getName());

        RetryPolicy retry = RetryPolicy.from(scanConfig);
        Optional<List<CalendarEntry>> candidates = account.usesFeed()
                ? fromFeed(account, ctx, retry)
                : fromWebUi(account, ctx, retry);

        if (candidates.isEmpty()) {
            if (!ctx.isCancelled()) {
                log.warn("⚠️ Calendar source unavailable for {} after {} attempts", account.getName(),
                        retry.getMaxAttempts());
                scanLogService.record(account.getId(), ScanAction.CALENDAR_ERROR,
                        Map.of("error", "source unavailable after " + retry.getMaxAttempts() + " attempts"));
            }
            return 0;
        }

        int saved = persist(account, candidates.get(), ctx);
        ScanAction action = account.usesFeed() ? ScanAction.FEED_FETCHED : ScanAction.CALENDAR_SCRAPED;
        scanLogService.record(account.getId(), action, Map.of("events", saved));
        log.info("📅 {} calendar entries saved for {}", saved, account.getName());
        return saved;
    }

    private Optional<List<CalendarEntry>> fromFeed(Account account, ScanContext ctx, RetryPolicy retry) {
        Optional<String> body = retry.execute("Feed fetch for " + account.getName(), ctx.getToken(),
                () -> feedClient.fetch(account.getFeedUrl()),
                text -> text != null && !text.isBlank());
        if (body.isEmpty()) {
            return Optional.empty();
        }

        List<CalendarEntry> entries = new ArrayList<>();
        for (IcsEvent event : icsParser.parse(body.get())) {
            try {
                entries.add(normalizer.fromFeedEvent(account.getId(), account.getName(), event));
            } catch (MalformedCandidateException e) {
                skipped(account, event.getSummary(), e);
            }
        }
        return Optional.of(entries);
    }

    private Optional<List<CalendarEntry>> fromWebUi(Account account, ScanContext ctx, RetryPolicy retry) {
        Optional<CalendarView> opened = retry.execute("Open calendar for " + account.getName(), ctx.getToken(),
                () -> calendarScraper.open(account), Objects::nonNull);
        if (opened.isEmpty()) {
            return Optional.empty();
        }

        // title+start -> event, across both periods
        Map<String, RawCalendarEvent> unique = new LinkedHashMap<>();
        try (CalendarView view = opened.get()) {
            Optional<List<RawCalendarEvent>> current = retry.execute("Calendar scrape (current period)",
                    ctx.getToken(), view::scrapeVisibleEvents, Objects::nonNull);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            current.get().forEach(event -> unique.putIfAbsent(event.dedupeKey(), event));

            if (!ctx.isCancelled()) {
                boolean moved = retry.execute("Navigate to next period", ctx.getToken(), () -> {
                    view.navigateNextPeriod();
                    return Boolean.TRUE;
                }, Boolean.TRUE::equals).orElse(Boolean.FALSE);

                if (moved && RetryPolicy.sleep(scanConfig.getNavigationSettle())) {
                    retry.execute("Calendar scrape (next period)", ctx.getToken(),
                                    view::scrapeVisibleEvents, Objects::nonNull)
                            .ifPresent(next -> next.forEach(event -> unique.putIfAbsent(event.dedupeKey(), event)));
                }
            }
        }

        List<CalendarEntry> entries = new ArrayList<>();
        for (RawCalendarEvent event : unique.values()) {
            try {
                entries.add(normalizer.fromScrapedEvent(account.getId(), account.getName(), event));
            } catch (MalformedCandidateException e) {
                skipped(account, event.getTitle(), e);
            }
        }
        return Optional.of(entries);
    }

    private int persist(Account account, List<CalendarEntry> entries, ScanContext ctx) {
        int saved = 0;
        for (int i = 0; i < entries.size(); i++) {
            if (ctx.isCancelled()) {
                log.info("Calendar phase for {} stopped by cancellation after {} entries", account.getName(), saved);
                break;
            }
            CalendarEntry entry = entries.get(i);
            ctx.getState().progress(i + 1, entries.size(), entry.getTitle());
            events.statusChanged();

            CalendarEntry stored = entryRepository.save(entry);
            ctx.getState().entrySaved();
            events.newEntry(stored != null ? stored : entry);
            saved++;
        }
        return saved;
    }

    private void skipped(Account account, String title, MalformedCandidateException e) {
        log.debug("Skipping calendar candidate '{}' for {}: {}", title, account.getName(), e.getMessage());
        scanLogService.record(account.getId(), ScanAction.CANDIDATE_SKIPPED,
                Map.of("title", String.valueOf(title), "reason", e.getMessage()));
    }
}
