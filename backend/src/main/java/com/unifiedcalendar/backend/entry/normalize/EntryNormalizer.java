package com.unifiedcalendar.backend.entry.normalize;

import com.unifiedcalendar.backend.classifier.MeetingClassification;
import com.unifiedcalendar.backend.entry.entity.CalendarEntry;
import com.unifiedcalendar.backend.entry.entity.CalendarSource;
import com.unifiedcalendar.backend.entry.entity.ClassifierEvidence;
import com.unifiedcalendar.backend.entry.entity.EmailSource;
import com.unifiedcalendar.backend.entry.entity.EntrySource;
import com.unifiedcalendar.backend.entry.entity.EntryStatus;
import com.unifiedcalendar.backend.entry.entity.SourceKind;
import com.unifiedcalendar.backend.feed.IcsEvent;
import com.unifiedcalendar.backend.scraper.RawCalendarEvent;
import com.unifiedcalendar.backend.scraper.RawEmail;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Turns raw candidates from feeds, scrapers and the classifier into {@link CalendarEntry} rows
 * with deterministic identifiers.
 */
@Component
public class EntryNormalizer {

    static final String UNTITLED = "Untitled Event";

    public CalendarEntry fromFeedEvent(String accountId, String feedName, IcsEvent event) {
        if (event.getStart() == null) {
            throw new MalformedCandidateException("Feed event without start");
        }
        String title = titleOrDefault(event.getSummary());
        LocalDateTime end = event.getEnd() != null ? event.getEnd() : event.getStart().plusHours(1);

        String naturalKey = hasText(event.getUid())
                ? event.getUid()
                : EntryIdentity.titleAndStart(title, event.getStart());

        CalendarSource source = CalendarSource.builder()
                .feedName(feedName)
                .externalEventId(event.getUid())
                .location(event.getLocation())
                .rsvpState(hasText(event.getStatus()) ? event.getStatus().trim().toLowerCase(Locale.ROOT) : null)
                .build();

        return build(accountId, naturalKey, title, event.getStart(), end, event.isAllDay(),
                EntryStatus.CONFIRMED, source);
    }

    public CalendarEntry fromScrapedEvent(String accountId, String calendarName, RawCalendarEvent event) {
        if (!hasText(event.getTitle())) {
            throw new MalformedCandidateException("Scraped event without title");
        }
        if (event.getStart() == null) {
            throw new MalformedCandidateException("Scraped event '" + event.getTitle() + "' without start");
        }

        LocalDateTime start = event.getStart();
        LocalDateTime end = event.getEnd();
        if (event.isAllDay()) {
            AllDaySpan span = AllDaySpan.of(start.toLocalDate(), end != null ? end.toLocalDate() : null);
            start = span.getStart();
            end = span.getEnd();
        } else if (end == null) {
            end = start.plusHours(1);
        }

        String title = event.getTitle().trim();
        CalendarSource source = CalendarSource.builder()
                .feedName(calendarName)
                .location(event.getLocation())
                .rsvpState(event.getRsvpState())
                .build();

        // Keyed on the scraped start, before all-day widening
        return build(accountId, EntryIdentity.titleAndStart(title, event.getStart()), title, start, end,
                event.isAllDay(), EntryStatus.CONFIRMED, source);
    }

    public CalendarEntry fromEmail(String accountId, RawEmail email, LocalDateTime emailTime,
                                   MeetingClassification classification) {
        if (!classification.isMeeting() || classification.getDate() == null) {
            throw new MalformedCandidateException("Email is not a placeable meeting");
        }

        LocalDateTime start;
        LocalDateTime end;
        boolean allDay;
        if (classification.getTime() != null && !classification.isMultiDay()) {
            start = classification.getDate().atTime(classification.getTime());
            int duration = classification.getDurationMinutes() != null ? classification.getDurationMinutes() : 60;
            end = start.plusMinutes(duration);
            allDay = false;
        } else {
            AllDaySpan span = AllDaySpan.of(classification.getDate(), classification.getEndDate());
            start = span.getStart();
            end = span.getEnd();
            allDay = true;
        }

        ClassifierEvidence evidence = ClassifierEvidence.builder()
                .tier(classification.getTier())
                .score(classification.getScore())
                .signals(classification.getSignals())
                .confidence(classification.getConfidence())
                .dateSpan(classification.getDateSpan())
                .timeSpan(classification.getTimeSpan())
                .oracleVerdict(classification.getOracleVerdict())
                .build();

        EmailSource source = EmailSource.builder()
                .subject(email.getSubject())
                .snippet(email.getSnippet())
                .threadId(email.getThreadId())
                .emailTime(emailTime)
                .classifierEvidence(evidence)
                .build();

        return build(accountId, emailNaturalKey(email, emailTime), titleOrDefault(classification.getTitle()),
                start, end, allDay, EntryStatus.TENTATIVE, source);
    }

    static String emailNaturalKey(RawEmail email, LocalDateTime emailTime) {
        if (hasText(email.getId())) {
            return email.getId();
        }
        if (hasText(email.getThreadId())) {
            return email.getThreadId();
        }
        return email.getSubject() + "|" + email.getFrom() + "|" + emailTime;
    }

    private CalendarEntry build(String accountId, String naturalKey, String title, LocalDateTime start,
                                LocalDateTime end, boolean allDay, EntryStatus status, EntrySource source) {
        if (end.isBefore(start)) {
            throw new MalformedCandidateException("'" + title + "' ends before it starts");
        }
        SourceKind kind = source.getKind();
        return CalendarEntry.builder()
                .id(EntryIdentity.entryId(accountId, kind, naturalKey))
                .accountId(accountId)
                .title(title)
                .startTime(start)
                .endTime(end)
                .allDay(allDay)
                .status(status)
                .sourceKind(kind)
                .source(source)
                .conflicts(new ArrayList<>())
                .build();
    }

    private static String titleOrDefault(String title) {
        return hasText(title) ? title.trim() : UNTITLED;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
