package com.unifiedcalendar.backend.account;

import com.unifiedcalendar.backend.conflict.ConflictDetector;
import com.unifiedcalendar.backend.conflict.ConflictService;
import com.unifiedcalendar.backend.entry.CalendarEntryRepository;
import com.unifiedcalendar.backend.entry.entity.CalendarEntry;
import com.unifiedcalendar.backend.scan.log.ScanAction;
import com.unifiedcalendar.backend.scan.log.ScanLogService;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AccountServiceTest {

    private AccountRepository accountRepository;
    private CalendarEntryRepository entryRepository;
    private ScanLogService scanLogService;
    private AccountService service;

    @BeforeEach
    void setUp() {
        accountRepository = mock(AccountRepository.class);
        entryRepository = mock(CalendarEntryRepository.class);
        scanLogService = mock(ScanLogService.class);
        when(accountRepository.save(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));
        when(accountRepository.findFirstByEmailIgnoreCase(anyString())).thenReturn(Optional.empty());
        service = new AccountService(accountRepository, entryRepository, scanLogService,
                new ConflictService(entryRepository, new ConflictDetector()));
    }

    private static Account account(String id, String email, String color, LocalDateTime createdAt) {
        return Account.builder().id(id).name(id).email(email).color(color).createdAt(createdAt).build();
    }

    @Test
    void new_account_gets_first_unused_colour() {
        when(accountRepository.findAll()).thenReturn(List.of(account("a", "a@example.com", "#4285f4", null)));

        var added = service.addAccount(AccountDTO.builder().name("Work").email("work@example.com").build());

        assertThat(added.getId()).startsWith("account-");
        assertThat(added.getColor()).isEqualTo("#34a853");
        assertThat(added.getProvider()).isEqualTo(AccountProvider.CALENDAR_WEB_UI);
        verify(scanLogService).record(eq(added.getId()), eq(ScanAction.ACCOUNT_ADDED), anyMap());
    }

    @Test
    void adding_a_known_email_updates_the_existing_account() {
        var existing = account("account-1", "Work@Example.com", "#4285f4", null);
        when(accountRepository.findFirstByEmailIgnoreCase("work@example.com")).thenReturn(Optional.of(existing));

        var result = service.addAccount(AccountDTO.builder().name("Work (renamed)").email("work@example.com")
                .accountIndex(2).build());

        assertThat(result).isSameAs(existing);
        assertThat(result.getName()).isEqualTo("Work (renamed)");
        assertThat(result.getAccountIndex()).isEqualTo(2);
        verify(scanLogService, never()).record(any(), any(), anyMap());
    }

    @Test
    void feed_account_requires_a_url() {
        var dto = AccountDTO.builder().name("Family").provider(AccountProvider.STRUCTURED_FEED).build();

        assertThatThrownBy(() -> service.addAccount(dto)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleting_an_account_removes_its_entries() {
        var existing = account("account-1", "work@example.com", "#4285f4", null);
        when(accountRepository.findById("account-1")).thenReturn(Optional.of(existing));

        service.deleteAccount("account-1");

        verify(entryRepository).deleteByAccountId("account-1");
        verify(accountRepository).delete(existing);
    }

    @Test
    void deleting_an_account_clears_its_ids_from_remaining_conflicts() {
        var existing = account("account-1", "work@example.com", "#4285f4", null);
        when(accountRepository.findById("account-1")).thenReturn(Optional.of(existing));
        var survivor = CalendarEntry.builder()
                .id("home-dentist")
                .accountId("account-2")
                .title("Dentist")
                .startTime(LocalDateTime.of(2026, 1, 8, 10, 0))
                .endTime(LocalDateTime.of(2026, 1, 8, 11, 0))
                .conflicts(new ArrayList<>(List.of("work-standup")))
                .build();
        when(entryRepository.findAllByOrderByStartTimeAsc()).thenReturn(List.of(survivor));

        service.deleteAccount("account-1");

        assertThat(survivor.getConflicts()).isEmpty();
        verify(entryRepository).saveAll(List.of(survivor));
    }

    @Test
    void unknown_account_is_not_found() {
        when(accountRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.deleteAccount("nope")).isInstanceOf(AccountNotFoundException.class);
    }

    @Test
    void duplicates_collapse_to_the_newest_account() {
        var older = account("old", "pat@example.com", "#4285f4", LocalDateTime.of(2025, 1, 1, 0, 0));
        var other = account("other", "sam@example.com", "#34a853", LocalDateTime.of(2025, 2, 1, 0, 0));
        var newer = account("new", "PAT@example.com", "#ea4335", LocalDateTime.of(2025, 3, 1, 0, 0));
        when(accountRepository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(older, other, newer));

        int removed = service.deduplicateByEmail();

        assertThat(removed).isEqualTo(1);
        verify(accountRepository).delete(older);
        verify(entryRepository).deleteByAccountId("old");
        verify(accountRepository, never()).delete(newer);
        verify(accountRepository, never()).delete(other);
    }
}
