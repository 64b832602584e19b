package com.unifiedcalendar.backend.account;

import com.unifiedcalendar.backend.conflict.ConflictService;
import com.unifiedcalendar.backend.entry.CalendarEntryRepository;
import com.unifiedcalendar.backend.scan.log.ScanAction;
import com.unifiedcalendar.backend.scan.log.ScanLogService;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    static final List<String> PALETTE = List.of(
            "#4285f4", "#34a853", "#ea4335", "#fbbc04", "#9c27b0", "#00bcd4");

    private final AccountRepository accountRepository;
    private final CalendarEntryRepository entryRepository;
    private final ScanLogService scanLogService;
    private final ConflictService conflictService;

    @Transactional(readOnly = true)
    public List<Account> getAllAccounts() {
        return accountRepository.findAllByOrderByCreatedAtAsc();
    }

    @Transactional(readOnly = true)
    public Account getAccount(String id) {
        return accountRepository.findById(id)
                .orElseThrow(() -> new AccountNotFoundException(id));
    }

    /**
     * Adds an account, or updates the existing one when the email is already known
     */
    @Transactional
    public Account addAccount(AccountDTO dto) {
        validate(dto);

        if (StringUtils.hasText(dto.getEmail())) {
            Account existing = accountRepository.findFirstByEmailIgnoreCase(dto.getEmail().trim()).orElse(null);
            if (existing != null) {
                log.info("Account with email {} already exists, updating {}", dto.getEmail(), existing.getId());
                apply(existing, dto);
                return accountRepository.save(existing);
            }
        }

        Account account = Account.builder()
                .id("account-" + UUID.randomUUID())
                .build();
        apply(account, dto);
        if (!StringUtils.hasText(account.getColor())) {
            account.setColor(nextColor());
        }

        Account saved = accountRepository.save(account);
        log.info("➕ Added account {} ({}, {})", saved.getName(), saved.getProvider(), saved.getId());
        scanLogService.record(saved.getId(), ScanAction.ACCOUNT_ADDED, Map.of(
                "name", saved.getName(),
                "provider", saved.getProvider().name()
        ));
        return saved;
    }

    @Transactional
    public Account updateAccount(String id, AccountDTO dto) {
        validate(dto);
        Account account = getAccount(id);
        apply(account, dto);
        return accountRepository.save(account);
    }

    /**
     * Removes the account and every entry it owns, then drops those entries from
     * the conflict lists of the remaining ones
     */
    @Transactional
    public void deleteAccount(String id) {
        Account account = getAccount(id);
        long entries = entryRepository.deleteByAccountId(id);
        accountRepository.delete(account);
        conflictService.refresh();
        log.info("🗑️ Deleted account {} and {} entries", id, entries);
    }

    /**
     * Collapses accounts sharing an email, keeping the most recently created one.
     *
     * @return number of accounts removed
     */
    @Transactional
    public int deduplicateByEmail() {
        Map<String, Account> newestByEmail = new LinkedHashMap<>();
        int removed = 0;

        for (Account account : accountRepository.findAllByOrderByCreatedAtAsc()) {
            if (!StringUtils.hasText(account.getEmail())) {
                continue;
            }
            String key = account.getEmail().trim().toLowerCase(Locale.ROOT);
            Account seen = newestByEmail.get(key);
            if (seen == null) {
                newestByEmail.put(key, account);
                continue;
            }
            Account keep = isNewer(account, seen) ? account : seen;
            Account drop = keep == account ? seen : account;
            entryRepository.deleteByAccountId(drop.getId());
            accountRepository.delete(drop);
            newestByEmail.put(key, keep);
            removed++;
            log.info("Removed duplicate account {} for {}", drop.getId(), key);
        }
        if (removed > 0) {
            conflictService.refresh();
        }
        return removed;
    }

    String nextColor() {
        Set<String> used = accountRepository.findAll().stream()
                .map(Account::getColor)
                .filter(StringUtils::hasText)
                .map(c -> c.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        return PALETTE.stream()
                .filter(c -> !used.contains(c))
                .findFirst()
                .orElse(PALETTE.get((int) (accountRepository.count() % PALETTE.size())));
    }

    private static boolean isNewer(Account candidate, Account other) {
        Comparator<LocalDateTime> order = Comparator.nullsFirst(Comparator.naturalOrder());
        return order.compare(candidate.getCreatedAt(), other.getCreatedAt()) > 0;
    }

    private static void validate(AccountDTO dto) {
        if (dto.getProvider() == AccountProvider.STRUCTURED_FEED && !StringUtils.hasText(dto.getFeedUrl())) {
            throw new IllegalArgumentException("A structured-feed account needs a feedUrl");
        }
    }

    private static void apply(Account account, AccountDTO dto) {
        account.setName(dto.getName().trim());
        if (dto.getEmail() != null) {
            account.setEmail(StringUtils.hasText(dto.getEmail()) ? dto.getEmail().trim() : null);
        }
        if (dto.getAccountIndex() != null) {
            account.setAccountIndex(dto.getAccountIndex());
        }
        if (dto.getProvider() != null) {
            account.setProvider(dto.getProvider());
        }
        if (dto.getPlatform() != null) {
            account.setPlatform(dto.getPlatform());
        }
        if (dto.getFeedUrl() != null) {
            account.setFeedUrl(StringUtils.hasText(dto.getFeedUrl()) ? dto.getFeedUrl().trim() : null);
        }
        if (StringUtils.hasText(dto.getColor())) {
            account.setColor(dto.getColor());
        }
    }
}
