package com.unifiedcalendar.backend.account;

import jakarta.validation.Valid;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;

    @GetMapping
    public ResponseEntity<?> getAccounts() {
        return ResponseEntity.ok(accountService.getAllAccounts());
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getAccount(@PathVariable String id) {
        try {
            return ResponseEntity.ok(accountService.getAccount(id));
        } catch (AccountNotFoundException e) {
            return error(HttpStatus.NOT_FOUND, "Account not found", e);
        }
    }

    @PostMapping
    public ResponseEntity<?> addAccount(@Valid @RequestBody AccountDTO dto) {
        try {
            Account account = accountService.addAccount(dto);
            return ResponseEntity.status(HttpStatus.CREATED).body(account);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, "Invalid account", e);
        } catch (Exception e) {
            log.error("Error adding account {}", dto.getName(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to add account", e);
        }
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> updateAccount(@PathVariable String id, @Valid @RequestBody AccountDTO dto) {
        try {
            return ResponseEntity.ok(accountService.updateAccount(id, dto));
        } catch (AccountNotFoundException e) {
            return error(HttpStatus.NOT_FOUND, "Account not found", e);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, "Invalid account", e);
        } catch (Exception e) {
            log.error("Error updating account {}", id, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to update account", e);
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteAccount(@PathVariable String id) {
        try {
            accountService.deleteAccount(id);
            return ResponseEntity.ok(Map.of(
                    "message", "Account deleted",
                    "id", id
            ));
        } catch (AccountNotFoundException e) {
            return error(HttpStatus.NOT_FOUND, "Account not found", e);
        } catch (Exception e) {
            log.error("Error deleting account {}", id, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to delete account", e);
        }
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, Exception e) {
        return ResponseEntity.status(status).body(Map.of(
                "error", error,
                "message", String.valueOf(e.getMessage()),
                "timestamp", LocalDateTime.now()
        ));
    }
}
