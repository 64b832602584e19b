package com.unifiedcalendar.backend.account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "accounts")
public class Account {
    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 200)
    private String name;

    // Natural key used to collapse duplicates
    @Column(length = 320)
    private String email;

    // Index into the browser's multi-login session (/u/{index}/)
    @Column(nullable = false)
    @Builder.Default
    private Integer accountIndex = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private AccountProvider provider = AccountProvider.CALENDAR_WEB_UI;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    @Builder.Default
    private AccountPlatform platform = AccountPlatform.GOOGLE;

    @Column(columnDefinition = "TEXT")
    private String feedUrl;

    @Column(length = 16)
    private String color;

    private LocalDateTime lastScanAt;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public boolean usesFeed() {
        return provider == AccountProvider.STRUCTURED_FEED;
    }
}
