package com.unifiedcalendar.backend.account;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for creating or editing an account
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountDTO {
    @NotBlank
    private String name;
    private String email;
    @Min(0)
    private Integer accountIndex;
    private AccountProvider provider;
    private AccountPlatform platform;
    private String feedUrl;
    private String color;
}
