package com.mchekin.runnerdispatch.dto;

import com.mchekin.runnerdispatch.domain.AccountType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstallationResponse {

    private Long installationId;
    private Long accountId;
    private String accountLogin;
    private AccountType accountType;
    private Instant suspendedAt;
    private Instant createdAt;
    private Instant updatedAt;
}
