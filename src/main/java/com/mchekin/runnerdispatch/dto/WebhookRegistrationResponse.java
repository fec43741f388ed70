package com.mchekin.runnerdispatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookRegistrationResponse {

    private Long id;
    private Long repositoryId;
    private String owner;
    private String name;
    private String remoteHookId;
    private String secretHint;
    private String deliveryUrl;
    private Boolean active;
    private Instant createdAt;
    private Instant updatedAt;
}
