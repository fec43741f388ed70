package com.mchekin.runnerdispatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterWebhookRequest {

    private Long repositoryId;
    private String owner;
    private String name;
}
