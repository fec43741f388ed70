package com.mchekin.runnerdispatch.dto;

public record ProvisionRequest(
        String eventType,
        String action,
        String owner,
        String name,
        Credential credential,
        String triggerAnnotation
) {
}
