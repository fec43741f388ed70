package com.mchekin.runnerdispatch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookAck {

    private boolean ok;
    private String event;
    private String message;
    private String taskArn;

    public static WebhookAck of(String event, String message) {
        return WebhookAck.builder().ok(true).event(event).message(message).build();
    }
}
