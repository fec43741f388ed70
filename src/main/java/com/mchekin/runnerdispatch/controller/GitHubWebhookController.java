package com.mchekin.runnerdispatch.controller;

import com.mchekin.runnerdispatch.dto.WebhookAck;
import com.mchekin.runnerdispatch.service.MalformedPayloadException;
import com.mchekin.runnerdispatch.service.WebhookAuthenticationException;
import com.mchekin.runnerdispatch.service.WebhookProcessor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * GitHub delivery endpoint. Everything that passes signature verification is answered with 200,
 * admission rejections and launch failures included.
 */
@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
public class GitHubWebhookController {

    private final WebhookProcessor webhookProcessor;

    @PostMapping("/github")
    public ResponseEntity<WebhookAck> receive(
            @RequestHeader(value = "X-GitHub-Event", defaultValue = "unknown") String event,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) String deliveryId,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestBody(required = false) byte[] body) {

        byte[] rawBody = body == null ? new byte[0] : body;

        try {
            return ResponseEntity.ok(webhookProcessor.process(event, deliveryId, signature, rawBody));
        } catch (WebhookAuthenticationException e) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(WebhookAck.builder().ok(false).event(event).message("Invalid signature").build());
        } catch (MalformedPayloadException e) {
            return ResponseEntity.badRequest()
                    .body(WebhookAck.builder().ok(false).event(event).message("Malformed payload").build());
        }
    }
}
