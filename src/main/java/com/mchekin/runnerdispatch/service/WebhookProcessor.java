package com.mchekin.runnerdispatch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.mchekin.runnerdispatch.config.RunnerProperties;
import com.mchekin.runnerdispatch.domain.DeliveryOutcome;
import com.mchekin.runnerdispatch.domain.WebhookDeliveryLog;
import com.mchekin.runnerdispatch.domain.WebhookRegistration;
import com.mchekin.runnerdispatch.dto.AdmissionDecision;
import com.mchekin.runnerdispatch.dto.AdmissionRequest;
import com.mchekin.runnerdispatch.dto.Classification;
import com.mchekin.runnerdispatch.dto.ProvisionRequest;
import com.mchekin.runnerdispatch.dto.WebhookAck;
import com.mchekin.runnerdispatch.repository.WebhookDeliveryLogRepository;
import com.mchekin.runnerdispatch.repository.WebhookRegistrationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

/**
 * Runs one inbound delivery through verification, classification, admission and provisioning.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookProcessor {

    private final WebhookRegistrationRepository registrationRepository;
    private final WebhookDeliveryLogRepository deliveryLogRepository;
    private final SignatureVerifier signatureVerifier;
    private final EventClassifier eventClassifier;
    private final InstallationDirectory installationDirectory;
    private final AdmissionController admissionController;
    private final Provisioner provisioner;
    private final RunnerProperties properties;

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @throws WebhookAuthenticationException when no active registration secret (nor the app secret) verifies the body
     * @throws MalformedPayloadException when a verified body is not JSON
     */
    public WebhookAck process(String event, String deliveryId, String signature, byte[] rawBody) {
        long startTime = System.currentTimeMillis();

        WebhookRegistration registration = verify(event, signature, rawBody).orElse(null);

        JsonNode payload;
        try {
            payload = objectMapper.readTree(rawBody);
            if (payload == null) {
                payload = MissingNode.getInstance();
            }
        } catch (IOException e) {
            throw new MalformedPayloadException(event, e);
        }
        String action = payload.path("action").asText(null);

        log.info("Verified webhook: event={}, action={}, delivery={}, registration={}",
                event, action, deliveryId, registration == null ? "app" : registration.fullName());

        Classification classification = eventClassifier.classify(event, payload);
        Handled handled = switch (classification.intent()) {
            case IGNORE -> {
                log.info("Ignoring webhook: event={}, action={}, reason={}", event, action, classification.message());
                yield new Handled(WebhookAck.of(event, classification.message()), DeliveryOutcome.IGNORED);
            }
            case ACKNOWLEDGE -> new Handled(acknowledge(event, payload, classification), DeliveryOutcome.ACKNOWLEDGED);
            case PROVISION_CANDIDATE -> {
                if (registration == null) {
                    log.warn("Provision candidate without repository registration: event={}, delivery={}",
                            event, deliveryId);
                    yield new Handled(WebhookAck.of(event, "No registration for repository"),
                            DeliveryOutcome.ACKNOWLEDGED);
                }
                yield admitAndProvision(event, action, payload, registration, classification);
            }
        };

        logDelivery(registration, deliveryId, event, action, handled.outcome(), handled.ack().getMessage(),
                System.currentTimeMillis() - startTime);
        return handled.ack();
    }

    /**
     * Returns the registration whose secret signed the body, or empty when only the app secret did.
     */
    private Optional<WebhookRegistration> verify(String event, String signature, byte[] rawBody) {
        for (WebhookRegistration registration : registrationRepository.findByActiveTrue()) {
            if (signatureVerifier.verify(registration.getSecret(), rawBody, signature)) {
                return Optional.of(registration);
            }
        }

        String appSecret = properties.github().appWebhookSecret();
        if (appSecret != null && !appSecret.isBlank() && signatureVerifier.verify(appSecret, rawBody, signature)) {
            return Optional.empty();
        }

        log.warn("Webhook signature verification failed: event={}, bodyLength={}", event, rawBody.length);
        throw new WebhookAuthenticationException(event);
    }

    private WebhookAck acknowledge(String event, JsonNode payload, Classification classification) {
        if (!classification.directoryUpdate()) {
            log.info("Acknowledged webhook: event={}, message={}", event, classification.message());
            return WebhookAck.of(event, classification.message());
        }

        try {
            installationDirectory.apply(event, payload);
            return WebhookAck.of(event, classification.message());
        } catch (RuntimeException e) {
            log.error("Error handling GitHub App event: event={}", event, e);
            return WebhookAck.builder().ok(false).event(event).message("Installation update failed").build();
        }
    }

    private Handled admitAndProvision(String event, String action, JsonNode payload,
                                      WebhookRegistration registration, Classification classification) {
        JsonNode runId = payload.path("workflow_job").path("run_id");

        AdmissionRequest request = new AdmissionRequest(
                registration.getRepositoryId(),
                registration.getOwner(),
                registration.getName(),
                event,
                action,
                runId.isNumber() ? runId.asLong() : null,
                classification.triggerAnnotation());

        AdmissionDecision decision = admissionController.admit(request);
        if (!decision.accepted()) {
            return new Handled(WebhookAck.of(event, "Rejected: " + decision.reason().code()), DeliveryOutcome.REJECTED);
        }

        Optional<String> taskArn = provisioner.launch(new ProvisionRequest(
                event,
                action,
                registration.getOwner(),
                registration.getName(),
                decision.credential(),
                decision.triggerAnnotation()));

        return taskArn
                .map(arn -> new Handled(
                        WebhookAck.builder().ok(true).event(event).message("Runner task created").taskArn(arn).build(),
                        DeliveryOutcome.PROVISIONED))
                .orElseGet(() -> new Handled(WebhookAck.of(event, "Runner task creation failed"),
                        DeliveryOutcome.PROVISION_FAILED));
    }

    private void logDelivery(WebhookRegistration registration, String deliveryId, String event, String action,
                             DeliveryOutcome outcome, String detail, long durationMs) {
        WebhookDeliveryLog deliveryLog = WebhookDeliveryLog.builder()
                .registrationId(registration == null ? null : registration.getId())
                .deliveryId(deliveryId)
                .event(event)
                .action(action)
                .outcome(outcome)
                .detail(detail)
                .durationMs(durationMs)
                .build();

        deliveryLogRepository.save(deliveryLog);
    }

    private record Handled(WebhookAck ack, DeliveryOutcome outcome) {
    }
}
