package com.mchekin.runnerdispatch.controller;

import com.mchekin.runnerdispatch.domain.WebhookDeliveryLog;
import com.mchekin.runnerdispatch.domain.WebhookRegistration;
import com.mchekin.runnerdispatch.dto.RegisterWebhookRequest;
import com.mchekin.runnerdispatch.dto.WebhookRegistrationResponse;
import com.mchekin.runnerdispatch.github.GitHubApiException;
import com.mchekin.runnerdispatch.repository.WebhookDeliveryLogRepository;
import com.mchekin.runnerdispatch.repository.WebhookRegistrationRepository;
import com.mchekin.runnerdispatch.service.NoCredentialException;
import com.mchekin.runnerdispatch.service.WebhookRegistrationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookRegistrationController {

    private final WebhookRegistrationRepository registrationRepository;
    private final WebhookDeliveryLogRepository deliveryLogRepository;
    private final WebhookRegistrationService registrationService;

    @PostMapping
    public ResponseEntity<WebhookRegistrationResponse> register(@RequestBody RegisterWebhookRequest request) {
        if (request.getRepositoryId() == null || request.getOwner() == null || request.getName() == null) {
            return ResponseEntity.badRequest().build();
        }

        try {
            WebhookRegistrationService.Registered registered = registrationService.register(request);
            HttpStatus status = registered.created() ? HttpStatus.CREATED : HttpStatus.OK;
            return ResponseEntity.status(status).body(toResponse(registered.registration()));
        } catch (NoCredentialException e) {
            log.warn("Webhook registration without credential: repository={}/{}", request.getOwner(), request.getName());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).build();
        } catch (GitHubApiException e) {
            log.error("Webhook registration failed: repository={}/{}, status={}",
                    request.getOwner(), request.getName(), e.getStatusCode(), e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).build();
        }
    }

    @GetMapping
    public ResponseEntity<List<WebhookRegistrationResponse>> listRegistrations(
            @RequestParam(required = false) Long repositoryId) {

        List<WebhookRegistration> registrations = repositoryId != null
                ? registrationRepository.findByRepositoryId(repositoryId)
                : registrationRepository.findAll();

        List<WebhookRegistrationResponse> responses = registrations.stream()
                .map(this::toResponse)
                .toList();

        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{id}")
    public ResponseEntity<WebhookRegistrationResponse> getRegistration(@PathVariable Long id) {
        return registrationRepository.findById(id)
                .map(registration -> ResponseEntity.ok(toResponse(registration)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deactivateRegistration(@PathVariable Long id) {
        if (!registrationService.deactivate(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/deliveries")
    public ResponseEntity<Page<WebhookDeliveryLog>> getDeliveries(
            @PathVariable Long id,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {

        if (!registrationRepository.existsById(id)) {
            return ResponseEntity.notFound().build();
        }

        Page<WebhookDeliveryLog> deliveries = deliveryLogRepository.findByRegistrationIdOrderByCreatedAtDesc(
                id, PageRequest.of(page, size));

        return ResponseEntity.ok(deliveries);
    }

    private WebhookRegistrationResponse toResponse(WebhookRegistration registration) {
        return WebhookRegistrationResponse.builder()
                .id(registration.getId())
                .repositoryId(registration.getRepositoryId())
                .owner(registration.getOwner())
                .name(registration.getName())
                .remoteHookId(registration.getRemoteHookId())
                .secretHint(WebhookRegistrationService.secretHint(registration.getSecret()))
                .deliveryUrl(registration.getDeliveryUrl())
                .active(registration.getActive())
                .createdAt(registration.getCreatedAt())
                .updatedAt(registration.getUpdatedAt())
                .build();
    }
}
