package com.mchekin.runnerdispatch.service;

import com.mchekin.runnerdispatch.config.RunnerProperties;
import com.mchekin.runnerdispatch.domain.WebhookRegistration;
import com.mchekin.runnerdispatch.dto.Credential;
import com.mchekin.runnerdispatch.dto.RegisterWebhookRequest;
import com.mchekin.runnerdispatch.github.GitHubClient;
import com.mchekin.runnerdispatch.repository.WebhookRegistrationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.Optional;

/**
 * Creates repository webhooks on GitHub and stores their generated secrets. Secrets are rotated
 * by deactivating a registration and registering again, never edited in place.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookRegistrationService {

    private final WebhookRegistrationRepository registrationRepository;
    private final CredentialResolver credentialResolver;
    private final GitHubClient gitHubClient;
    private final RunnerProperties properties;
    private final Clock clock;

    private final SecureRandom secureRandom = new SecureRandom();

    public record Registered(WebhookRegistration registration, boolean created) {
    }

    /**
     * Returns the active registration for the repository if there is one, otherwise creates the hook.
     *
     * @throws NoCredentialException when no credential exists for the repository owner
     * @throws com.mchekin.runnerdispatch.github.GitHubApiException when GitHub rejects the hook
     */
    @Transactional
    public Registered register(RegisterWebhookRequest request) {
        Optional<WebhookRegistration> existing =
                registrationRepository.findFirstByRepositoryIdAndActiveTrue(request.getRepositoryId());
        if (existing.isPresent()) {
            log.info("Webhook already registered: repository={}, registrationId={}",
                    existing.get().fullName(), existing.get().getId());
            return new Registered(existing.get(), false);
        }

        String secret = generateSecret();
        String deliveryUrl = properties.webhook().deliveryUrl();
        String remoteHookId;

        if (isLocalDelivery(deliveryUrl)) {
            remoteHookId = "local-dev-" + request.getRepositoryId() + "-" + clock.instant().getEpochSecond();
            log.info("Local delivery URL, skipping GitHub hook creation: repository={}/{}, hookId={}",
                    request.getOwner(), request.getName(), remoteHookId);
        } else {
            Credential credential = credentialResolver.resolve(request.getOwner());
            long hookId = gitHubClient.createRepositoryWebhook(credential.token(), request.getOwner(),
                    request.getName(), deliveryUrl, secret, properties.webhook().events());
            remoteHookId = String.valueOf(hookId);
            log.info("GitHub webhook created: repository={}/{}, hookId={}, credential={}",
                    request.getOwner(), request.getName(), remoteHookId, credential.source());
        }

        WebhookRegistration registration = WebhookRegistration.builder()
                .repositoryId(request.getRepositoryId())
                .owner(request.getOwner())
                .name(request.getName())
                .remoteHookId(remoteHookId)
                .secret(secret)
                .deliveryUrl(deliveryUrl)
                .active(true)
                .build();

        return new Registered(registrationRepository.save(registration), true);
    }

    /**
     * @return false if no registration has the id
     */
    @Transactional
    public boolean deactivate(Long id) {
        return registrationRepository.findById(id)
                .map(registration -> {
                    registration.setActive(false);
                    registrationRepository.save(registration);
                    log.info("Webhook registration deactivated: repository={}, registrationId={}",
                            registration.fullName(), id);
                    return true;
                })
                .orElse(false);
    }

    /**
     * First four characters of the secret, the rest masked.
     */
    public static String secretHint(String secret) {
        if (secret == null || secret.length() <= 4) {
            return "****";
        }
        return secret.substring(0, 4) + "****";
    }

    private String generateSecret() {
        byte[] bytes = new byte[32];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static boolean isLocalDelivery(String deliveryUrl) {
        return deliveryUrl.contains("localhost") || deliveryUrl.contains("127.0.0.1");
    }
}
