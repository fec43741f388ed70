package com.mchekin.runnerdispatch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mchekin.runnerdispatch.domain.AccountType;
import com.mchekin.runnerdispatch.domain.Installation;
import com.mchekin.runnerdispatch.github.GitHubClient;
import com.mchekin.runnerdispatch.repository.InstallationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Maps GitHub accounts to their App installation. Written by installation lifecycle events and
 * manual syncs, read when resolving credentials.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InstallationDirectory {

    private final InstallationRepository installationRepository;
    private final GitHubClient gitHubClient;
    private final AppJwtSigner appJwtSigner;

    public Optional<Installation> findByAccountLogin(String accountLogin) {
        return installationRepository.findFirstByAccountLoginIgnoreCase(accountLogin);
    }

    public Optional<Installation> findByInstallationId(Long installationId) {
        return installationRepository.findByInstallationId(installationId);
    }

    public List<Installation> list() {
        return installationRepository.findAllByOrderByAccountLoginAsc();
    }

    /**
     * Applies an {@code installation} or {@code installation_repositories} event.
     */
    @Transactional
    public void apply(String eventType, JsonNode payload) {
        String action = payload.path("action").asText("");
        JsonNode installation = payload.path("installation");
        String login = installation.path("account").path("login").asText("unknown");

        if ("installation_repositories".equals(eventType)) {
            int added = payload.path("repositories_added").size();
            int removed = payload.path("repositories_removed").size();
            log.info("Installation repositories changed: account={}, action={}, added={}, removed={}",
                    login, action, added, removed);
            return;
        }

        switch (action) {
            case "created", "new_permissions_accepted" -> {
                Installation saved = upsert(installation);
                log.info("GitHub App installed: account={}, installationId={}",
                        saved.getAccountLogin(), saved.getInstallationId());
            }
            case "deleted" -> {
                long deleted = installationRepository.deleteByInstallationId(installation.path("id").asLong());
                log.info("GitHub App uninstalled: account={}, installationId={}, removed={}",
                        login, installation.path("id").asLong(), deleted);
            }
            case "suspend", "unsuspend" -> {
                Installation saved = upsert(installation);
                log.info("GitHub App {}ed: account={}, installationId={}",
                        action, saved.getAccountLogin(), saved.getInstallationId());
            }
            default -> log.info("Installation event ignored: account={}, action={}", login, action);
        }
    }

    /**
     * Refreshes one installation from GitHub's list of app installations.
     *
     * @return the stored installation, or empty if the app does not list it
     */
    @Transactional
    public Optional<Installation> sync(Long installationId) {
        for (JsonNode candidate : gitHubClient.listInstallations(appJwtSigner.mint())) {
            if (candidate.path("id").asLong() == installationId) {
                return Optional.of(upsert(candidate));
            }
        }
        log.warn("Installation not listed by GitHub: installationId={}", installationId);
        return Optional.empty();
    }

    Installation upsert(JsonNode node) {
        Long installationId = node.path("id").asLong();
        JsonNode account = node.path("account");

        Installation installation = installationRepository.findByInstallationId(installationId)
                .orElseGet(() -> Installation.builder().installationId(installationId).build());

        installation.setAccountId(account.path("id").asLong());
        installation.setAccountLogin(account.path("login").asText());
        installation.setAccountType(AccountType.fromGitHub(account.path("type").asText()));
        installation.setSuspendedAt(parseTimestamp(node.path("suspended_at").asText(null)));
        installation.setPermissions(node.path("permissions").toString());
        installation.setEvents(node.path("events").toString());

        return installationRepository.save(installation);
    }

    private static Instant parseTimestamp(String value) {
        return value == null || value.isBlank() ? null : OffsetDateTime.parse(value).toInstant();
    }
}
