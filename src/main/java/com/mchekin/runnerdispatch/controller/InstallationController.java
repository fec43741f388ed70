package com.mchekin.runnerdispatch.controller;

import com.mchekin.runnerdispatch.domain.Installation;
import com.mchekin.runnerdispatch.dto.InstallationResponse;
import com.mchekin.runnerdispatch.github.GitHubApiException;
import com.mchekin.runnerdispatch.service.InstallationDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/installations")
@RequiredArgsConstructor
@Slf4j
public class InstallationController {

    private final InstallationDirectory installationDirectory;

    @GetMapping
    public ResponseEntity<List<InstallationResponse>> listInstallations() {
        List<InstallationResponse> responses = installationDirectory.list().stream()
                .map(this::toResponse)
                .toList();

        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{installationId}")
    public ResponseEntity<InstallationResponse> getInstallation(@PathVariable Long installationId) {
        return installationDirectory.findByInstallationId(installationId)
                .map(installation -> ResponseEntity.ok(toResponse(installation)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{installationId}/sync")
    public ResponseEntity<InstallationResponse> syncInstallation(@PathVariable Long installationId) {
        try {
            return installationDirectory.sync(installationId)
                    .map(installation -> ResponseEntity.ok(toResponse(installation)))
                    .orElse(ResponseEntity.notFound().build());
        } catch (GitHubApiException | IllegalStateException e) {
            log.error("Installation sync failed: installationId={}", installationId, e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).build();
        }
    }

    private InstallationResponse toResponse(Installation installation) {
        return InstallationResponse.builder()
                .installationId(installation.getInstallationId())
                .accountId(installation.getAccountId())
                .accountLogin(installation.getAccountLogin())
                .accountType(installation.getAccountType())
                .suspendedAt(installation.getSuspendedAt())
                .createdAt(installation.getCreatedAt())
                .updatedAt(installation.getUpdatedAt())
                .build();
    }
}
