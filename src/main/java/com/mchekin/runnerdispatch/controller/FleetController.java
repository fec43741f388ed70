package com.mchekin.runnerdispatch.controller;

import com.mchekin.runnerdispatch.compute.ComputeFleet;
import com.mchekin.runnerdispatch.compute.FleetOccupancy;
import com.mchekin.runnerdispatch.config.RunnerProperties;
import com.mchekin.runnerdispatch.dto.Credential;
import com.mchekin.runnerdispatch.dto.FleetStatusResponse;
import com.mchekin.runnerdispatch.dto.RunnerTokenResponse;
import com.mchekin.runnerdispatch.github.AccessToken;
import com.mchekin.runnerdispatch.github.GitHubApiException;
import com.mchekin.runnerdispatch.github.GitHubClient;
import com.mchekin.runnerdispatch.service.CredentialResolver;
import com.mchekin.runnerdispatch.service.NoCredentialException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Operational views of the runner fleet.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class FleetController {

    private final ComputeFleet computeFleet;
    private final CredentialResolver credentialResolver;
    private final GitHubClient gitHubClient;
    private final RunnerProperties properties;

    @GetMapping("/fleet")
    public ResponseEntity<FleetStatusResponse> getFleetStatus() {
        try {
            FleetOccupancy occupancy = computeFleet.occupancy();
            return ResponseEntity.ok(FleetStatusResponse.builder()
                    .running(occupancy.running())
                    .pending(occupancy.pending())
                    .total(occupancy.total())
                    .ceiling(properties.admission().occupancyCeiling())
                    .build());
        } catch (SdkException e) {
            log.error("Fleet occupancy query failed", e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).build();
        }
    }

    @PostMapping("/runners/{owner}/{repo}/removal-token")
    public ResponseEntity<RunnerTokenResponse> createRemovalToken(@PathVariable String owner,
                                                                  @PathVariable String repo) {
        try {
            Credential credential = credentialResolver.resolve(owner);
            AccessToken token = gitHubClient.createRemovalToken(credential.token(), owner, repo);
            log.info("Runner removal token issued: repository={}/{}", owner, repo);
            return ResponseEntity.ok(RunnerTokenResponse.builder()
                    .token(token.token())
                    .expiresAt(token.expiresAt())
                    .build());
        } catch (NoCredentialException e) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).build();
        } catch (GitHubApiException e) {
            log.error("Runner removal token failed: repository={}/{}, status={}", owner, repo, e.getStatusCode(), e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).build();
        }
    }
}
