package com.mchekin.runnerdispatch.service;

import com.mchekin.runnerdispatch.compute.ComputeFleet;
import com.mchekin.runnerdispatch.compute.FleetOccupancy;
import com.mchekin.runnerdispatch.config.RunnerProperties;
import com.mchekin.runnerdispatch.dto.AdmissionDecision;
import com.mchekin.runnerdispatch.dto.AdmissionRequest;
import com.mchekin.runnerdispatch.dto.Credential;
import com.mchekin.runnerdispatch.dto.RejectionReason;
import com.mchekin.runnerdispatch.github.GitHubClient;
import com.mchekin.runnerdispatch.github.WorkflowJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a provision candidate may launch another runner.
 *
 * <p>Checks run in order: per-repository cooldown, fleet occupancy against the ceiling, queue
 * depth of the triggering workflow run (only for {@code workflow_job} with runners already up),
 * then a registration-token probe with the resolved credential. Acceptance is recorded in the
 * cooldown ledger before the decision is returned; it is never retracted, even if the launch
 * that follows fails.
 *
 * <p>Occupancy and queue depth are read from two eventually consistent systems without a lock,
 * so concurrent deliveries for different repositories can still overshoot by a few tasks. Once
 * the ceiling is reached only {@code workflow_job} events may add runners.
 */
@Service
@Slf4j
public class AdmissionController {

    private final CooldownLedger cooldownLedger;
    private final ComputeFleet computeFleet;
    private final CredentialResolver credentialResolver;
    private final GitHubClient gitHubClient;
    private final Clock clock;
    private final Duration cooldown;
    private final int occupancyCeiling;

    @Autowired
    public AdmissionController(CooldownLedger cooldownLedger, ComputeFleet computeFleet,
                               CredentialResolver credentialResolver, GitHubClient gitHubClient,
                               Clock clock, RunnerProperties properties) {
        this(cooldownLedger, computeFleet, credentialResolver, gitHubClient, clock,
                properties.admission().cooldown(), properties.admission().occupancyCeiling());
    }

    AdmissionController(CooldownLedger cooldownLedger, ComputeFleet computeFleet,
                        CredentialResolver credentialResolver, GitHubClient gitHubClient,
                        Clock clock, Duration cooldown, int occupancyCeiling) {
        this.cooldownLedger = cooldownLedger;
        this.computeFleet = computeFleet;
        this.credentialResolver = credentialResolver;
        this.gitHubClient = gitHubClient;
        this.clock = clock;
        this.cooldown = cooldown;
        this.occupancyCeiling = occupancyCeiling;
    }

    public AdmissionDecision admit(AdmissionRequest request) {
        return cooldownLedger.withRepositoryLock(request.repositoryId(), () -> evaluate(request));
    }

    private AdmissionDecision evaluate(AdmissionRequest request) {
        String repository = request.owner() + "/" + request.name();
        Instant now = clock.instant();

        Optional<Instant> lastAccepted = cooldownLedger.lastAccepted(request.repositoryId());
        if (lastAccepted.isPresent()) {
            Duration sinceLast = Duration.between(lastAccepted.get(), now);
            if (sinceLast.compareTo(cooldown) < 0) {
                log.info("Cooldown active: repository={}, event={}, sinceLastMs={}",
                        repository, request.eventType(), sinceLast.toMillis());
                return AdmissionDecision.reject(RejectionReason.COOLDOWN_ACTIVE);
            }
        }

        int occupancy;
        try {
            FleetOccupancy fleet = computeFleet.occupancy();
            occupancy = fleet.total();
            log.info("Active tasks: repository={}, total={}, running={}, pending={}",
                    repository, occupancy, fleet.running(), fleet.pending());
        } catch (RuntimeException e) {
            log.warn("Occupancy query failed, treating fleet as saturated: repository={}", repository, e);
            return AdmissionDecision.reject(RejectionReason.CAPACITY_SATURATED);
        }

        if (occupancy >= occupancyCeiling) {
            if (!request.workflowJob()) {
                log.info("Capacity saturated: repository={}, event={}, occupancy={}",
                        repository, request.eventType(), occupancy);
                return AdmissionDecision.reject(RejectionReason.CAPACITY_SATURATED);
            }
            log.info("Allowing workflow_job past saturation: repository={}, occupancy={}", repository, occupancy);
        }

        Credential credential = null;

        if (occupancy > 0 && request.workflowJob()) {
            try {
                credential = credentialResolver.resolve(request.owner());
            } catch (NoCredentialException e) {
                log.warn("No credential for queue check: repository={}", repository);
                return AdmissionDecision.reject(RejectionReason.NO_CREDENTIAL);
            } catch (RuntimeException e) {
                log.warn("Credential exchange failed during queue check: repository={}", repository, e);
                return AdmissionDecision.reject(RejectionReason.QUEUE_CHECK_FAILED);
            }

            try {
                List<WorkflowJob> jobs = gitHubClient.listRunJobs(credential.token(),
                        request.owner(), request.name(), request.runId() == null ? 0L : request.runId());
                long queued = jobs.stream().filter(WorkflowJob::queued).count();
                long inProgress = jobs.stream().filter(WorkflowJob::inProgress).count();

                if (occupancy >= queued) {
                    log.info("Sufficient runners: repository={}, occupancy={}, queued={}, inProgress={}",
                            repository, occupancy, queued, inProgress);
                    return AdmissionDecision.reject(RejectionReason.SUFFICIENT_RUNNERS);
                }
                log.info("Queue needs runners: repository={}, occupancy={}, queued={}, inProgress={}",
                        repository, occupancy, queued, inProgress);
            } catch (RuntimeException e) {
                log.warn("Queue check failed with runners active, skipping: repository={}, occupancy={}",
                        repository, occupancy, e);
                return AdmissionDecision.reject(RejectionReason.QUEUE_CHECK_FAILED);
            }
        }

        if (credential == null) {
            try {
                credential = credentialResolver.resolve(request.owner());
            } catch (NoCredentialException e) {
                log.warn("No credential for repository={}", repository);
                return AdmissionDecision.reject(RejectionReason.NO_CREDENTIAL);
            } catch (RuntimeException e) {
                log.warn("Credential exchange failed: repository={}", repository, e);
                return AdmissionDecision.reject(RejectionReason.INSUFFICIENT_PERMISSIONS);
            }
        }

        try {
            gitHubClient.createRegistrationToken(credential.token(), request.owner(), request.name());
        } catch (RuntimeException e) {
            log.warn("Credential cannot register runners: repository={}, source={}",
                    repository, credential.source(), e);
            return AdmissionDecision.reject(RejectionReason.INSUFFICIENT_PERMISSIONS);
        }

        cooldownLedger.recordAccepted(request.repositoryId(), clock.instant());
        log.info("Admission accepted: repository={}, trigger={}, occupancy={}, credential={}",
                repository, request.triggerAnnotation(), occupancy, credential.source());

        return AdmissionDecision.accept(credential, request.triggerAnnotation());
    }
}
