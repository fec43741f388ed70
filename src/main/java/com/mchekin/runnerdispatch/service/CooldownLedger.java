package com.mchekin.runnerdispatch.service;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Process-local record of the last accepted provisioning decision per repository.
 */
public interface CooldownLedger {

    Optional<Instant> lastAccepted(Long repositoryId);

    void recordAccepted(Long repositoryId, Instant acceptedAt);

    /**
     * Runs {@code action} while holding the repository's lock, so a check and the matching
     * {@link #recordAccepted} cannot interleave with another delivery for the same repository.
     */
    <T> T withRepositoryLock(Long repositoryId, Supplier<T> action);
}
