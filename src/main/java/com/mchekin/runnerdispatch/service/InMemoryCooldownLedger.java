package com.mchekin.runnerdispatch.service;

import com.mchekin.runnerdispatch.config.RunnerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Entries older than the horizon are pruned on every access. Lost on restart.
 */
@Component
@Slf4j
public class InMemoryCooldownLedger implements CooldownLedger {

    private final Clock clock;
    private final Duration horizon;

    private final Map<Long, Instant> acceptedAt = new ConcurrentHashMap<>();
    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Autowired
    public InMemoryCooldownLedger(Clock clock, RunnerProperties properties) {
        this(clock, properties.admission().ledgerHorizon());
    }

    InMemoryCooldownLedger(Clock clock, Duration horizon) {
        this.clock = clock;
        this.horizon = horizon;
    }

    @Override
    public Optional<Instant> lastAccepted(Long repositoryId) {
        prune();
        return Optional.ofNullable(acceptedAt.get(repositoryId));
    }

    @Override
    public void recordAccepted(Long repositoryId, Instant at) {
        prune();
        acceptedAt.put(repositoryId, at);
    }

    @Override
    public <T> T withRepositoryLock(Long repositoryId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(repositoryId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        return acceptedAt.size();
    }

    private void prune() {
        Instant threshold = clock.instant().minus(horizon);
        if (acceptedAt.values().removeIf(at -> at.isBefore(threshold))) {
            log.debug("Pruned cooldown entries older than {}", threshold);
        }
    }
}
