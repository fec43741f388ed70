package com.mchekin.runnerdispatch.scheduler;

import com.mchekin.runnerdispatch.config.RunnerProperties;
import com.mchekin.runnerdispatch.repository.WebhookDeliveryLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Component
@RequiredArgsConstructor
@Slf4j
public class DeliveryLogCleanupScheduler {

    private final WebhookDeliveryLogRepository deliveryLogRepository;
    private final RunnerProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${runner.delivery-log.cleanup-cron:0 0 * * * *}")  // Every hour at minute 0
    public void cleanupExpiredDeliveries() {
        Instant threshold = clock.instant().minus(properties.deliveryLog().retention());
        log.info("Starting cleanup of webhook delivery logs older than {}", threshold);

        deliveryLogRepository.deleteByCreatedAtBefore(threshold);

        log.info("Completed cleanup of webhook delivery logs");
    }
}
