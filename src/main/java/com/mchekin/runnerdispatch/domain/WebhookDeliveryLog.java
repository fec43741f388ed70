package com.mchekin.runnerdispatch.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit row for a verified inbound delivery. Never read back for deduplication.
 */
@Entity
@Table(name = "webhook_delivery_logs",
    indexes = {
        @Index(name = "idx_webhook_delivery_registration_id", columnList = "registrationId"),
        @Index(name = "idx_webhook_delivery_created_at", columnList = "createdAt")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookDeliveryLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long registrationId;  // null = verified with the app webhook secret

    @Column(length = 100)
    private String deliveryId;

    @Column(nullable = false, length = 100)
    private String event;

    @Column(length = 100)
    private String action;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private DeliveryOutcome outcome;

    @Column(length = 500)
    private String detail;

    @Column(nullable = false)
    private Long durationMs;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
