package com.mchekin.runnerdispatch.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Entity
@Table(name = "webhook_registrations",
    indexes = {
        @Index(name = "idx_registration_repository_active", columnList = "repositoryId,active"),
        @Index(name = "idx_registration_active", columnList = "active")
    },
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_registration_repository_hook", columnNames = {"repositoryId", "remoteHookId"})
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookRegistration {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long repositoryId;

    @Column(nullable = false, length = 100)
    private String owner;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 100)
    private String remoteHookId;

    @ToString.Exclude
    @Column(nullable = false, length = 255)
    private String secret;

    @Column(nullable = false, length = 2048)
    private String deliveryUrl;

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public String fullName() {
        return owner + "/" + name;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
