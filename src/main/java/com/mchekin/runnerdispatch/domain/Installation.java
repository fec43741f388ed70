package com.mchekin.runnerdispatch.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "installations",
    indexes = {
        @Index(name = "idx_installation_account_login", columnList = "accountLogin")
    },
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_installation_id", columnNames = "installationId")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Installation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long installationId;

    @Column(nullable = false)
    private Long accountId;

    @Column(nullable = false, length = 100)
    private String accountLogin;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AccountType accountType;

    private Instant suspendedAt;  // null = active

    @Column(columnDefinition = "TEXT")
    private String permissions;

    @Column(columnDefinition = "TEXT")
    private String events;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public boolean isSuspended() {
        return suspendedAt != null;
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
