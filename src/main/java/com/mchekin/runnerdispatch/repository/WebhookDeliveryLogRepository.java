package com.mchekin.runnerdispatch.repository;

import com.mchekin.runnerdispatch.domain.WebhookDeliveryLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface WebhookDeliveryLogRepository extends JpaRepository<WebhookDeliveryLog, Long> {

    Page<WebhookDeliveryLog> findByRegistrationIdOrderByCreatedAtDesc(Long registrationId, Pageable pageable);

    @Modifying
    @Transactional
    void deleteByCreatedAtBefore(Instant threshold);
}
