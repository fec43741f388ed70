package com.mchekin.runnerdispatch.repository;

import com.mchekin.runnerdispatch.domain.WebhookRegistration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WebhookRegistrationRepository extends JpaRepository<WebhookRegistration, Long> {

    List<WebhookRegistration> findByActiveTrue();

    Optional<WebhookRegistration> findFirstByRepositoryIdAndActiveTrue(Long repositoryId);

    List<WebhookRegistration> findByRepositoryId(Long repositoryId);
}
