package com.mchekin.runnerdispatch.repository;

import com.mchekin.runnerdispatch.domain.Installation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface InstallationRepository extends JpaRepository<Installation, Long> {

    Optional<Installation> findByInstallationId(Long installationId);

    Optional<Installation> findFirstByAccountLoginIgnoreCase(String accountLogin);

    List<Installation> findAllByOrderByAccountLoginAsc();

    @Modifying
    @Transactional
    long deleteByInstallationId(Long installationId);
}
