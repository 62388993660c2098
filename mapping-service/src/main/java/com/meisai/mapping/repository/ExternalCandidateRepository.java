package com.meisai.mapping.repository;

import com.meisai.mapping.entity.ExternalCandidate;
import com.meisai.mapping.entity.ExternalEntityType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ExternalCandidateRepository extends JpaRepository<ExternalCandidate, Long> {

    Optional<ExternalCandidate> findByEntityTypeAndEntityId(ExternalEntityType entityType, String entityId);

    List<ExternalCandidate> findByDateBetween(LocalDate from, LocalDate to);

    Page<ExternalCandidate> findByEntityType(ExternalEntityType entityType, Pageable pageable);
}
