package com.meisai.ingest.repository;

import com.meisai.ingest.entity.StatementRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface StatementRecordRepository extends JpaRepository<StatementRecord, Long> {

    Optional<StatementRecord> findByContentHash(String contentHash);

    List<StatementRecord> findByContentHashIn(Collection<String> contentHashes);

    @Modifying(clearAutomatically = true)
    @Query("update StatementRecord s set s.externalReferenceNumber = :ref, s.updatedAt = :now where s.id = :id")
    int updateExternalReference(@Param("id") Long id, @Param("ref") String externalReferenceNumber,
                                @Param("now") Instant now);
}
