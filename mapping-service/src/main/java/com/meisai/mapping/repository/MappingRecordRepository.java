package com.meisai.mapping.repository;

import com.meisai.mapping.entity.ExternalEntityType;
import com.meisai.mapping.entity.MappingRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;
import java.util.Optional;

public interface MappingRecordRepository extends JpaRepository<MappingRecord, Long>,
        JpaSpecificationExecutor<MappingRecord> {

    Optional<MappingRecord> findByActiveSlot(String activeSlot);

    boolean existsByStatementRecordIdAndExternalEntityTypeAndExternalEntityId(
            Long statementRecordId, ExternalEntityType externalEntityType, String externalEntityId);

    List<MappingRecord> findByStatementRecordId(Long statementRecordId);
}
