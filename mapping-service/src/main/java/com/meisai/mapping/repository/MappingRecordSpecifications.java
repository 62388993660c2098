package com.meisai.mapping.repository;

import com.meisai.mapping.entity.ExternalEntityType;
import com.meisai.mapping.entity.MappingRecord;
import com.meisai.mapping.entity.MappingStatus;
import com.meisai.mapping.entity.MatchType;
import org.springframework.data.jpa.domain.Specification;

/** Optional filters of the mapping listing; a null argument matches everything. */
public final class MappingRecordSpecifications {

    private MappingRecordSpecifications() {
    }

    public static Specification<MappingRecord> forStatement(Long statementRecordId) {
        return (root, query, cb) -> statementRecordId == null ? null
                : cb.equal(root.get("statementRecordId"), statementRecordId);
    }

    public static Specification<MappingRecord> hasMatchType(MatchType matchType) {
        return (root, query, cb) -> matchType == null ? null : cb.equal(root.get("matchType"), matchType);
    }

    public static Specification<MappingRecord> hasStatus(MappingStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    public static Specification<MappingRecord> hasEntityType(ExternalEntityType entityType) {
        return (root, query, cb) -> entityType == null ? null
                : cb.equal(root.get("externalEntityType"), entityType);
    }
}
