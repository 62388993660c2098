package com.meisai.ingest.repository;

import com.meisai.ingest.entity.AccountType;
import com.meisai.ingest.entity.ImportSession;
import com.meisai.ingest.entity.ImportStatus;
import org.springframework.data.jpa.domain.Specification;

/** Optional filters of the session listing; a null argument matches everything. */
public final class ImportSessionSpecifications {

    private ImportSessionSpecifications() {
    }

    public static Specification<ImportSession> hasAccountType(AccountType accountType) {
        return (root, query, cb) -> accountType == null ? null : cb.equal(root.get("accountType"), accountType);
    }

    public static Specification<ImportSession> hasAccountId(String accountId) {
        return (root, query, cb) -> accountId == null ? null : cb.equal(root.get("accountId"), accountId);
    }

    public static Specification<ImportSession> hasStatus(ImportStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    public static Specification<ImportSession> createdBy(String createdBy) {
        return (root, query, cb) -> createdBy == null ? null : cb.equal(root.get("createdBy"), createdBy);
    }
}
