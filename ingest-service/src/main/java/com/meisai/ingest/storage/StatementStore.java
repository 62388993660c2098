package com.meisai.ingest.storage;

import com.meisai.ingest.entity.StatementRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Persistence seam for statement records. Failures surface as
 * {@link com.meisai.common.error.MeisaiException} of kind STORAGE_ERROR; nothing is retried here.
 */
public interface StatementStore {

    StatementRecord create(StatementRecord record);

    Optional<StatementRecord> get(Long id);

    /** Replaces the business fields of an existing record. */
    StatementRecord update(Long id, StatementRecord replacement);

    void delete(Long id);

    List<StatementRecord> bulkInsert(List<StatementRecord> records);

    Optional<StatementRecord> getByHash(String contentHash);

    /** Every requested hash is present in the result, mapped to whether it is stored. */
    Map<String, Boolean> checkDuplicatesByHash(Collection<String> contentHashes);

    <T> T withTransaction(Supplier<T> work);

    /** Streams every stored record to the consumer, page by page. Returns the number visited. */
    long loadHashIndex(Consumer<StatementRecord> consumer);

    void setExternalReference(Long id, String externalReferenceNumber);
}
