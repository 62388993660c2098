package com.meisai.ingest.storage;

import com.meisai.common.error.ErrorKind;
import com.meisai.common.error.MeisaiException;
import com.meisai.ingest.config.HashIndexProperties;
import com.meisai.ingest.entity.StatementRecord;
import com.meisai.ingest.repository.StatementRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.Supplier;

@Slf4j
@Component
public class JpaStatementStore implements StatementStore {

    private final StatementRecordRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final int pageSize;

    public JpaStatementStore(StatementRecordRepository repository,
                             PlatformTransactionManager transactionManager,
                             HashIndexProperties hashIndexProperties) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.pageSize = hashIndexProperties.getLoadBatchSize();
    }

    @Override
    public StatementRecord create(StatementRecord record) {
        if (record.getId() != null) {
            throw MeisaiException.validation("id", "new statement record must not carry an id");
        }
        return guarded("insert statement record", () -> repository.save(record));
    }

    @Override
    public Optional<StatementRecord> get(Long id) {
        return guarded("load statement record", () -> repository.findById(id));
    }

    @Override
    public StatementRecord update(Long id, StatementRecord replacement) {
        return guarded("update statement record", () -> {
            StatementRecord existing = repository.findById(id)
                    .orElseThrow(() -> new MeisaiException(ErrorKind.STORAGE_ERROR,
                            "statement record vanished before update", Map.of("recordId", id)));
            existing.setDate(replacement.getDate());
            existing.setTime(replacement.getTime());
            existing.setEntryPoint(replacement.getEntryPoint());
            existing.setExitPoint(replacement.getExitPoint());
            existing.setTollAmount(replacement.getTollAmount());
            existing.setVehicleNumber(replacement.getVehicleNumber());
            existing.setCardNumber(replacement.getCardNumber());
            existing.setContentHash(replacement.getContentHash());
            existing.setExitDate(replacement.getExitDate());
            existing.setExitTime(replacement.getExitTime());
            existing.setTollStationName(replacement.getTollStationName());
            existing.setUsageCategory(replacement.getUsageCategory());
            existing.setVehicleClass(replacement.getVehicleClass());
            existing.setRemarks(replacement.getRemarks());
            existing.setImportSessionId(replacement.getImportSessionId());
            return repository.save(existing);
        });
    }

    @Override
    public void delete(Long id) {
        guarded("delete statement record", () -> {
            repository.deleteById(id);
            return null;
        });
    }

    @Override
    public List<StatementRecord> bulkInsert(List<StatementRecord> records) {
        return withTransaction(() -> guarded("bulk insert statement records", () -> repository.saveAll(records)));
    }

    @Override
    public Optional<StatementRecord> getByHash(String contentHash) {
        return guarded("load statement record by hash", () -> repository.findByContentHash(contentHash));
    }

    @Override
    public Map<String, Boolean> checkDuplicatesByHash(Collection<String> contentHashes) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        if (contentHashes.isEmpty()) {
            return result;
        }
        Set<String> stored = new HashSet<>();
        guarded("check duplicates by hash", () -> repository.findByContentHashIn(contentHashes))
                .forEach(r -> stored.add(r.getContentHash()));
        contentHashes.forEach(h -> result.put(h, stored.contains(h)));
        return result;
    }

    @Override
    public <T> T withTransaction(Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (TransactionException | DataAccessException e) {
            throw MeisaiException.storage("transaction failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long loadHashIndex(Consumer<StatementRecord> consumer) {
        long visited = 0;
        int page = 0;
        Page<StatementRecord> slice;
        do {
            PageRequest request = PageRequest.of(page++, pageSize, Sort.by("id"));
            slice = guarded("page statement records", () -> repository.findAll(request));
            slice.forEach(consumer);
            visited += slice.getNumberOfElements();
        } while (slice.hasNext());
        log.info("Visited {} stored statement records for hash index warm-up", visited);
        return visited;
    }

    @Override
    public void setExternalReference(Long id, String externalReferenceNumber) {
        int updated = withTransaction(() -> guarded("set external reference",
                () -> repository.updateExternalReference(id, externalReferenceNumber, Instant.now())));
        if (updated == 0) {
            log.warn("No statement record {} to attach external reference {}", id, externalReferenceNumber);
        }
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("Storage failure during {}: {}", operation, e.getMessage());
            throw MeisaiException.storage(operation + " failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
