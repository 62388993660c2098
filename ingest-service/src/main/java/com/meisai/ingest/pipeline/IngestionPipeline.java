package com.meisai.ingest.pipeline;

import com.meisai.common.error.ErrorKind;
import com.meisai.common.error.MeisaiException;
import com.meisai.common.model.ImportProgress;
import com.meisai.ingest.config.ImportProperties;
import com.meisai.ingest.entity.ImportSession;
import com.meisai.ingest.entity.StatementRecord;
import com.meisai.ingest.hash.Classification;
import com.meisai.ingest.hash.HashDecision;
import com.meisai.ingest.hash.HashIndex;
import com.meisai.ingest.kafka.StatementEventPublisher;
import com.meisai.ingest.parser.FirstLineKind;
import com.meisai.ingest.parser.StatementCsvParser;
import com.meisai.ingest.repository.ImportSessionRepository;
import com.meisai.ingest.session.ActiveImport;
import com.meisai.ingest.session.ImportSessionRegistry;
import com.meisai.ingest.session.ProgressListener;
import com.meisai.ingest.storage.StatementStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drives complete CSV rows of one session through parse, classify and persist.
 * <p>
 * Every method expects the caller to hold the session lock, so rows of a session are handled
 * strictly in order. Row problems are counted and the session carries on; session level
 * problems ({@link ErrorKind#STREAM_ERROR}) propagate to the caller, which fails the session.
 */
@Slf4j
@Component
public class IngestionPipeline {

    private final StatementCsvParser parser;
    private final HashIndex hashIndex;
    private final StatementStore statementStore;
    private final ImportSessionRepository sessionRepository;
    private final ImportSessionRegistry registry;
    private final StatementEventPublisher eventPublisher;
    private final ObjectProvider<ProgressListener> listeners;
    private final ImportProperties properties;

    public IngestionPipeline(StatementCsvParser parser,
                             HashIndex hashIndex,
                             StatementStore statementStore,
                             ImportSessionRepository sessionRepository,
                             ImportSessionRegistry registry,
                             StatementEventPublisher eventPublisher,
                             ObjectProvider<ProgressListener> listeners,
                             ImportProperties properties) {
        this.parser = parser;
        this.hashIndex = hashIndex;
        this.statementStore = statementStore;
        this.sessionRepository = sessionRepository;
        this.registry = registry;
        this.eventPublisher = eventPublisher;
        this.listeners = listeners;
        this.properties = properties;
    }

    /**
     * Processes the rows recovered from one piece of input.
     *
     * @param lines complete CSV rows in source order
     * @param last  true when no further input follows; the row total is then confirmed up front
     */
    public void processRows(ActiveImport active, List<String> lines, boolean last) {
        ImportSession session = active.getSession();
        int first = 0;
        if (!active.isHeaderResolved() && !lines.isEmpty()) {
            first = resolveHeader(active, lines.get(0)) ? 1 : 0;
        }
        List<String> dataRows = lines.subList(first, lines.size());

        session.discoverRows(dataRows.size());
        if (last) {
            session.confirmTotalRows();
        }
        if (!dataRows.isEmpty()) {
            session.startProcessing();
        }

        int interval = Math.max(1, properties.getProgressIntervalRows());
        for (String line : dataRows) {
            if (active.isCancelled()) {
                log.info("Session {} cancelled, {} rows left unprocessed", active.getSessionId(),
                        session.getTotalRows() - session.getProcessedRows());
                return;
            }
            processRow(active, line);
            if (session.getProcessedRows() % interval == 0) {
                emit(active);
            }
        }
    }

    /** Snapshot + checkpoint after a chunk that did not end the input. */
    public void chunkProcessed(ActiveImport active) {
        emit(active);
    }

    /** End of input: completed, or failed when the error rate is above tolerance. */
    public void complete(ActiveImport active) {
        ImportSession session = active.getSession();
        session.complete(properties.getMaxErrorRate());
        terminate(active);
        log.info("Session {} {}: processed={} success={} duplicate={} error={}", session.getSessionId(),
                session.getStatus().wireName(), session.getProcessedRows(), session.getSuccessRows(),
                session.getDuplicateRows(), session.getErrorRows());
    }

    /** Session level failure. Already persisted rows stay. */
    public void fail(ActiveImport active, String reason) {
        ImportSession session = active.getSession();
        if (session.fail(reason)) {
            log.warn("Session {} failed after {} rows: {}", session.getSessionId(), session.getProcessedRows(), reason);
        }
        terminate(active);
    }

    private void terminate(ActiveImport active) {
        if (active.getReassembler() != null) {
            active.getReassembler().release();
        }
        try {
            emit(active);
        } finally {
            registry.remove(active);
        }
    }

    private boolean resolveHeader(ActiveImport active, String line) {
        active.setHeaderResolved(true);
        List<String> cells;
        try {
            cells = parser.split(line);
        } catch (MeisaiException e) {
            throw MeisaiException.stream(active.getSessionId(), "malformed header row: " + e.getMessage());
        }
        FirstLineKind kind = parser.classifyFirstLine(cells);
        if (kind == FirstLineKind.MALFORMED) {
            throw MeisaiException.stream(active.getSessionId(),
                    "malformed header row: expected 13 columns, got " + cells.size());
        }
        if (kind == FirstLineKind.HEADER) {
            active.nextLine();
            return true;
        }
        return false;
    }

    private void processRow(ActiveImport active, String line) {
        ImportSession session = active.getSession();
        long lineNumber = active.nextLine();
        int logLimit = properties.getErrorLogLimit();

        StatementRecord record;
        try {
            record = parser.parse(parser.split(line));
        } catch (MeisaiException e) {
            log.debug("Session {} line {}: {}", session.getSessionId(), lineNumber, e.getMessage());
            session.recordError(lineNumber, e.getKind(), e.getMessage(), logLimit);
            return;
        }
        record.setAccountType(session.getAccountType() == null ? null : session.getAccountType().wireName());
        record.setAccountId(session.getAccountId());
        record.setImportSessionId(session.getSessionId());

        ImportOptions options = active.getOptions();
        try {
            String contentHash = hashIndex.fingerprint(record);
            registerIfStored(active, contentHash);
            HashDecision decision = options.isValidateOnly()
                    ? validate(active, contentHash, record)
                    : hashIndex.classify(contentHash, record, d -> persist(active, record, d));
            count(active, lineNumber, decision);
        } catch (MeisaiException e) {
            log.warn("Session {} line {} not stored: {}", session.getSessionId(), lineNumber, e.getMessage());
            session.recordError(lineNumber, e.getKind(), e.getMessage(), logLimit);
        }
    }

    /**
     * The index can lag behind storage after a clear or a warm-up from an old snapshot. A fingerprint
     * the index misses but storage holds is indexed first, so the row classifies as DUPLICATE.
     */
    private void registerIfStored(ActiveImport active, String contentHash) {
        if (hashIndex.contains(contentHash)) {
            return;
        }
        statementStore.getByHash(contentHash).ifPresent(stored -> {
            log.debug("Session {}: fingerprint {} found in storage only, indexing record {}",
                    active.getSessionId(), contentHash, stored.getId());
            hashIndex.register(stored);
        });
    }

    /** Dry run: a fingerprint already seen earlier in the same input counts as DUPLICATE, as it would when stored. */
    private HashDecision validate(ActiveImport active, String contentHash, StatementRecord record) {
        HashDecision decision = hashIndex.peek(contentHash, record);
        if (decision.getClassification() != Classification.DUPLICATE && !active.markValidated(contentHash)) {
            return decision.toBuilder().classification(Classification.DUPLICATE).build();
        }
        return decision;
    }

    private void count(ActiveImport active, long lineNumber, HashDecision decision) {
        ImportSession session = active.getSession();
        if (decision.getClassification() != Classification.DUPLICATE) {
            session.recordSuccess();
        } else if (active.getOptions().isSkipDuplicates()) {
            session.recordDuplicate();
        } else {
            String message = decision.getRecordId() == null
                    ? "duplicate of an earlier row" : "duplicate of statement record " + decision.getRecordId();
            session.recordError(lineNumber, ErrorKind.VALIDATION_ERROR, message, properties.getErrorLogLimit());
        }
    }

    private Long persist(ActiveImport active, StatementRecord record, HashDecision decision) {
        record.setContentHash(decision.getContentHash());
        if (decision.getClassification() == Classification.CHANGED) {
            if (active.getOptions().isUpdateExisting()) {
                StatementRecord updated = statementStore.withTransaction(
                        () -> statementStore.update(decision.getPreviousRecordId(), record));
                active.recordUpdated();
                log.info("Session {} updated statement record {} (content changed)",
                        active.getSessionId(), updated.getId());
                return updated.getId();
            }
            log.warn("Session {}: row conflicts with statement record {} (same date/time/card, different content), stored separately",
                    active.getSessionId(), decision.getPreviousRecordId());
        }
        StatementRecord saved = statementStore.withTransaction(() -> {
            StatementRecord created = statementStore.create(record);
            eventPublisher.publishAfterCommit(created);
            return created;
        });
        return saved.getId();
    }

    private void emit(ActiveImport active) {
        ImportSession session = active.getSession();
        ImportProgress progress = session.toProgress();
        active.getProgress().offer(progress);
        listeners.orderedStream().forEach(listener -> {
            try {
                listener.onProgress(progress);
            } catch (RuntimeException e) {
                log.warn("Progress listener {} failed for session {}: {}",
                        listener.getClass().getSimpleName(), session.getSessionId(), e.getMessage());
            }
        });
        checkpoint(session);
    }

    private void checkpoint(ImportSession session) {
        try {
            sessionRepository.save(session);
        } catch (DataAccessException e) {
            throw MeisaiException.storage("could not save import session " + session.getSessionId(), e);
        }
    }
}
