package com.meisai.ingest.service;

import com.meisai.common.error.ErrorKind;
import com.meisai.common.error.MeisaiException;
import com.meisai.common.model.ImportChunk;
import com.meisai.common.model.ImportProgress;
import com.meisai.ingest.dto.ImportSessionSummary;
import com.meisai.ingest.dto.OpenStreamRequest;
import com.meisai.ingest.entity.AccountType;
import com.meisai.ingest.entity.ImportMode;
import com.meisai.ingest.entity.ImportSession;
import com.meisai.ingest.pipeline.IngestionPipeline;
import com.meisai.ingest.session.ActiveImport;
import com.meisai.ingest.session.ImportSessionRegistry;
import com.meisai.ingest.stream.ReassembledRows;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Streamed import: an ordered series of chunks per session, from HTTP or Kafka.
 * Each call returns the progress snapshots produced while handling that chunk.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreamingImportService {

    private static final int MAX_SESSION_ID_LENGTH = 36;

    private final ImportSessionService sessionService;
    private final ImportSessionRegistry registry;
    private final IngestionPipeline pipeline;

    public ImportSessionSummary open(OpenStreamRequest request) {
        AccountType accountType = AccountType.fromWire(request.getAccountType());
        if (!StringUtils.hasText(request.getAccountId())) {
            throw MeisaiException.validation("accountId", "accountId is required");
        }
        ImportSessionService.requireCsvFileName(request.getFileName());
        if (request.getFileSize() != null && request.getFileSize() < 0) {
            throw MeisaiException.validation("fileSize", "fileSize must not be negative");
        }
        ActiveImport active = sessionService.open(null, ImportMode.STREAM, accountType, request.getAccountId(),
                request.getFileName(), request.getFileSize(), request.getCreatedBy(), request.getOptions());
        return ImportSessionSummary.from(active.getSession());
    }

    /**
     * Feeds one chunk to the session named by {@code sessionId}; an unknown id opens a session.
     * Session level problems fail the session and are reported through the returned snapshots.
     */
    public List<ImportProgress> acceptChunk(String sessionId, ImportChunk chunk) {
        if (!StringUtils.hasText(sessionId)) {
            throw MeisaiException.validation("sessionId", "sessionId is required");
        }
        ActiveImport active = resolve(sessionId, chunk);
        ImportSession session = active.getSession();

        active.getLock().lock();
        try {
            if (session.isTerminal()) {
                throw new MeisaiException(ErrorKind.STREAM_ERROR, "session is already " + session.getStatus().wireName(),
                        Map.of("sessionId", sessionId, "chunkNumber", chunk.getChunkNumber()));
            }
            active.touch();
            try {
                ReassembledRows rows = active.getReassembler().accept(chunk);
                if (rows.isIgnored()) {
                    return active.getProgress().drain();
                }
                session.addBytesReceived(rows.getBytesConsumed());
                pipeline.processRows(active, rows.getRows(), rows.isLast());

                if (active.isCancelled()) {
                    if (!session.isTerminal()) {
                        pipeline.fail(active, "cancelled");
                    }
                } else if (rows.isLast()) {
                    pipeline.complete(active);
                } else {
                    pipeline.chunkProcessed(active);
                }
            } catch (MeisaiException e) {
                if (e.getKind() != ErrorKind.STREAM_ERROR && e.getKind() != ErrorKind.STORAGE_ERROR) {
                    throw e;
                }
                if (!session.isTerminal()) {
                    pipeline.fail(active, e.getMessage());
                }
            }
            return active.getProgress().drain();
        } finally {
            active.getLock().unlock();
        }
    }

    public ImportSessionSummary cancel(String sessionId) {
        return sessionService.cancel(sessionId);
    }

    private ActiveImport resolve(String sessionId, ImportChunk chunk) {
        return registry.find(sessionId).orElseGet(() -> {
            Optional<ImportSession> stored = sessionService.findStored(sessionId);
            if (stored.isPresent()) {
                if (!stored.get().isTerminal()) {
                    sessionService.cancel(sessionId, "session state lost, restart the upload");
                }
                throw new MeisaiException(ErrorKind.STREAM_ERROR, "session no longer accepts chunks",
                        Map.of("sessionId", sessionId, "chunkNumber", chunk.getChunkNumber()));
            }
            if (sessionId.length() > MAX_SESSION_ID_LENGTH) {
                throw MeisaiException.validation("sessionId", "sessionId longer than " + MAX_SESSION_ID_LENGTH);
            }
            AccountType accountType = StringUtils.hasText(chunk.getAccountType())
                    ? AccountType.fromWire(chunk.getAccountType()) : null;
            String fileName = StringUtils.hasText(chunk.getFileName())
                    ? chunk.getFileName() : "stream_" + sessionId + ".csv";
            return sessionService.openImplicit(sessionId, accountType, chunk.getAccountId(), fileName);
        });
    }
}
