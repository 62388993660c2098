package com.meisai.ingest.service;

import com.meisai.common.error.ErrorKind;
import com.meisai.common.error.MeisaiException;
import com.meisai.common.model.ImportChunk;
import com.meisai.ingest.dto.ImportRequest;
import com.meisai.ingest.dto.ImportSessionSummary;
import com.meisai.ingest.entity.AccountType;
import com.meisai.ingest.entity.ImportMode;
import com.meisai.ingest.entity.ImportSession;
import com.meisai.ingest.pipeline.IngestionPipeline;
import com.meisai.ingest.session.ActiveImport;
import com.meisai.ingest.stream.ReassembledRows;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Whole-file import. The file goes through the same reassembly and pipeline as a streamed upload
 * delivered in a single chunk, so both paths count rows identically.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CsvImportService {

    private final ImportSessionService sessionService;
    private final IngestionPipeline pipeline;

    public ImportSessionSummary importFile(ImportRequest request) {
        AccountType accountType = AccountType.fromWire(request.getAccountType());
        if (!StringUtils.hasText(request.getAccountId())) {
            throw MeisaiException.validation("accountId", "accountId is required");
        }
        ImportSessionService.requireCsvFileName(request.getFileName());
        if (request.getFileContent() == null) {
            throw MeisaiException.validation("fileContent", "fileContent is required");
        }

        ActiveImport active = sessionService.open(null, ImportMode.WHOLE_FILE, accountType, request.getAccountId(),
                request.getFileName(), (long) request.getFileContent().length, request.getCreatedBy(),
                request.getOptions());
        return ImportSessionSummary.from(run(active, request.getFileContent()));
    }

    public ImportSessionSummary importUpload(MultipartFile file, String accountType, String accountId, String createdBy) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new MeisaiException(ErrorKind.VALIDATION_ERROR, "uploaded file could not be read: " + e.getMessage());
        }
        return importFile(ImportRequest.builder()
                .accountType(accountType)
                .accountId(accountId)
                .fileName(file.getOriginalFilename())
                .fileContent(content)
                .createdBy(createdBy)
                .build());
    }

    /** Runs complete input through an already opened session and returns it in its terminal state. */
    ImportSession run(ActiveImport active, byte[] content) {
        ImportSession session = active.getSession();
        active.getLock().lock();
        try {
            ImportChunk whole = ImportChunk.builder()
                    .sessionId(session.getSessionId())
                    .chunkNumber(0)
                    .data(content)
                    .last(true)
                    .build();
            ReassembledRows rows = active.getReassembler().accept(whole);
            session.addBytesReceived(rows.getBytesConsumed());
            pipeline.processRows(active, rows.getRows(), true);
            if (active.isCancelled()) {
                // a cancel issued on this thread, e.g. from a progress listener, has already failed it
                if (!session.isTerminal()) {
                    pipeline.fail(active, "cancelled");
                }
            } else {
                pipeline.complete(active);
            }
        } catch (MeisaiException e) {
            if (e.getKind() != ErrorKind.STREAM_ERROR && e.getKind() != ErrorKind.STORAGE_ERROR) {
                throw e;
            }
            if (!session.isTerminal()) {
                pipeline.fail(active, e.getMessage());
            }
        } finally {
            active.getLock().unlock();
        }
        return session;
    }
}
