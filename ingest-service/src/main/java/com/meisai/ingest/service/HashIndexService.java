package com.meisai.ingest.service;

import com.meisai.common.error.ErrorKind;
import com.meisai.common.error.MeisaiException;
import com.meisai.ingest.dto.HashImportRequest;
import com.meisai.ingest.dto.HashImportResult;
import com.meisai.ingest.entity.ImportMode;
import com.meisai.ingest.entity.ImportSession;
import com.meisai.ingest.hash.HashIndex;
import com.meisai.ingest.hash.HashIndexSnapshotStore;
import com.meisai.ingest.hash.HashIndexStats;
import com.meisai.ingest.pipeline.ImportOptions;
import com.meisai.ingest.session.ActiveImport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;

/** Administration of the fingerprint index: path based imports, statistics and reset. */
@Slf4j
@Service
@RequiredArgsConstructor
public class HashIndexService {

    private final HashIndex hashIndex;
    private final ImportSessionService sessionService;
    private final CsvImportService csvImportService;
    private final ObjectProvider<HashIndexSnapshotStore> snapshotStore;

    /**
     * Imports a CSV file readable by this service. Tracked as a whole-file session like any other import.
     */
    public HashImportResult importFile(HashImportRequest request) {
        if (!StringUtils.hasText(request.getCsvPath())) {
            throw MeisaiException.validation("csvPath", "csvPath is required");
        }
        Path path;
        try {
            path = Path.of(request.getCsvPath());
        } catch (InvalidPathException e) {
            throw MeisaiException.validation("csvPath", "invalid path: " + request.getCsvPath());
        }
        if (!Files.isRegularFile(path)) {
            throw new MeisaiException(ErrorKind.VALIDATION_ERROR, "CSV file not found",
                    Map.of("field", "csvPath", "csvPath", request.getCsvPath()));
        }
        String fileName = path.getFileName().toString();
        ImportSessionService.requireCsvFileName(fileName);

        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new MeisaiException(ErrorKind.VALIDATION_ERROR, "CSV file could not be read: " + e.getMessage(),
                    Map.of("csvPath", request.getCsvPath()));
        }

        ImportOptions options = request.getOptions() == null ? ImportOptions.defaults() : request.getOptions();
        ActiveImport active = sessionService.open(null, ImportMode.WHOLE_FILE, null, null,
                fileName, (long) content.length, "hash-import", options);
        ImportSession session = csvImportService.run(active, content);

        HashImportResult result = HashImportResult.builder()
                .sessionId(session.getSessionId())
                .status(session.getStatus().wireName())
                .addedCount(session.getSuccessRows() - active.getUpdatedRows())
                .updatedCount(active.getUpdatedRows())
                .duplicateCount(session.getDuplicateRows())
                .errorCount(session.getErrorRows())
                .processedCount(session.getProcessedRows())
                .validateOnly(options.isValidateOnly())
                .build();
        log.info("Hash import of {} finished: added={} updated={} duplicates={} errors={}{}", path,
                result.getAddedCount(), result.getUpdatedCount(), result.getDuplicateCount(), result.getErrorCount(),
                options.isValidateOnly() ? " (validate only)" : "");
        return result;
    }

    public HashIndexStats stats() {
        return hashIndex.stats();
    }

    public HashIndexStats clear() {
        hashIndex.clear();
        HashIndexSnapshotStore snapshots = snapshotStore.getIfAvailable();
        if (snapshots != null) {
            try {
                snapshots.delete();
            } catch (RuntimeException e) {
                log.warn("Hash index cleared but Redis snapshot could not be removed: {}", e.getMessage());
            }
        }
        return hashIndex.stats();
    }
}
