package com.meisai.ingest.entity;

import com.meisai.common.error.ErrorKind;
import com.meisai.common.error.MeisaiException;
import com.meisai.common.model.ImportProgress;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One logical import (whole file or streamed).
 * <p>
 * Counters only move through the record* methods so that
 * {@code successRows + errorRows + duplicateRows == processedRows} holds whenever the entity is saved.
 * Exactly one terminal transition is allowed; a terminal session rejects further rows.
 */
@Entity
@Table(name = "import_session", indexes = {
        @Index(name = "idx_import_session_account", columnList = "account_type, account_id"),
        @Index(name = "idx_import_session_created", columnList = "created_at")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ImportSession {

    @Id
    @Column(length = 36)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ImportStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ImportMode mode;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type")
    private AccountType accountType;

    @Column(name = "account_id")
    private String accountId;

    private String fileName;
    private Long fileSize;
    private String createdBy;

    private long totalRows;
    private boolean totalRowsConfirmed;
    private long processedRows;
    private long successRows;
    private long errorRows;
    private long duplicateRows;

    private long bytesReceived;
    private double progressPercentage;

    @Column(length = 1000)
    private String failureReason;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "import_session_error", joinColumns = @JoinColumn(name = "session_id"))
    @OrderColumn(name = "error_position")
    @Builder.Default
    private List<RowError> errorLog = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    public static ImportSession open(String sessionId, ImportMode mode, AccountType accountType, String accountId,
                                     String fileName, Long fileSize, String createdBy) {
        return ImportSession.builder()
                .sessionId(sessionId != null ? sessionId : UUID.randomUUID().toString())
                .status(ImportStatus.PENDING)
                .mode(mode)
                .accountType(accountType)
                .accountId(accountId)
                .fileName(fileName)
                .fileSize(fileSize)
                .createdBy(createdBy)
                .createdAt(Instant.now())
                .build();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** pending -> processing; repeated calls while processing are no-ops. */
    public void startProcessing() {
        ensureOpen();
        if (status == ImportStatus.PENDING) {
            status = ImportStatus.PROCESSING;
            startedAt = Instant.now();
        }
    }

    /** Adds rows found in the input so far. Streamed sessions grow their total chunk by chunk. */
    public void discoverRows(long rows) {
        ensureOpen();
        if (totalRowsConfirmed) {
            throw MeisaiException.stream(sessionId, "total row count already confirmed");
        }
        totalRows += rows;
    }

    public void confirmTotalRows() {
        totalRowsConfirmed = true;
    }

    public void addBytesReceived(long bytes) {
        bytesReceived += bytes;
    }

    public void recordSuccess() {
        startProcessing();
        successRows++;
        processedRows++;
    }

    public void recordDuplicate() {
        startProcessing();
        duplicateRows++;
        processedRows++;
    }

    public void recordError(long rowNumber, ErrorKind kind, String message, int errorLogLimit) {
        startProcessing();
        errorRows++;
        processedRows++;
        if (errorLog.size() < errorLogLimit) {
            errorLog.add(new RowError(rowNumber, kind, message));
        }
    }

    /**
     * Terminal transition at end of input. Fails instead when the row error rate exceeds the tolerance.
     */
    public void complete(double maxErrorRate) {
        ensureOpen();
        confirmTotalRows();
        double errorRate = processedRows == 0 ? 0.0 : (double) errorRows / processedRows;
        if (errorRate > maxErrorRate) {
            fail(String.format("row error rate %.3f exceeds tolerance %.3f", errorRate, maxErrorRate));
            return;
        }
        status = ImportStatus.COMPLETED;
        completedAt = Instant.now();
        progressPercentage = 100.0;
    }

    /** Terminal failure. A second terminal transition is ignored and reported to the caller as false. */
    public boolean fail(String reason) {
        if (isTerminal()) {
            return false;
        }
        status = ImportStatus.FAILED;
        failureReason = reason;
        completedAt = Instant.now();
        return true;
    }

    /**
     * Recomputes progress: rows against a confirmed total, otherwise bytes against the declared file size.
     * Never goes backwards and stays below 100 until completion.
     */
    public double refreshProgress() {
        if (status == ImportStatus.COMPLETED) {
            progressPercentage = 100.0;
            return progressPercentage;
        }
        double computed = 0.0;
        if (totalRowsConfirmed && totalRows > 0) {
            computed = processedRows * 100.0 / totalRows;
        } else if (fileSize != null && fileSize > 0) {
            computed = bytesReceived * 100.0 / fileSize;
        }
        progressPercentage = Math.max(progressPercentage, Math.min(99.9, computed));
        return progressPercentage;
    }

    public ImportProgress toProgress() {
        return ImportProgress.builder()
                .sessionId(sessionId)
                .status(status.wireName())
                .processedRows(processedRows)
                .totalRows(totalRows)
                .totalRowsConfirmed(totalRowsConfirmed)
                .successRows(successRows)
                .errorRows(errorRows)
                .duplicateRows(duplicateRows)
                .progressPercentage(refreshProgress())
                .timestamp(Instant.now())
                .build();
    }

    private void ensureOpen() {
        if (isTerminal()) {
            throw new MeisaiException(ErrorKind.STREAM_ERROR, "session is already " + status.wireName(),
                    Map.of("sessionId", sessionId, "status", status.wireName()));
        }
    }
}
