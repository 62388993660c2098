package com.meisai.ingest.dto;

import com.meisai.ingest.entity.ImportSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportSessionSummary {
    private String sessionId;
    private String status;
    private String mode;
    private String accountType;
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
    private double progressPercentage;
    private String failureReason;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private List<RowErrorView> errors;

    public static ImportSessionSummary from(ImportSession s) {
        return ImportSessionSummary.builder()
                .sessionId(s.getSessionId())
                .status(s.getStatus().wireName())
                .mode(s.getMode().wireName())
                .accountType(s.getAccountType() == null ? null : s.getAccountType().wireName())
                .accountId(s.getAccountId())
                .fileName(s.getFileName())
                .fileSize(s.getFileSize())
                .createdBy(s.getCreatedBy())
                .totalRows(s.getTotalRows())
                .totalRowsConfirmed(s.isTotalRowsConfirmed())
                .processedRows(s.getProcessedRows())
                .successRows(s.getSuccessRows())
                .errorRows(s.getErrorRows())
                .duplicateRows(s.getDuplicateRows())
                .progressPercentage(s.getProgressPercentage())
                .failureReason(s.getFailureReason())
                .createdAt(s.getCreatedAt())
                .startedAt(s.getStartedAt())
                .completedAt(s.getCompletedAt())
                .errors(s.getErrorLog().stream()
                        .map(e -> new RowErrorView(e.getRowNumber(), e.getErrorKind().name(), e.getMessage()))
                        .toList())
                .build();
    }
}
