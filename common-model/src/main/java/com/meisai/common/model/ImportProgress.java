package com.meisai.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/** Progress snapshot of one import session. Produced on meisai.import.progress. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportProgress implements Serializable {
    private String sessionId;
    private String status;            // pending / processing / completed / failed
    private long processedRows;
    private long totalRows;
    private boolean totalRowsConfirmed;
    private long successRows;
    private long errorRows;
    private long duplicateRows;
    private double progressPercentage;
    private Instant timestamp;

    public boolean isTerminal() {
        return "completed".equals(status) || "failed".equals(status);
    }
}
