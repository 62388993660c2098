package com.meisai.ingest.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HashImportResult {
    private String sessionId;
    private String status;
    private long addedCount;
    private long updatedCount;
    private long duplicateCount;
    private long errorCount;
    private long processedCount;
    private boolean validateOnly;
}
