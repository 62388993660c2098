package com.meisai.ingest.hash;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HashIndexStats {
    private long totalRecords;
    private long naturalKeys;
    private long memoryEstimate;   // bytes, rough
    private boolean changeDetection;
}
