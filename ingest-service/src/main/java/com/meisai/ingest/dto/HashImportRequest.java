package com.meisai.ingest.dto;

import com.meisai.ingest.pipeline.ImportOptions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HashImportRequest {
    private String csvPath;
    private ImportOptions options;
}
