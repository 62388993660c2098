package com.meisai.ingest.dto;

import com.meisai.ingest.pipeline.ImportOptions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Whole-file import; fileContent is base64 in JSON. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportRequest {
    private String accountType;
    private String accountId;
    private String fileName;
    private byte[] fileContent;
    private String createdBy;
    private ImportOptions options;
}
