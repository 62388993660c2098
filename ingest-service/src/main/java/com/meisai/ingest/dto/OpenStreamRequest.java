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
public class OpenStreamRequest {
    private String accountType;
    private String accountId;
    private String fileName;
    private Long fileSize;      // optional, enables byte based progress
    private String createdBy;
    private ImportOptions options;
}
