package com.meisai.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChunkRequest {
    private String sessionId;   // optional; defaults to the path session
    private long chunkNumber;
    private byte[] data;

    @JsonProperty("isLast")
    private boolean last;
}
