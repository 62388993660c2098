package com.meisai.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * One network fragment of a streamed CSV upload. Fragments are not row aligned.
 * Published on meisai.import.chunk keyed by sessionId so one session stays on one partition.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportChunk implements Serializable {
    private String sessionId;
    private long chunkNumber;
    private byte[] data;        // raw CSV bytes, base64 on the wire

    @JsonProperty("isLast")
    private boolean last;

    // only read when the first chunk implicitly opens the session
    private String accountType;
    private String accountId;
    private String fileName;
}
