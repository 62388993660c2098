package com.meisai.ingest.hash;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/** Index entry; also the value type of the Redis snapshot. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class HashIndexEntry implements Serializable {
    private String contentHash;
    private Long recordId;
    private Instant lastSeenAt;
    private String naturalKey;
    private Integer tollAmount;
}
