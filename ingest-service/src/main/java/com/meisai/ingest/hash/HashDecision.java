package com.meisai.ingest.hash;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class HashDecision {
    Classification classification;
    String contentHash;
    /** Matching stored record for DUPLICATE, the written record after NEW or CHANGED. Null before persisting. */
    Long recordId;
    /** CHANGED only: record and fingerprint the natural key pointed to. */
    Long previousRecordId;
    String previousHash;

    public boolean isNew() {
        return classification == Classification.NEW;
    }
}
