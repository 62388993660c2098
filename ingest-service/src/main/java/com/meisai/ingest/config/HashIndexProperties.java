package com.meisai.ingest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the in-memory hash index, bound from {@code meisai.hash-index.*}.
 */
@Data
@ConfigurationProperties(prefix = "meisai.hash-index")
public class HashIndexProperties {

    /** Enables the secondary natural-key index (date + time + card) and CHANGED classification. */
    private boolean changeDetection = false;

    /** Where the index is warmed from at startup. */
    private Persistence persistence = Persistence.NONE;

    private boolean warmUp = true;

    /** Page size used when the index is rebuilt from storage. */
    private int loadBatchSize = 1000;

    /** Redis hash holding the snapshot. */
    private String snapshotKey = "meisai:hash-index";

    public enum Persistence {
        NONE,
        REDIS
    }
}
