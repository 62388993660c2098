package com.meisai.ingest.hash;

import com.meisai.ingest.config.HashIndexProperties;
import com.meisai.ingest.storage.StatementStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Warms the index at startup: from the Redis snapshot when one is configured and not empty,
 * otherwise by walking the stored statement records. Records written after the snapshot was taken
 * are picked up lazily: the pipeline checks storage for any fingerprint the index misses.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HashIndexLoader {

    private final HashIndex hashIndex;
    private final StatementStore statementStore;
    private final HashIndexProperties properties;
    private final ObjectProvider<HashIndexSnapshotStore> snapshotStore;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.isWarmUp()) {
            log.info("Hash index warm-up disabled");
            return;
        }
        warmUp();
    }

    public long warmUp() {
        HashIndexSnapshotStore snapshots = snapshotStore.getIfAvailable();
        if (snapshots != null) {
            try {
                int restored = snapshots.restore();
                if (restored > 0) {
                    log.info("Hash index restored from Redis snapshot: {} entries", restored);
                    return restored;
                }
                log.info("Redis snapshot empty, rebuilding hash index from storage");
            } catch (RuntimeException e) {
                log.warn("Redis snapshot unavailable ({}), rebuilding hash index from storage", e.getMessage());
            }
        }
        long loaded = statementStore.loadHashIndex(hashIndex::register);
        log.info("Hash index rebuilt from storage: {} records", loaded);
        return loaded;
    }
}
