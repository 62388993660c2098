package com.meisai.ingest.hash;

import com.meisai.ingest.config.HashIndexProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis copy of the hash index (one Redis hash, field = fingerprint) so a restart does not need a
 * full table scan. Written periodically; read once at startup.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "meisai.hash-index", name = "persistence", havingValue = "redis")
public class HashIndexSnapshotStore {

    private static final int WRITE_BATCH = 1000;

    private final RedisTemplate<String, HashIndexEntry> redisTemplate;
    private final HashIndex hashIndex;
    private final String key;

    public HashIndexSnapshotStore(RedisTemplate<String, HashIndexEntry> hashIndexRedisTemplate,
                                  HashIndex hashIndex,
                                  HashIndexProperties properties) {
        this.redisTemplate = hashIndexRedisTemplate;
        this.hashIndex = hashIndex;
        this.key = properties.getSnapshotKey();
    }

    @Scheduled(fixedDelayString = "${meisai.hash-index.snapshot-interval-ms:60000}",
            initialDelayString = "${meisai.hash-index.snapshot-interval-ms:60000}")
    public void snapshotJob() {
        try {
            int written = write();
            log.debug("Hash index snapshot written: {} entries to {}", written, key);
        } catch (RuntimeException e) {
            log.warn("Hash index snapshot to Redis failed: {}", e.getMessage());
        }
    }

    /** Replaces the stored snapshot with the current index content. */
    public int write() {
        List<HashIndexEntry> entries = hashIndex.snapshot();
        HashOperations<String, String, HashIndexEntry> ops = redisTemplate.opsForHash();
        redisTemplate.delete(key);
        Map<String, HashIndexEntry> batch = new LinkedHashMap<>();
        for (HashIndexEntry entry : entries) {
            batch.put(entry.getContentHash(), entry);
            if (batch.size() == WRITE_BATCH) {
                ops.putAll(key, batch);
                batch.clear();
            }
        }
        if (!batch.isEmpty()) {
            ops.putAll(key, batch);
        }
        return entries.size();
    }

    /** Loads the stored snapshot into the index. Returns the number of entries restored. */
    public int restore() {
        HashOperations<String, String, HashIndexEntry> ops = redisTemplate.opsForHash();
        Map<String, HashIndexEntry> stored = ops.entries(key);
        stored.values().forEach(hashIndex::register);
        return stored.size();
    }

    public void delete() {
        redisTemplate.delete(key);
        log.info("Hash index snapshot {} removed from Redis", key);
    }
}
