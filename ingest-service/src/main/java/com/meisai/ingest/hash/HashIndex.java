package com.meisai.ingest.hash;

import com.meisai.ingest.config.HashIndexProperties;
import com.meisai.ingest.entity.StatementRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Fingerprint index shared by every import.
 * <p>
 * Lookups and inserts run under the shared read lock; {@link #clear()} takes the write lock and so
 * waits for in-flight classifications. Within the read lock, records with the same natural key
 * (and therefore every record with the same fingerprint) serialise on one stripe: of two sessions
 * importing identical content only the first sees NEW, the second DUPLICATE.
 */
@Slf4j
@Component
public class HashIndex {

    private static final int STRIPES = 256;

    // rough heap cost per entry: 64 char key, entry object, map node
    private static final long BYTES_PER_ENTRY = 360;
    private static final long BYTES_PER_NATURAL_KEY = 200;

    private final RecordHasher hasher;
    private final boolean changeDetection;

    private final Map<String, HashIndexEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, String> hashByNaturalKey = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock indexLock = new ReentrantReadWriteLock();
    private final Object[] stripes = new Object[STRIPES];

    public HashIndex(RecordHasher hasher, HashIndexProperties properties) {
        this.hasher = hasher;
        this.changeDetection = properties.isChangeDetection();
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new Object();
        }
    }

    public String fingerprint(StatementRecord record) {
        return hasher.fingerprint(record);
    }

    public HashDecision classify(StatementRecord record, RecordPersister persister) {
        return classify(hasher.fingerprint(record), record, persister);
    }

    /**
     * Classifies the record and, for NEW or CHANGED, runs the persister before the fingerprint is
     * indexed. A persister failure propagates and nothing is registered.
     */
    public HashDecision classify(String contentHash, StatementRecord record, RecordPersister persister) {
        String naturalKey = hasher.naturalKey(record);
        indexLock.readLock().lock();
        try {
            synchronized (stripeFor(naturalKey)) {
                HashDecision decision = lookup(contentHash, naturalKey);
                if (decision.getClassification() == Classification.DUPLICATE) {
                    entries.computeIfPresent(contentHash, (k, e) -> e.toBuilder().lastSeenAt(Instant.now()).build());
                    return decision;
                }

                Long recordId = persister.persist(decision);
                if (recordId == null) {
                    throw new IllegalStateException("persister returned no record id for " + contentHash);
                }
                if (decision.getClassification() == Classification.CHANGED
                        && recordId.equals(decision.getPreviousRecordId())) {
                    // rewritten in place, the old fingerprint no longer exists in storage
                    entries.remove(decision.getPreviousHash());
                }
                put(HashIndexEntry.builder()
                        .contentHash(contentHash)
                        .recordId(recordId)
                        .lastSeenAt(Instant.now())
                        .naturalKey(naturalKey)
                        .tollAmount(record.getTollAmount())
                        .build());
                return decision.toBuilder().recordId(recordId).build();
            }
        } finally {
            indexLock.readLock().unlock();
        }
    }

    public boolean contains(String contentHash) {
        return entries.containsKey(contentHash);
    }

    /** Read-only classification, nothing is persisted or indexed. */
    public HashDecision peek(StatementRecord record) {
        return peek(hasher.fingerprint(record), record);
    }

    public HashDecision peek(String contentHash, StatementRecord record) {
        indexLock.readLock().lock();
        try {
            return lookup(contentHash, hasher.naturalKey(record));
        } finally {
            indexLock.readLock().unlock();
        }
    }

    /** Adds an entry for an already stored record (warm-up). */
    public void register(HashIndexEntry entry) {
        indexLock.readLock().lock();
        try {
            put(entry);
        } finally {
            indexLock.readLock().unlock();
        }
    }

    public void register(StatementRecord stored) {
        register(HashIndexEntry.builder()
                .contentHash(stored.getContentHash())
                .recordId(stored.getId())
                .lastSeenAt(stored.getUpdatedAt() != null ? stored.getUpdatedAt() : Instant.now())
                .naturalKey(hasher.naturalKey(stored))
                .tollAmount(stored.getTollAmount())
                .build());
    }

    public List<HashIndexEntry> snapshot() {
        indexLock.readLock().lock();
        try {
            return List.copyOf(entries.values());
        } finally {
            indexLock.readLock().unlock();
        }
    }

    public HashIndexStats stats() {
        long total = entries.size();
        long keys = hashByNaturalKey.size();
        return HashIndexStats.builder()
                .totalRecords(total)
                .naturalKeys(keys)
                .memoryEstimate(total * BYTES_PER_ENTRY + keys * BYTES_PER_NATURAL_KEY)
                .changeDetection(changeDetection)
                .build();
    }

    public int size() {
        return entries.size();
    }

    /** Drops everything. Blocks until running classifications finish and holds new ones off meanwhile. */
    public void clear() {
        indexLock.writeLock().lock();
        try {
            int dropped = entries.size();
            entries.clear();
            hashByNaturalKey.clear();
            log.info("Hash index cleared, {} entries dropped", dropped);
        } finally {
            indexLock.writeLock().unlock();
        }
    }

    private HashDecision lookup(String contentHash, String naturalKey) {
        HashIndexEntry exact = entries.get(contentHash);
        if (exact != null) {
            return HashDecision.builder()
                    .classification(Classification.DUPLICATE)
                    .contentHash(contentHash)
                    .recordId(exact.getRecordId())
                    .build();
        }
        if (changeDetection) {
            String previousHash = hashByNaturalKey.get(naturalKey);
            HashIndexEntry previous = previousHash == null ? null : entries.get(previousHash);
            if (previous != null) {
                return HashDecision.builder()
                        .classification(Classification.CHANGED)
                        .contentHash(contentHash)
                        .previousRecordId(previous.getRecordId())
                        .previousHash(previousHash)
                        .build();
            }
        }
        return HashDecision.builder()
                .classification(Classification.NEW)
                .contentHash(contentHash)
                .build();
    }

    private void put(HashIndexEntry entry) {
        entries.put(entry.getContentHash(), entry);
        if (changeDetection && entry.getNaturalKey() != null) {
            hashByNaturalKey.put(entry.getNaturalKey(), entry.getContentHash());
        }
    }

    private Object stripeFor(String naturalKey) {
        return stripes[Math.floorMod(naturalKey.hashCode(), STRIPES)];
    }
}
