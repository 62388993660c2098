package com.meisai.ingest.hash;

/**
 * Writes the record for a NEW or CHANGED decision and returns the id the index should point to.
 * Throwing leaves the index untouched.
 */
@FunctionalInterface
public interface RecordPersister {
    Long persist(HashDecision decision);
}
