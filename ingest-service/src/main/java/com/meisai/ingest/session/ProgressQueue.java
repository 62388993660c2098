package com.meisai.ingest.session;

import com.meisai.common.model.ImportProgress;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded buffer of progress snapshots for one session.
 * The producer never blocks: when full, the oldest snapshot is dropped since a newer one supersedes it.
 */
public class ProgressQueue {

    private final int capacity;
    private final Deque<ImportProgress> snapshots;
    private long dropped;

    public ProgressQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.snapshots = new ArrayDeque<>(capacity);
    }

    public synchronized void offer(ImportProgress progress) {
        if (snapshots.size() == capacity) {
            snapshots.pollFirst();
            dropped++;
        }
        snapshots.addLast(progress);
    }

    public synchronized List<ImportProgress> drain() {
        List<ImportProgress> out = new ArrayList<>(snapshots);
        snapshots.clear();
        return out;
    }

    public synchronized int size() {
        return snapshots.size();
    }

    public synchronized long droppedCount() {
        return dropped;
    }
}
