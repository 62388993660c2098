package com.meisai.ingest.session;

import com.meisai.ingest.entity.ImportSession;
import com.meisai.ingest.pipeline.ImportOptions;
import com.meisai.ingest.stream.ChunkReassembler;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live state of a session that is still consuming input. Everything except the cancel flag and
 * the activity timestamp is touched only while {@link #getLock()} is held.
 */
@Getter
public class ActiveImport {

    private final ImportSession session;
    private final ImportOptions options;
    private final ChunkReassembler reassembler;
    private final ProgressQueue progress;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    @Setter
    private boolean headerResolved;
    private long linesConsumed;
    private long updatedRows;
    /** Fingerprints accepted by a validate-only run. */
    @Getter(AccessLevel.NONE)
    private final Set<String> validatedHashes = new HashSet<>();
    private volatile Instant lastActivity = Instant.now();

    public ActiveImport(ImportSession session, ImportOptions options, ChunkReassembler reassembler, int queueCapacity) {
        this.session = session;
        this.options = options;
        this.reassembler = reassembler;
        this.progress = new ProgressQueue(queueCapacity);
    }

    public String getSessionId() {
        return session.getSessionId();
    }

    /** Source line number of the next row, header included. */
    public long nextLine() {
        return ++linesConsumed;
    }

    /** Returns false when the fingerprint was already accepted earlier in this validate-only run. */
    public boolean markValidated(String contentHash) {
        return validatedHashes.add(contentHash);
    }

    public void recordUpdated() {
        updatedRows++;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Returns true for the caller that actually flipped the flag. */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public void touch() {
        lastActivity = Instant.now();
    }
}
