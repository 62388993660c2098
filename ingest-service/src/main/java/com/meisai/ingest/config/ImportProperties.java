package com.meisai.ingest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings of the session based import pipeline, bound from {@code meisai.import.*}.
 */
@Data
@ConfigurationProperties(prefix = "meisai.import")
public class ImportProperties {

    /** A progress snapshot is emitted every this many processed rows. */
    private int progressIntervalRows = 100;

    /** Per-session progress queue size; the oldest snapshot is dropped on overflow. */
    private int progressQueueCapacity = 64;

    /** How many row errors are kept in the session error log. */
    private int errorLogLimit = 100;

    /** Sessions whose errorRows / processedRows exceeds this end up failed. */
    private double maxErrorRate = 1.0;

    /** Fixed input charset. Empty means sniff UTF-8 vs windows-31j on the first bytes. */
    private String charset;

    private Stream stream = new Stream();

    @Data
    public static class Stream {
        private int maxRowBytes = 64 * 1024;
        private MismatchedSessionPolicy mismatchedSessionPolicy = MismatchedSessionPolicy.REJECT;
        private Duration idleTimeout = Duration.ofMinutes(15);
    }

    public enum MismatchedSessionPolicy {
        REJECT,
        IGNORE
    }
}
