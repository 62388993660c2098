package com.meisai.ingest.hash;

public enum Classification {
    NEW,
    DUPLICATE,
    /** Same natural key stored under another fingerprint. Only with change detection enabled. */
    CHANGED
}
