package com.meisai.ingest.entity;

import java.util.Locale;

public enum ImportMode {
    WHOLE_FILE,
    STREAM;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
