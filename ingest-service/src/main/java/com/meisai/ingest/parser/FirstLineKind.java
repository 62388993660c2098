package com.meisai.ingest.parser;

public enum FirstLineKind {
    HEADER,
    DATA,
    MALFORMED
}
