package com.meisai.common.error;

/**
 * Closed set of failure categories shared by all services.
 * Callers branch on the kind, never on the exception message.
 */
public enum ErrorKind {

    /** A single CSV row could not be turned into a statement record. */
    ROW_PARSE_ERROR(false),

    /** No import session exists for the given id. */
    SESSION_NOT_FOUND(true),

    /** No mapping exists for the given id. */
    MAPPING_NOT_FOUND(true),

    /** No statement record exists for the given id or fingerprint. */
    STATEMENT_NOT_FOUND(true),

    /** Another active mapping already occupies the (record, entity type) slot. */
    MAPPING_CONFLICT(false),

    /** Input rejected before anything was written. */
    VALIDATION_ERROR(false),

    /** The storage collaborator failed or is unreachable. */
    STORAGE_ERROR(false),

    /** The chunk stream of an import session can no longer be trusted. */
    STREAM_ERROR(false);

    private final boolean notFound;

    ErrorKind(boolean notFound) {
        this.notFound = notFound;
    }

    public boolean isNotFound() {
        return notFound;
    }
}
