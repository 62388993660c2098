package com.meisai.common.error;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class MeisaiException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> context;

    public MeisaiException(ErrorKind kind, String message) {
        this(kind, message, Map.of(), null);
    }

    public MeisaiException(ErrorKind kind, String message, Map<String, Object> context) {
        this(kind, message, context, null);
    }

    public MeisaiException(ErrorKind kind, String message, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static MeisaiException sessionNotFound(String sessionId) {
        return new MeisaiException(ErrorKind.SESSION_NOT_FOUND,
                "Import session not found: " + sessionId, Map.of("sessionId", sessionId));
    }

    public static MeisaiException mappingNotFound(long mappingId) {
        return new MeisaiException(ErrorKind.MAPPING_NOT_FOUND,
                "Mapping not found: " + mappingId, Map.of("mappingId", mappingId));
    }

    public static MeisaiException statementNotFound(String key, Object value) {
        return new MeisaiException(ErrorKind.STATEMENT_NOT_FOUND,
                "Statement record not found: " + key + "=" + value, Map.of(key, value));
    }

    public static MeisaiException validation(String message) {
        return new MeisaiException(ErrorKind.VALIDATION_ERROR, message);
    }

    public static MeisaiException validation(String field, String message) {
        return new MeisaiException(ErrorKind.VALIDATION_ERROR, message, Map.of("field", field));
    }

    public static MeisaiException stream(String sessionId, String message) {
        return new MeisaiException(ErrorKind.STREAM_ERROR, message, Map.of("sessionId", sessionId));
    }

    public static MeisaiException storage(String message, Throwable cause) {
        return new MeisaiException(ErrorKind.STORAGE_ERROR, message, Map.of(), cause);
    }
}
