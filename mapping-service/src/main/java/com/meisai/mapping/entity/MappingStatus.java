package com.meisai.mapping.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a mapping. {@code REJECTED} is terminal; every other state may be rejected.
 */
public enum MappingStatus {
    PENDING,
    ACTIVE,
    INACTIVE,
    REJECTED;

    public boolean isTerminal() {
        return this == REJECTED;
    }

    public boolean canTransitionTo(MappingStatus target) {
        return switch (this) {
            case PENDING -> target == ACTIVE || target == REJECTED;
            case ACTIVE -> target == INACTIVE || target == REJECTED;
            case INACTIVE -> target == ACTIVE || target == REJECTED;
            case REJECTED -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MappingStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
