package com.meisai.mapping.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MatchType {
    EXACT,
    FUZZY,
    TIME,
    AMOUNT,
    MANUAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MatchType fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
