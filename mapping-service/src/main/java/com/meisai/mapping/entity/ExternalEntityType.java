package com.meisai.mapping.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Kinds of accounting records a statement row can be linked to. */
public enum ExternalEntityType {
    DTAKO_RECORD,
    EXPENSE_RECORD,
    INVOICE_RECORD;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExternalEntityType fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
