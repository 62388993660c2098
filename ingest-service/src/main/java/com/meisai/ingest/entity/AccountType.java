package com.meisai.ingest.entity;

import com.meisai.common.error.MeisaiException;

import java.util.Locale;

public enum AccountType {
    CORPORATE,
    PERSONAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AccountType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw MeisaiException.validation("accountType", "accountType is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw MeisaiException.validation("accountType", "accountType must be corporate or personal: " + value);
        }
    }
}
