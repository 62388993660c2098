package com.meisai.mapping.service;

import com.meisai.common.error.MeisaiException;
import com.meisai.mapping.entity.ExternalEntityType;
import com.meisai.mapping.entity.MappingStatus;
import com.meisai.mapping.entity.MatchType;
import org.springframework.util.StringUtils;

/** Parses lower-case wire names; blank means "not given", unknown names are validation errors. */
final class WireValues {

    private WireValues() {
    }

    static ExternalEntityType entityType(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return ExternalEntityType.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw MeisaiException.validation("externalEntityType", "unknown external entity type: " + value);
        }
    }

    static MatchType matchType(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return MatchType.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw MeisaiException.validation("matchType", "unknown match type: " + value);
        }
    }

    static MappingStatus status(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return MappingStatus.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw MeisaiException.validation("status", "unknown mapping status: " + value);
        }
    }
}
