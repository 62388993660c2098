package com.meisai.ingest.parser;

import java.util.regex.Pattern;

/** Whitespace canonicalisation applied to every text cell before it is stored or hashed. */
public final class TextNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /** Trims, turns full-width spaces (U+3000) into ASCII spaces and collapses runs. Null becomes "". */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String replaced = value.replace('\u3000', ' ');
        return WHITESPACE_RUN.matcher(replaced).replaceAll(" ").trim();
    }

    /** Normalized value, or null when nothing is left. */
    public static String normalizeToNull(String value) {
        String normalized = normalize(value);
        return normalized.isEmpty() ? null : normalized;
    }
}
