package com.docrag.retrieval;

import java.util.Locale;

/**
 * Caller hint selecting which similarity threshold applies to a query.
 */
public enum ContentClass {
    CODE,
    TEXT;

    /**
     * @return the matching class, or {@code null} for a blank value (untagged query)
     */
    public static ContentClass parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown content class '" + value + "'. Expected one of: code, text", e);
        }
    }
}
