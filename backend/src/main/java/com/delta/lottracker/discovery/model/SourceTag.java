package com.delta.lottracker.discovery.model;

import java.util.Locale;

/**
 * The three channels the marketplace exposes its catalog through.
 */
public enum SourceTag {
    SUMMARY,
    SEARCH,
    RENDERED;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SourceTag fromKey(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return SourceTag.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
