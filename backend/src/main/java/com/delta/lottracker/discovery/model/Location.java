package com.delta.lottracker.discovery.model;

import java.util.Locale;

/**
 * Pickup warehouses. Labels are matched loosely because each channel spells them differently
 * ("Rock Hill", "rock-hill", "ROCK_HILL").
 */
public enum Location {
    ANDERSON("Anderson"),
    GASTONIA("Gastonia"),
    GREENVILLE("Greenville"),
    ROCK_HILL("Rock Hill"),
    SPARTANBURG("Spartanburg"),
    UNKNOWN("Unknown");

    private final String label;

    Location(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Location fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim()
            .toUpperCase(Locale.ROOT)
            .replace('-', '_')
            .replace(' ', '_');
        for (Location location : values()) {
            if (location.name().equals(normalized)) {
                return location;
            }
        }
        // "Rock Hill, SC" and similar decorated labels
        for (Location location : values()) {
            if (location != UNKNOWN && normalized.startsWith(location.name())) {
                return location;
            }
        }
        return UNKNOWN;
    }
}
