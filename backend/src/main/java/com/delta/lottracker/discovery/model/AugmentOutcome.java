package com.delta.lottracker.discovery.model;

public enum AugmentOutcome {
    UPDATED,
    UNCHANGED,
    DEGRADED,
    FAILED,
    SKIPPED
}
