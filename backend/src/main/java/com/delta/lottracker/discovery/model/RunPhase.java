package com.delta.lottracker.discovery.model;

public enum RunPhase {
    IDLE,
    FETCHING,
    RECONCILING,
    AUGMENTING,
    SCORING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
