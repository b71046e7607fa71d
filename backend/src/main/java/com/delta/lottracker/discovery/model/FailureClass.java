package com.delta.lottracker.discovery.model;

public enum FailureClass {
    RETRYABLE,
    PERMANENT
}
