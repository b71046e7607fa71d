package com.delta.lottracker.discovery.model;

public record SourceStreamResult(
    SourceTag source,
    String streamKey,
    int pagesFetched,
    int recordsFetched,
    String status,
    FailureClass failureClass,
    String errorMessage
) {
    public static final String COMPLETED = "COMPLETED";
    public static final String FAILED = "FAILED";
    public static final String CANCELLED = "CANCELLED";

    public boolean succeeded() {
        return COMPLETED.equals(status);
    }
}
