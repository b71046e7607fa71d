package com.delta.lottracker.discovery.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    int attempts,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return (statusCode == 200 || statusCode == 204) && errorCode == null;
    }

    public boolean isJson() {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("json");
    }

    public HttpFetchResult withAttempts(int attempts) {
        return new HttpFetchResult(
            requestedUrl,
            finalUri,
            statusCode,
            body,
            contentType,
            fetchedAt,
            duration,
            attempts,
            errorCode,
            errorMessage
        );
    }
}
