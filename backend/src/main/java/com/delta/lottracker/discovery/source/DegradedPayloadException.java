package com.delta.lottracker.discovery.source;

/**
 * The rendered document was fetched but its embedded data block was missing or unreadable.
 */
public class DegradedPayloadException extends RuntimeException {
    private final String lotId;

    public DegradedPayloadException(String lotId, String message) {
        super(message);
        this.lotId = lotId;
    }

    public DegradedPayloadException(String lotId, String message, Throwable cause) {
        super(message, cause);
        this.lotId = lotId;
    }

    public String lotId() {
        return lotId;
    }
}
