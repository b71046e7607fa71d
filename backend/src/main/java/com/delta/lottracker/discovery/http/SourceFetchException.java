package com.delta.lottracker.discovery.http;

import com.delta.lottracker.discovery.model.FailureClass;
import com.delta.lottracker.discovery.model.SourceTag;

/**
 * A channel request that failed after the retry budget, or failed permanently on the first try.
 */
public class SourceFetchException extends RuntimeException {
    private final SourceTag source;
    private final FailureClass failureClass;
    private final int statusCode;
    private final String reasonCode;

    public SourceFetchException(SourceTag source, FailureClass failureClass, int statusCode, String reasonCode, String message) {
        super(message);
        this.source = source;
        this.failureClass = failureClass;
        this.statusCode = statusCode;
        this.reasonCode = reasonCode;
    }

    public SourceTag source() {
        return source;
    }

    public FailureClass failureClass() {
        return failureClass;
    }

    public int statusCode() {
        return statusCode;
    }

    public String reasonCode() {
        return reasonCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isAuthRejected() {
        return statusCode == 401 || statusCode == 403;
    }
}
