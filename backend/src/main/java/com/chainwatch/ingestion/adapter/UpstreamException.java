package com.chainwatch.ingestion.adapter;

/**
 * Thrown when an upstream provider call fails: HTTP error, provider-level error status, malformed body or local
 * limiter timeout. Always transient from the jobs' point of view.
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
