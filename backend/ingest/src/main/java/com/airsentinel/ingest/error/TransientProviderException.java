package com.airsentinel.ingest.error;

/**
 * A provider failure that may succeed on retry: timeouts, connection resets, HTTP 429 and 5xx.
 */
public class TransientProviderException extends RuntimeException {
    public TransientProviderException(String message) {
        super(message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
