package com.airsentinel.core.error;

/**
 * Base type for failures that callers are expected to tell apart. {@link #code()} is stable and
 * is what the HTTP layer and the event log expose.
 */
public abstract class AirSentinelException extends RuntimeException {
    private final String code;

    protected AirSentinelException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected AirSentinelException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
