package com.airsentinel.ingest.error;

import com.airsentinel.core.error.AirSentinelException;

/**
 * The provider answered, but not in the shape we validated against. Never retried.
 */
public class SchemaMismatchException extends AirSentinelException {
    public SchemaMismatchException(String message) {
        super("schema_mismatch", message);
    }

    public SchemaMismatchException(String message, Throwable cause) {
        super("schema_mismatch", message, cause);
    }
}
