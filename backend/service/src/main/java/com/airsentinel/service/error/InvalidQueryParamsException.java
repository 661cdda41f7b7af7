package com.airsentinel.service.error;

import com.airsentinel.core.error.AirSentinelException;

public class InvalidQueryParamsException extends AirSentinelException {
    public InvalidQueryParamsException(String message) {
        super("invalid_query_params", message);
    }

    public InvalidQueryParamsException(String message, Throwable cause) {
        super("invalid_query_params", message, cause);
    }
}
