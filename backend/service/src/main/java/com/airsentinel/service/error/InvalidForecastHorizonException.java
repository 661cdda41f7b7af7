package com.airsentinel.service.error;

import com.airsentinel.core.error.AirSentinelException;

/**
 * Reported to HTTP clients as {@code invalid_query_params}.
 */
public class InvalidForecastHorizonException extends AirSentinelException {
    public InvalidForecastHorizonException(int days, int maxDays) {
        super("invalid_query_params", "Forecast days must be between 1 and " + maxDays + ", got " + days);
    }
}
