package com.airsentinel.service.error;

import com.airsentinel.core.error.AirSentinelException;

public class NoDataException extends AirSentinelException {
    public NoDataException(String city) {
        super("no_data", "No data for " + city);
    }
}
