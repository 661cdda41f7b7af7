package com.airsentinel.service.error;

import com.airsentinel.core.error.AirSentinelException;

public class InsufficientHistoryException extends AirSentinelException {
    private final int available;
    private final int required;

    public InsufficientHistoryException(String city, int available, int required) {
        super("insufficient_history", "Not enough history to train " + city + ": " + available
                + " hourly readings, need " + required);
        this.available = available;
        this.required = required;
    }

    public int available() {
        return available;
    }

    public int required() {
        return required;
    }
}
