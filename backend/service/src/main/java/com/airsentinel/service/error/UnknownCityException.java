package com.airsentinel.service.error;

import com.airsentinel.core.error.AirSentinelException;

public class UnknownCityException extends AirSentinelException {
    private final String city;

    public UnknownCityException(String city) {
        super("unknown_city", "Unknown city: " + city);
        this.city = city;
    }

    public String city() {
        return city;
    }
}
