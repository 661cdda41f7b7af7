package com.airsentinel.service.query;

import com.airsentinel.core.model.ForecastPoint;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ForecastResponse(
        String city,
        @JsonProperty("forecast_days") int forecastDays,
        int count,
        List<ForecastPoint> data
) {
}
