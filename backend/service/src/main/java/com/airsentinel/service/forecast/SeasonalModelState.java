package com.airsentinel.service.forecast;

import java.util.List;

/**
 * Fitted parameters of {@link SeasonalForecastModel}.
 *
 * @param level deseasonalized concentration at the end of the training window
 * @param trendPerHour fitted slope before damping
 * @param damping per-step damping factor applied to the trend, in (0, 1]
 * @param hourOfDayOffsets 24 additive offsets indexed by UTC hour
 * @param dayOfWeekOffsets 7 additive offsets indexed Monday=0
 * @param uncertainty relative half-width of the prediction band
 */
public record SeasonalModelState(
        double level,
        double trendPerHour,
        double damping,
        List<Double> hourOfDayOffsets,
        List<Double> dayOfWeekOffsets,
        double uncertainty
) {
    public SeasonalModelState {
        if (hourOfDayOffsets == null || hourOfDayOffsets.size() != 24) {
            throw new IllegalArgumentException("hourOfDayOffsets must have 24 entries");
        }
        if (dayOfWeekOffsets == null || dayOfWeekOffsets.size() != 7) {
            throw new IllegalArgumentException("dayOfWeekOffsets must have 7 entries");
        }
        hourOfDayOffsets = List.copyOf(hourOfDayOffsets);
        dayOfWeekOffsets = List.copyOf(dayOfWeekOffsets);
    }
}
