package com.airsentinel.service.forecast;

import com.airsentinel.core.model.SensorReading;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Additive seasonal model: recent level, damped linear trend, hour-of-day and day-of-week
 * offsets. Predictions are floored at zero and carry a fixed relative band.
 */
public final class SeasonalForecastModel {
    static final double TREND_DAMPING = 0.95;
    static final double UNCERTAINTY = 0.15;
    private static final int LEVEL_HOURS = 24;

    private final SeasonalModelState state;
    private final Instant anchor;

    public SeasonalForecastModel(SeasonalModelState state, Instant anchor) {
        this.state = state;
        this.anchor = anchor;
    }

    public static SeasonalForecastModel of(ModelArtifact artifact) {
        return new SeasonalForecastModel(artifact.state(), artifact.windowEnd());
    }

    /**
     * Fits on readings in ascending timestamp order.
     */
    public static SeasonalModelState fit(List<SensorReading> readings) {
        if (readings.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a model without readings");
        }
        int n = readings.size();
        double mean = 0;
        for (SensorReading reading : readings) {
            mean += reading.pm25();
        }
        mean /= n;

        double[] hourSums = new double[24];
        int[] hourCounts = new int[24];
        for (SensorReading reading : readings) {
            int hour = hourOf(reading.timestamp());
            hourSums[hour] += reading.pm25();
            hourCounts[hour]++;
        }
        double[] hourOffsets = new double[24];
        for (int h = 0; h < 24; h++) {
            hourOffsets[h] = hourCounts[h] == 0 ? 0.0 : hourSums[h] / hourCounts[h] - mean;
        }

        double[] daySums = new double[7];
        int[] dayCounts = new int[7];
        for (SensorReading reading : readings) {
            int day = dayOf(reading.timestamp());
            daySums[day] += reading.pm25() - mean - hourOffsets[hourOf(reading.timestamp())];
            dayCounts[day]++;
        }
        double[] dayOffsets = new double[7];
        for (int d = 0; d < 7; d++) {
            dayOffsets[d] = dayCounts[d] == 0 ? 0.0 : daySums[d] / dayCounts[d];
        }

        Instant origin = readings.get(0).timestamp();
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            SensorReading reading = readings.get(i);
            x[i] = hoursBetween(origin, reading.timestamp());
            y[i] = reading.pm25() - hourOffsets[hourOf(reading.timestamp())] - dayOffsets[dayOf(reading.timestamp())];
        }
        double slope = slope(x, y);

        int recent = Math.min(LEVEL_HOURS, n);
        double recentY = 0;
        double recentX = 0;
        for (int i = n - recent; i < n; i++) {
            recentY += y[i];
            recentX += x[i];
        }
        double level = recentY / recent + slope * (x[n - 1] - recentX / recent);

        return new SeasonalModelState(level, slope, TREND_DAMPING, boxed(hourOffsets), boxed(dayOffsets), UNCERTAINTY);
    }

    public Prediction predict(Instant at) {
        double steps = Math.max(0.0, hoursBetween(anchor, at));
        double phi = state.damping();
        double trend = phi >= 1.0
                ? state.trendPerHour() * steps
                : state.trendPerHour() * phi * (1 - Math.pow(phi, steps)) / (1 - phi);
        double value = state.level()
                + trend
                + state.hourOfDayOffsets().get(hourOf(at))
                + state.dayOfWeekOffsets().get(dayOf(at));
        double pm25 = Math.max(0.0, value);
        return new Prediction(
                pm25,
                Math.max(0.0, pm25 * (1 - state.uncertainty())),
                pm25 * (1 + state.uncertainty())
        );
    }

    private static double slope(double[] x, double[] y) {
        int n = x.length;
        double meanX = 0;
        double meanY = 0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;
        double covariance = 0;
        double variance = 0;
        for (int i = 0; i < n; i++) {
            covariance += (x[i] - meanX) * (y[i] - meanY);
            variance += (x[i] - meanX) * (x[i] - meanX);
        }
        return variance == 0 ? 0.0 : covariance / variance;
    }

    private static double hoursBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMinutes() / 60.0;
    }

    private static int hourOf(Instant instant) {
        return ZonedDateTime.ofInstant(instant, ZoneOffset.UTC).getHour();
    }

    private static int dayOf(Instant instant) {
        return ZonedDateTime.ofInstant(instant, ZoneOffset.UTC).getDayOfWeek().getValue() - 1;
    }

    private static List<Double> boxed(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double value : values) {
            list.add(value);
        }
        return list;
    }

    public record Prediction(double pm25, double lower, double upper) {
    }
}
