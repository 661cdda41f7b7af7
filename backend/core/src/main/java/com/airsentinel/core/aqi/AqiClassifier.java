package com.airsentinel.core.aqi;

import com.airsentinel.core.error.ClassificationRangeException;
import com.airsentinel.core.model.AqiCategory;
import com.airsentinel.core.model.ClassifiedReading;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Maps a PM2.5 concentration (µg/m³) onto the US EPA Air Quality Index.
 *
 * <p>Concentrations are truncated to one decimal before lookup, which is how the published table
 * is meant to be read and what closes the gaps between rows (12.05 reads as 12.0). Values above the
 * top of the table are clamped to the Hazardous maximum rather than extrapolated.
 *
 * <p>Stateless and thread-safe; current readings and forecasts share one instance.
 */
public final class AqiClassifier {
    public static final List<Breakpoint> EPA_PM25_BREAKPOINTS = List.of(
            Breakpoint.of("0.0", "12.0", 0, 50, AqiCategory.GOOD),
            Breakpoint.of("12.1", "35.4", 51, 100, AqiCategory.MODERATE),
            Breakpoint.of("35.5", "55.4", 101, 150, AqiCategory.UNHEALTHY_FOR_SENSITIVE_GROUPS),
            Breakpoint.of("55.5", "150.4", 151, 200, AqiCategory.UNHEALTHY),
            Breakpoint.of("150.5", "250.4", 201, 300, AqiCategory.VERY_UNHEALTHY),
            Breakpoint.of("250.5", "500.4", 301, 500, AqiCategory.HAZARDOUS)
    );

    private final List<Breakpoint> breakpoints;

    public AqiClassifier() {
        this(EPA_PM25_BREAKPOINTS);
    }

    AqiClassifier(List<Breakpoint> breakpoints) {
        if (breakpoints.isEmpty()) {
            throw new IllegalArgumentException("breakpoints must not be empty");
        }
        this.breakpoints = List.copyOf(breakpoints);
    }

    public ClassifiedReading classify(double pm25) {
        if (!Double.isFinite(pm25) || pm25 < 0) {
            throw new ClassificationRangeException(pm25);
        }
        BigDecimal concentration = BigDecimal.valueOf(pm25).setScale(1, RoundingMode.FLOOR);

        Breakpoint lowest = breakpoints.get(0);
        if (concentration.compareTo(lowest.cLow()) < 0) {
            return new ClassifiedReading(0, lowest.category());
        }
        Breakpoint highest = breakpoints.get(breakpoints.size() - 1);
        if (concentration.compareTo(highest.cHigh()) > 0) {
            return new ClassifiedReading(highest.aqiHigh(), highest.category());
        }
        for (Breakpoint breakpoint : breakpoints) {
            if (breakpoint.contains(concentration)) {
                return new ClassifiedReading(interpolate(breakpoint, concentration), breakpoint.category());
            }
        }
        throw new IllegalStateException("No breakpoint covers concentration " + concentration);
    }

    private static int interpolate(Breakpoint breakpoint, BigDecimal concentration) {
        BigDecimal aqiSpan = BigDecimal.valueOf(breakpoint.aqiHigh() - breakpoint.aqiLow());
        BigDecimal concentrationSpan = breakpoint.cHigh().subtract(breakpoint.cLow());
        BigDecimal offset = concentration.subtract(breakpoint.cLow());
        BigDecimal aqi = aqiSpan.multiply(offset)
                .divide(concentrationSpan, MathContext.DECIMAL64)
                .add(BigDecimal.valueOf(breakpoint.aqiLow()));
        return aqi.setScale(0, RoundingMode.HALF_UP).intValueExact();
    }
}
