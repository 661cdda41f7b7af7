package com.airsentinel.core.aqi;

import com.airsentinel.core.model.AqiCategory;

import java.math.BigDecimal;

/**
 * One row of the EPA PM2.5 table: concentrations {@code [cLow, cHigh]} map linearly onto
 * {@code [aqiLow, aqiHigh]}.
 */
public record Breakpoint(
        BigDecimal cLow,
        BigDecimal cHigh,
        int aqiLow,
        int aqiHigh,
        AqiCategory category
) {
    public Breakpoint {
        if (cHigh.compareTo(cLow) <= 0) {
            throw new IllegalArgumentException("cHigh must be greater than cLow");
        }
        if (aqiHigh <= aqiLow) {
            throw new IllegalArgumentException("aqiHigh must be greater than aqiLow");
        }
    }

    static Breakpoint of(String cLow, String cHigh, int aqiLow, int aqiHigh, AqiCategory category) {
        return new Breakpoint(new BigDecimal(cLow), new BigDecimal(cHigh), aqiLow, aqiHigh, category);
    }

    boolean contains(BigDecimal concentration) {
        return cLow.compareTo(concentration) <= 0 && concentration.compareTo(cHigh) <= 0;
    }
}
