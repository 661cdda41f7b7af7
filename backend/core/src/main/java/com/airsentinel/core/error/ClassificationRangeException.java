package com.airsentinel.core.error;

/**
 * Raised for a concentration that cannot be classified: negative, NaN or infinite.
 */
public class ClassificationRangeException extends AirSentinelException {
    private final double concentration;

    public ClassificationRangeException(double concentration) {
        super("classification_range", "PM2.5 concentration out of range: " + concentration);
        this.concentration = concentration;
    }

    public double concentration() {
        return concentration;
    }
}
