package org.alarmlog.forecast;

import java.time.LocalDateTime;

/**
 * Predicted alarm count of one future period with its confidence bounds.
 */
public final class ForecastPoint {

    private final LocalDateTime period;
    private final double mean;
    private final double lower;
    private final double upper;

    ForecastPoint(LocalDateTime period, double mean, double lower, double upper) {
        this.period = period;
        this.mean = mean;
        this.lower = lower;
        this.upper = upper;
    }

    public LocalDateTime getPeriod() {
        return period;
    }

    public double getMean() {
        return mean;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    @Override
    public String toString() {
        return period + "=" + mean + " [" + lower + ", " + upper + "]";
    }
}
