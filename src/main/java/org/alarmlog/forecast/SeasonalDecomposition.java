package org.alarmlog.forecast;

import org.alarmlog.error.DataInsufficiencyException;

import java.util.Arrays;

/**
 * Additive decomposition {@code y = trend + seasonal + residual}. The trend is a
 * centred moving average (2 x period for even periods), the seasonal part is the
 * mean detrended value of each phase, centred on zero. Trend and residual are
 * NaN at both ends where the moving average is undefined.
 */
public final class SeasonalDecomposition {

    private final int period;
    private final double[] observed;
    private final double[] trend;
    private final double[] seasonal;
    private final double[] residual;

    private SeasonalDecomposition(int period, double[] observed, double[] trend, double[] seasonal, double[] residual) {
        this.period = period;
        this.observed = observed;
        this.trend = trend;
        this.seasonal = seasonal;
        this.residual = residual;
    }

    public static SeasonalDecomposition additive(double[] y, int period) {
        if (period < 2) {
            throw new IllegalArgumentException("Decomposition period must be at least 2, got " + period);
        }
        int n = y.length;
        if (n < 2 * period) {
            throw new DataInsufficiencyException("Insufficient data: decomposition with period " + period
                    + " needs at least " + 2 * period + " observations, have " + n);
        }

        double[] trend = movingAverage(y, period);

        double[] phaseSum = new double[period];
        int[] phaseCount = new int[period];
        for (int t = 0; t < n; t++) {
            if (!Double.isNaN(trend[t])) {
                phaseSum[t % period] += y[t] - trend[t];
                phaseCount[t % period]++;
            }
        }
        double[] phaseMean = new double[period];
        double overall = 0;
        for (int i = 0; i < period; i++) {
            phaseMean[i] = phaseCount[i] == 0 ? 0 : phaseSum[i] / phaseCount[i];
            overall += phaseMean[i];
        }
        overall /= period;

        double[] seasonal = new double[n];
        double[] residual = new double[n];
        for (int t = 0; t < n; t++) {
            seasonal[t] = phaseMean[t % period] - overall;
            residual[t] = y[t] - trend[t] - seasonal[t];
        }
        return new SeasonalDecomposition(period, y.clone(), trend, seasonal, residual);
    }

    static double[] movingAverage(double[] y, int period) {
        int n = y.length;
        int half = period / 2;
        double[] weights;
        if (period % 2 == 0) {
            weights = new double[period + 1];
            Arrays.fill(weights, 1.0 / period);
            weights[0] = 0.5 / period;
            weights[period] = 0.5 / period;
        } else {
            weights = new double[period];
            Arrays.fill(weights, 1.0 / period);
        }
        double[] trend = new double[n];
        Arrays.fill(trend, Double.NaN);
        for (int t = half; t < n - half; t++) {
            double sum = 0;
            for (int k = 0; k < weights.length; k++) {
                sum += weights[k] * y[t - half + k];
            }
            trend[t] = sum;
        }
        return trend;
    }

    public int getPeriod() {
        return period;
    }

    public double[] getObserved() {
        return observed.clone();
    }

    public double[] getTrend() {
        return trend.clone();
    }

    public double[] getSeasonal() {
        return seasonal.clone();
    }

    public double[] getResidual() {
        return residual.clone();
    }
}
