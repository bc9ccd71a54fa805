package org.alarmlog.forecast;

import org.alarmlog.error.DataInsufficiencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Additive Holt-Winters exponential smoothing, used as a second opinion next to
 * the seasonal ARIMA forecast. Smoothing weights are chosen from a coarse grid
 * by the in-sample one-step squared error.
 */
public class HoltWintersForecaster {

    private static final Logger log = LoggerFactory.getLogger(HoltWintersForecaster.class);

    private static final double[] GRID = {0.1, 0.3, 0.5, 0.7, 0.9};

    private final int period;

    public HoltWintersForecaster(int period) {
        if (period < 2) {
            throw new IllegalArgumentException("Seasonal period must be at least 2, got " + period);
        }
        this.period = period;
    }

    public boolean canFit(int length) {
        return length >= 2 * period;
    }

    public Fit fit(double[] y) {
        if (!canFit(y.length)) {
            throw new DataInsufficiencyException("Insufficient data: Holt-Winters with period " + period
                    + " needs at least " + 2 * period + " observations, have " + y.length);
        }
        Fit best = null;
        for (double alpha : GRID) {
            for (double beta : GRID) {
                for (double gamma : GRID) {
                    Fit fit = smooth(y, alpha, beta, gamma);
                    if (best == null || fit.sse < best.sse) {
                        best = fit;
                    }
                }
            }
        }
        log.info("Holt-Winters weights alpha={} beta={} gamma={}", best.alpha, best.beta, best.gamma);
        return best;
    }

    private Fit smooth(double[] y, double alpha, double beta, double gamma) {
        double first = 0;
        double second = 0;
        for (int i = 0; i < period; i++) {
            first += y[i];
            second += y[period + i];
        }
        first /= period;
        second /= period;

        double level = first;
        double trend = (second - first) / period;
        double[] seasonal = new double[period];
        for (int i = 0; i < period; i++) {
            seasonal[i] = y[i] - first;
        }

        double sse = 0;
        for (int t = period; t < y.length; t++) {
            int phase = t % period;
            double predicted = level + trend + seasonal[phase];
            double error = y[t] - predicted;
            sse += error * error;
            double previousLevel = level;
            level = alpha * (y[t] - seasonal[phase]) + (1 - alpha) * (level + trend);
            trend = beta * (level - previousLevel) + (1 - beta) * trend;
            seasonal[phase] = gamma * (y[t] - level) + (1 - gamma) * seasonal[phase];
        }
        return new Fit(alpha, beta, gamma, level, trend, seasonal, y.length, sse);
    }

    public final class Fit {
        private final double alpha;
        private final double beta;
        private final double gamma;
        private final double level;
        private final double trend;
        private final double[] seasonal;
        private final int length;
        private final double sse;

        private Fit(double alpha, double beta, double gamma, double level, double trend, double[] seasonal,
                    int length, double sse) {
            this.alpha = alpha;
            this.beta = beta;
            this.gamma = gamma;
            this.level = level;
            this.trend = trend;
            this.seasonal = seasonal;
            this.length = length;
            this.sse = sse;
        }

        public double[] forecast(int steps) {
            double[] out = new double[steps];
            for (int h = 1; h <= steps; h++) {
                out[h - 1] = level + h * trend + seasonal[(length + h - 1) % period];
            }
            return out;
        }

        public double getAlpha() {
            return alpha;
        }

        public double getBeta() {
            return beta;
        }

        public double getGamma() {
            return gamma;
        }

        public double getSse() {
            return sse;
        }
    }
}
