package org.alarmlog.forecast;

import org.alarmlog.error.DataInsufficiencyException;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Seasonal ARIMA (1,1,1)x(1,1,1)s on a count series.
 *
 * <p>The series is differenced once and seasonally once. The multiplicative AR
 * and MA polynomials are estimated as subset regressions on lags 1, s and s+1
 * with the Hannan-Rissanen method: a long autoregression supplies innovation
 * estimates, then the differenced series is regressed on its own lags and on
 * the lagged innovations. A series too short for the second stage is fitted
 * with the AR lags only.
 */
public final class SeasonalArimaModel {

    private static final Logger log = LoggerFactory.getLogger(SeasonalArimaModel.class);

    /**
     * Observations required on top of the parameter count in each regression.
     */
    private static final int SLACK = 4;

    private final int period;
    private final int[] lags;
    private final double[] history;
    private final double[] differenced;
    private final double[] ar;
    private final double[] ma;
    private final double[] innovations;
    private final int burnIn;
    private final double sigma2;
    private final double mse;

    private SeasonalArimaModel(int period, double[] history, double[] differenced, double[] ar, double[] ma) {
        this.period = period;
        this.lags = lagsFor(period);
        this.history = history;
        this.differenced = differenced;
        this.ar = ar;
        this.ma = ma;
        this.burnIn = period + 1;
        this.innovations = computeInnovations();

        double sum = 0;
        int count = 0;
        for (int t = burnIn; t < innovations.length; t++) {
            sum += innovations[t] * innovations[t];
            count++;
        }
        this.mse = count == 0 ? 0 : sum / count;
        int params = ar.length + (hasMovingAverage() ? ma.length : 0);
        this.sigma2 = count > params ? sum / (count - params) : mse;
    }

    static int[] lagsFor(int period) {
        return new int[]{1, period, period + 1};
    }

    /**
     * Smallest series length the AR-only fit accepts.
     */
    public static int minimumLength(int period) {
        return 2 * (period + 1) + lagsFor(period).length + SLACK;
    }

    public static SeasonalArimaModel fit(double[] y, int period) {
        if (period < 2) {
            throw new IllegalArgumentException("Seasonal period must be at least 2, got " + period);
        }
        if (y.length < minimumLength(period)) {
            throw new DataInsufficiencyException("Insufficient data: seasonal model with period " + period
                    + " needs at least " + minimumLength(period) + " observations, have " + y.length);
        }
        double[] w = difference(y, period);
        int[] lags = lagsFor(period);
        int maxLag = period + 1;

        // 1. Long autoregression for innovation estimates
        int longOrder = Math.min(period + 2, (w.length - 1) / 3);
        int start = longOrder + maxLag;
        if (longOrder >= 1 && w.length - start >= 2 * lags.length + SLACK) {
            double[] longCoefficients = regress(w, lagMatrix(w, longOrder, longOrder), longOrder,
                    new double[longOrder]);
            double[] e = new double[w.length];
            for (int t = longOrder; t < w.length; t++) {
                double fitted = 0;
                for (int k = 1; k <= longOrder; k++) {
                    fitted += longCoefficients[k - 1] * w[t - k];
                }
                e[t] = w[t] - fitted;
            }

            // 2. Regress on own lags and lagged innovations
            int rows = w.length - start;
            double[][] x = new double[rows][2 * lags.length];
            for (int r = 0; r < rows; r++) {
                int t = start + r;
                for (int j = 0; j < lags.length; j++) {
                    x[r][j] = w[t - lags[j]];
                    x[r][lags.length + j] = e[t - lags[j]];
                }
            }
            double[] coefficients = regress(w, x, start, new double[2 * lags.length]);
            double[] arPart = Arrays.copyOfRange(coefficients, 0, lags.length);
            double[] maPart = Arrays.copyOfRange(coefficients, lags.length, 2 * lags.length);
            log.info("Fitted seasonal ARIMA(1,1,1)x(1,1,1,{}) on {} observations", period, y.length);
            return new SeasonalArimaModel(period, y.clone(), w, arPart, maPart);
        }

        // 3. AR lags only
        double[] arPart = regress(w, lagMatrix(w, maxLag, lags), maxLag, new double[lags.length]);
        log.info("Series of {} observations too short for the MA terms, fitted seasonal ARIMA(1,1,0)x(1,1,0,{})",
                y.length, period);
        return new SeasonalArimaModel(period, y.clone(), w, arPart, new double[lags.length]);
    }

    /**
     * First difference followed by a seasonal difference.
     */
    static double[] difference(double[] y, int period) {
        double[] w = new double[y.length - period - 1];
        for (int j = 0; j < w.length; j++) {
            int t = j + period + 1;
            w[j] = (y[t] - y[t - 1]) - (y[t - period] - y[t - period - 1]);
        }
        return w;
    }

    private static double[][] lagMatrix(double[] w, int start, int order) {
        int[] lags = new int[order];
        for (int k = 0; k < order; k++) lags[k] = k + 1;
        return lagMatrix(w, start, lags);
    }

    private static double[][] lagMatrix(double[] w, int start, int[] lags) {
        double[][] x = new double[w.length - start][lags.length];
        for (int r = 0; r < x.length; r++) {
            for (int j = 0; j < lags.length; j++) {
                x[r][j] = w[start + r - lags[j]];
            }
        }
        return x;
    }

    /**
     * No-intercept least squares of {@code w[start..]} on {@code x}. A singular
     * design (a flat series, for instance) yields {@code fallback}.
     */
    private static double[] regress(double[] w, double[][] x, int start, double[] fallback) {
        double[] target = Arrays.copyOfRange(w, start, w.length);
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.setNoIntercept(true);
        ols.newSampleData(target, x);
        try {
            return ols.estimateRegressionParameters();
        } catch (SingularMatrixException e) {
            log.warn("Singular design matrix in seasonal ARIMA regression, using zero coefficients");
            return fallback;
        }
    }

    private double[] computeInnovations() {
        double[] a = new double[differenced.length];
        for (int t = 0; t < differenced.length; t++) {
            a[t] = differenced[t] - predictDifferenced(differenced, a, t);
        }
        return a;
    }

    /**
     * One-step prediction of {@code w[t]}; values before the start of the series count as zero.
     */
    private double predictDifferenced(double[] w, double[] a, int t) {
        double value = 0;
        for (int j = 0; j < lags.length; j++) {
            int s = t - lags[j];
            if (s >= 0) {
                value += ar[j] * w[s] + ma[j] * a[s];
            }
        }
        return value;
    }

    /**
     * Point forecasts and confidence bounds for the next {@code steps} periods.
     */
    public Forecast forecast(int steps, double confidenceLevel) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be positive");
        }
        int n = history.length;
        int m = differenced.length;
        double[] w = Arrays.copyOf(differenced, m + steps);
        double[] a = Arrays.copyOf(innovations, m + steps);
        double[] y = Arrays.copyOf(history, n + steps);
        for (int h = 0; h < steps; h++) {
            int t = m + h;
            w[t] = predictDifferenced(w, a, t);
            a[t] = 0;
            int i = n + h;
            y[i] = w[t] + y[i - 1] + y[i - period] - y[i - period - 1];
        }

        double[] psi = psiWeights(steps);
        double z = new NormalDistribution().inverseCumulativeProbability(0.5 + confidenceLevel / 2);
        double[] mean = Arrays.copyOfRange(y, n, n + steps);
        double[] lower = new double[steps];
        double[] upper = new double[steps];
        double cumulative = 0;
        for (int h = 0; h < steps; h++) {
            cumulative += psi[h] * psi[h];
            double half = z * Math.sqrt(sigma2 * cumulative);
            lower[h] = mean[h] - half;
            upper[h] = mean[h] + half;
        }
        return new Forecast(mean, lower, upper);
    }

    /**
     * MA(infinity) weights of the integrated model, from the AR polynomial
     * multiplied by (1 - B)(1 - B^s).
     */
    double[] psiWeights(int count) {
        int order = period + 1;
        double[] phi = new double[order + 1];
        phi[0] = 1;
        for (int j = 0; j < lags.length; j++) {
            phi[lags[j]] -= ar[j];
        }
        double[] integrated = multiply(multiply(phi, new double[]{1, -1}), seasonalDifference());
        double[] theta = new double[order + 1];
        theta[0] = 1;
        for (int j = 0; j < lags.length; j++) {
            theta[lags[j]] += ma[j];
        }

        double[] psi = new double[count];
        for (int k = 0; k < count; k++) {
            double value = k < theta.length ? theta[k] : 0;
            for (int i = 1; i <= Math.min(k, integrated.length - 1); i++) {
                value -= integrated[i] * psi[k - i];
            }
            psi[k] = value;
        }
        return psi;
    }

    private double[] seasonalDifference() {
        double[] d = new double[period + 1];
        d[0] = 1;
        d[period] = -1;
        return d;
    }

    private static double[] multiply(double[] p, double[] q) {
        double[] r = new double[p.length + q.length - 1];
        for (int i = 0; i < p.length; i++) {
            for (int j = 0; j < q.length; j++) {
                r[i + j] += p[i] * q[j];
            }
        }
        return r;
    }

    /**
     * In-sample innovations after the burn-in, scaled to unit variance.
     */
    public double[] standardizedResiduals() {
        double sd = Math.sqrt(sigma2);
        double[] out = new double[Math.max(0, innovations.length - burnIn)];
        for (int i = 0; i < out.length; i++) {
            out[i] = sd > 0 ? innovations[burnIn + i] / sd : 0;
        }
        return out;
    }

    public int getPeriod() {
        return period;
    }

    /**
     * Coefficients on the differenced series at lags 1, s and s+1.
     */
    public double[] getArCoefficients() {
        return ar.clone();
    }

    public double[] getMaCoefficients() {
        return ma.clone();
    }

    public boolean hasMovingAverage() {
        for (double c : ma) {
            if (c != 0) return true;
        }
        return false;
    }

    public double getSigma2() {
        return sigma2;
    }

    /**
     * Mean squared one-step error; equal on the original and the differenced scale.
     */
    public double getMse() {
        return mse;
    }

    public static final class Forecast {
        private final double[] mean;
        private final double[] lower;
        private final double[] upper;

        Forecast(double[] mean, double[] lower, double[] upper) {
            this.mean = mean;
            this.lower = lower;
            this.upper = upper;
        }

        public double[] getMean() {
            return mean.clone();
        }

        public double[] getLower() {
            return lower.clone();
        }

        public double[] getUpper() {
            return upper.clone();
        }
    }
}
