package org.alarmlog.forecast;

import org.alarmlog.error.DataInsufficiencyException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Augmented Dickey-Fuller test with a constant term. The regression
 * {@code dy(t) = a + g*y(t-1) + sum b(i)*dy(t-i)} is fitted by least squares and
 * the t-statistic of {@code g} is compared with the asymptotic critical values.
 * The number of lagged differences is picked by AIC on a common sample.
 */
public final class StationarityCheck {

    static final double CRITICAL_1 = -3.43;
    static final double CRITICAL_5 = -2.86;
    static final double CRITICAL_10 = -2.57;

    private static final int MIN_OBSERVATIONS = 8;

    private StationarityCheck() {
    }

    public static Result test(double[] y) {
        int n = y.length;
        if (n < MIN_OBSERVATIONS) {
            throw new DataInsufficiencyException("Insufficient data: stationarity test needs at least "
                    + MIN_OBSERVATIONS + " observations, have " + n);
        }
        double[] dy = new double[n - 1];
        for (int t = 1; t < n; t++) {
            dy[t - 1] = y[t] - y[t - 1];
        }

        // same rule of thumb as the usual ADF default, limited by the sample size
        int maxLag = (int) Math.floor(12 * Math.pow(n / 100.0, 0.25));
        maxLag = Math.max(0, Math.min(maxLag, (dy.length - 4) / 2));

        int bestLag = 0;
        double bestAic = Double.POSITIVE_INFINITY;
        for (int p = 0; p <= maxLag; p++) {
            OLSMultipleLinearRegression ols = regression(y, dy, p, maxLag);
            int rows = dy.length - maxLag;
            double rss = ols.calculateResidualSumOfSquares();
            double aic = rows * Math.log(Math.max(rss, Double.MIN_NORMAL) / rows) + 2.0 * (p + 2);
            if (aic < bestAic) {
                bestAic = aic;
                bestLag = p;
            }
        }

        OLSMultipleLinearRegression ols = regression(y, dy, bestLag, bestLag);
        double gamma = ols.estimateRegressionParameters()[1];
        double se = ols.estimateRegressionParametersStandardErrors()[1];
        double statistic = se > 0 ? gamma / se : Double.NEGATIVE_INFINITY;
        return new Result(statistic, bestLag, dy.length - bestLag);
    }

    /**
     * Rows start at {@code start} in the difference series so models with
     * different lag counts can share one sample.
     */
    private static OLSMultipleLinearRegression regression(double[] y, double[] dy, int lags, int start) {
        int rows = dy.length - start;
        double[] target = new double[rows];
        double[][] x = new double[rows][lags + 1];
        for (int r = 0; r < rows; r++) {
            int t = start + r;
            target[r] = dy[t];
            x[r][0] = y[t];
            for (int i = 1; i <= lags; i++) {
                x[r][i] = dy[t - i];
            }
        }
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(target, x);
        return ols;
    }

    public static final class Result {
        private final double statistic;
        private final int lags;
        private final int observations;

        Result(double statistic, int lags, int observations) {
            this.statistic = statistic;
            this.lags = lags;
            this.observations = observations;
        }

        public double getStatistic() {
            return statistic;
        }

        public int getLags() {
            return lags;
        }

        public int getObservations() {
            return observations;
        }

        public Map<String, Double> getCriticalValues() {
            Map<String, Double> values = new LinkedHashMap<>();
            values.put("1%", CRITICAL_1);
            values.put("5%", CRITICAL_5);
            values.put("10%", CRITICAL_10);
            return values;
        }

        /**
         * Unit root rejected at the 5% level.
         */
        public boolean isStationary() {
            return statistic < CRITICAL_5;
        }

        @Override
        public String toString() {
            return String.format(Locale.ROOT, "ADF statistic=%.4f, lags=%d, 5%% critical=%.2f, %s",
                    statistic, lags, CRITICAL_5, isStationary() ? "stationary" : "non-stationary");
        }
    }
}
