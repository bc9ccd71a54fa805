package org.alarmlog.anomaly;

import java.util.Arrays;

/**
 * Anomaly cut-off derived from training reconstruction errors.
 */
public final class ThresholdCalculator {

    private ThresholdCalculator() {
    }

    /**
     * Quantile with linear interpolation between the closest ranks.
     *
     * @param quantile value in [0, 1]
     */
    public static double quantile(double[] values, double quantile) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot take a quantile of no values");
        }
        if (quantile < 0 || quantile > 1) {
            throw new IllegalArgumentException("Quantile must be in [0, 1], got " + quantile);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        double index = quantile * (n - 1);
        int lower = (int) Math.floor(index);
        if (lower >= n - 1) return sorted[n - 1];
        double fraction = index - lower;
        return sorted[lower] + fraction * (sorted[lower + 1] - sorted[lower]);
    }

    public static int countAbove(double[] errors, double threshold) {
        int count = 0;
        for (double e : errors) {
            if (e > threshold) count++;
        }
        return count;
    }
}
