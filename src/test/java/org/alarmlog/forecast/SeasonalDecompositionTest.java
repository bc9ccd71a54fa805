package org.alarmlog.forecast;

import org.alarmlog.error.DataInsufficiencyException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SeasonalDecompositionTest {

    private static double[] trendPlusSeason(int n, double[] season) {
        double[] y = new double[n];
        for (int t = 0; t < n; t++) {
            y[t] = 2 * t + season[t % season.length];
        }
        return y;
    }

    @Test
    void recoversEvenPeriodComponents() {
        double[] season = {1, -1, 2, -2};
        SeasonalDecomposition d = SeasonalDecomposition.additive(trendPlusSeason(24, season), 4);

        double[] trend = d.getTrend();
        double[] seasonal = d.getSeasonal();
        double[] residual = d.getResidual();
        assertTrue(Double.isNaN(trend[0]));
        assertTrue(Double.isNaN(trend[1]));
        assertTrue(Double.isNaN(trend[22]));
        for (int t = 2; t < 22; t++) {
            assertEquals(2 * t, trend[t], 1e-9);
            assertEquals(0, residual[t], 1e-9);
        }
        for (int t = 0; t < 24; t++) {
            assertEquals(season[t % 4], seasonal[t], 1e-9);
        }
    }

    @Test
    void recoversOddPeriodComponents() {
        double[] season = {3, 0, -3};
        SeasonalDecomposition d = SeasonalDecomposition.additive(trendPlusSeason(15, season), 3);

        assertEquals(2 * 7, d.getTrend()[7], 1e-9);
        assertEquals(season[7 % 3], d.getSeasonal()[7], 1e-9);
        assertTrue(Double.isNaN(d.getResidual()[14]));
    }

    @Test
    void needsTwoFullPeriods() {
        assertThrows(DataInsufficiencyException.class,
                () -> SeasonalDecomposition.additive(new double[13], 7));
    }
}
