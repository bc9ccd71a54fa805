package org.alarmlog.forecast;

import org.alarmlog.error.DataInsufficiencyException;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StationarityCheckTest {

    @Test
    void meanRevertingSeriesIsStationary() {
        Random random = new Random(42);
        double[] y = new double[200];
        for (int t = 1; t < y.length; t++) {
            y[t] = 0.3 * y[t - 1] + random.nextGaussian();
        }

        StationarityCheck.Result result = StationarityCheck.test(y);

        assertTrue(result.isStationary(), result.toString());
        assertTrue(result.getStatistic() < StationarityCheck.CRITICAL_1);
    }

    @Test
    void persistentLevelShiftIsNotStationary() {
        Random random = new Random(1);
        double[] y = new double[100];
        for (int t = 0; t < y.length; t++) {
            y[t] = (t < 50 ? 0 : 10) + 0.01 * random.nextGaussian();
        }

        StationarityCheck.Result result = StationarityCheck.test(y);

        assertFalse(result.isStationary(), result.toString());
    }

    @Test
    void reportsCriticalValues() {
        Random random = new Random(3);
        double[] y = new double[50];
        for (int t = 0; t < y.length; t++) y[t] = random.nextGaussian();

        StationarityCheck.Result result = StationarityCheck.test(y);

        assertEquals(-2.86, result.getCriticalValues().get("5%"), 0.0);
        assertTrue(result.getLags() >= 0);
        assertEquals(y.length - 1 - result.getLags(), result.getObservations());
    }

    @Test
    void needsSomeObservations() {
        assertThrows(DataInsufficiencyException.class, () -> StationarityCheck.test(new double[]{1, 2, 3}));
    }
}
