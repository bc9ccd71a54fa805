package org.alarmlog.forecast;

import org.alarmlog.data.AlarmTable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

final class ForecastFixtures {

    static final LocalDate START = LocalDate.of(2024, 1, 1);

    private ForecastFixtures() {
    }

    /**
     * Weekly pattern with some noise, one row per alarm.
     */
    static int[] dailyCounts(int days, long seed) {
        Random random = new Random(seed);
        int[] counts = new int[days];
        for (int d = 0; d < days; d++) {
            int weekday = d % 7;
            counts[d] = 5 + (weekday >= 5 ? 4 : 0) + random.nextInt(3);
        }
        return counts;
    }

    static AlarmTable table(int[] counts) {
        List<String[]> rows = new ArrayList<>();
        for (int d = 0; d < counts.length; d++) {
            for (int i = 0; i < counts[d]; i++) {
                String time = String.format(Locale.ROOT, "%s %02d:%02d:00", START.plusDays(d), 8 + i % 10, i % 60);
                rows.add(new String[]{"1", time, Integer.toString(100 + i % 4)});
            }
        }
        return new AlarmTable(List.of("serial", "timestamp", "alarm"), rows);
    }

    static double[] noisySeasonal(int n, long seed) {
        Random random = new Random(seed);
        double[] y = new double[n];
        for (int t = 0; t < n; t++) {
            y[t] = 20 + 0.1 * t + 4 * Math.sin(2 * Math.PI * t / 12) + random.nextGaussian();
        }
        return y;
    }
}
