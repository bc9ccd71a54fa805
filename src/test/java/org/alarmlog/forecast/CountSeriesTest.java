package org.alarmlog.forecast;

import org.alarmlog.data.AlarmTable;
import org.alarmlog.error.DataInsufficiencyException;
import org.alarmlog.error.SchemaException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CountSeriesTest {

    private static AlarmTable table(String[]... rows) {
        return new AlarmTable(List.of("timestamp", "alarm"), Arrays.asList(rows));
    }

    @Test
    void fillsEmptyDaysWithZero() {
        CountSeries series = CountSeries.resample(table(
                new String[]{"2024-01-01 10:00", "5"},
                new String[]{"2024-01-01 23:59", "6"},
                new String[]{"2024-01-04 00:00", "5"}), ChronoUnit.DAYS);

        assertArrayEquals(new double[]{2, 0, 0, 1}, series.getCounts(), 0.0);
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), series.first());
        assertEquals(LocalDateTime.of(2024, 1, 4, 0, 0), series.last());
    }

    @Test
    void skipsUnparseableTimestampsAndBlankAlarms() {
        CountSeries series = CountSeries.resample(table(
                new String[]{"2024-01-01", "5"},
                new String[]{"garbage", "5"},
                new String[]{"2024-01-02", ""}), ChronoUnit.DAYS);

        assertArrayEquals(new double[]{1, 0}, series.getCounts(), 0.0);
    }

    @Test
    void weeksStartOnMonday() {
        // 2024-01-03 is a Wednesday, 2024-01-08 the next Monday
        CountSeries series = CountSeries.resample(table(
                new String[]{"2024-01-03 09:00", "1"},
                new String[]{"2024-01-08 09:00", "1"}), ChronoUnit.WEEKS);

        assertEquals(List.of(LocalDateTime.of(2024, 1, 1, 0, 0), LocalDateTime.of(2024, 1, 8, 0, 0)),
                series.getPeriods());
    }

    @Test
    void futurePeriodsFollowTheLastOne() {
        CountSeries series = CountSeries.resample(table(new String[]{"2024-02-28 12:30", "1"}), ChronoUnit.HOURS);

        assertEquals(List.of(LocalDateTime.of(2024, 2, 28, 13, 0), LocalDateTime.of(2024, 2, 28, 14, 0)),
                series.futurePeriods(2));
    }

    @Test
    void acceptsEpochSeconds() {
        CountSeries series = CountSeries.resample(table(new String[]{"86400", "1"}), ChronoUnit.DAYS);

        assertEquals(LocalDateTime.of(1970, 1, 2, 0, 0), series.first());
    }

    @Test
    void failsWithoutTimestamps() {
        assertThrows(DataInsufficiencyException.class,
                () -> CountSeries.resample(table(new String[]{"never", "1"}), ChronoUnit.DAYS));
        AlarmTable noAlarm = new AlarmTable(List.of("timestamp"), List.<String[]>of(new String[]{"2024-01-01"}));
        assertThrows(SchemaException.class, () -> CountSeries.resample(noAlarm, ChronoUnit.DAYS));
    }
}
