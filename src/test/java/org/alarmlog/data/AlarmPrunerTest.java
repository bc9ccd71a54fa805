package org.alarmlog.data;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class AlarmPrunerTest {

    @Test
    void dropsConsecutiveRepeatsPerMachine() {
        List<AlarmRecord> records = Arrays.asList(
                new AlarmRecord("1", 1, 5),
                new AlarmRecord("1", 2, 5),
                new AlarmRecord("1", 3, 7),
                new AlarmRecord("1", 4, 5),
                new AlarmRecord("1", 5, 5),
                new AlarmRecord("2", 1, 5));

        PrunedLog pruned = AlarmPruner.prune(records);

        assertEquals(List.of("1", "2"), pruned.serials());
        assertArrayEquals(new double[]{5, 7, 5}, pruned.alarmCodes("1"));
        assertArrayEquals(new double[]{5}, pruned.alarmCodes("2"));
        assertEquals(4, pruned.size());
    }

    @Test
    void sortsByTimestampBeforePruning() {
        List<AlarmRecord> records = Arrays.asList(
                new AlarmRecord("A", 30, 1),
                new AlarmRecord("A", 10, 1),
                new AlarmRecord("A", 20, 2));

        PrunedLog pruned = AlarmPruner.prune(records);

        assertArrayEquals(new double[]{1, 2, 1}, pruned.alarmCodes("A"));
    }

    @Test
    void numericSerialsComeFirstInNumericOrder() {
        List<AlarmRecord> records = Arrays.asList(
                new AlarmRecord("B", 1, 1),
                new AlarmRecord("10", 1, 1),
                new AlarmRecord("2", 1, 1));

        assertEquals(List.of("2", "10", "B"), AlarmPruner.prune(records).serials());
    }

    @Test
    void pruningTwiceChangesNothing() {
        List<AlarmRecord> records = Arrays.asList(
                new AlarmRecord("1", 1, 3),
                new AlarmRecord("1", 2, 3),
                new AlarmRecord("1", 3, 4),
                new AlarmRecord("1", 4, 4),
                new AlarmRecord("2", 2, 9),
                new AlarmRecord("2", 1, 9));

        PrunedLog once = AlarmPruner.prune(records);
        PrunedLog twice = AlarmPruner.prune(once);

        assertEquals(once.allRecords(), twice.allRecords());
        for (String serial : twice.serials()) {
            double[] codes = twice.alarmCodes(serial);
            for (int i = 1; i < codes.length; i++) {
                assertNotEquals(codes[i - 1], codes[i]);
            }
        }
    }
}
