package org.alarmlog.data;

import org.alarmlog.error.DataInsufficiencyException;
import org.alarmlog.error.SchemaException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AlarmRecordReaderTest {

    @Test
    void reportsEveryMissingColumn() {
        AlarmTable table = new AlarmTable(List.of("serial"), Collections.singletonList(new String[]{"1"}));

        SchemaException e = assertThrows(SchemaException.class, () -> AlarmRecordReader.read(table));

        assertEquals(List.of("timestamp", "alarm"), e.getMissingColumns());
        assertEquals("Missing required columns: timestamp, alarm", e.getMessage());
    }

    @Test
    void dropsRowsWithBadTimestamps() {
        AlarmTable table = new AlarmTable(List.of("Serial", "Timestamp", "Alarm"), Arrays.asList(
                new String[]{"1", "00:01", "4"},
                new String[]{"1", "yesterday", "5"},
                new String[]{"1.0", "00:03", "6"}));

        List<AlarmRecord> records = AlarmRecordReader.read(table);

        assertEquals(2, records.size());
        assertEquals("1", records.get(1).getSerial());
        assertEquals(3.0, records.get(1).getTimestamp(), 1e-9);
    }

    @Test
    void failsWhenNoTimestampParses() {
        AlarmTable table = new AlarmTable(List.of("serial", "timestamp", "alarm"), Arrays.asList(
                new String[]{"1", "x", "4"},
                new String[]{"1", "y", "5"}));

        DataInsufficiencyException e = assertThrows(DataInsufficiencyException.class,
                () -> AlarmRecordReader.read(table));
        assertEquals("No valid timestamp data after conversion", e.getMessage());
    }

    @Test
    void failsOnEmptyTable() {
        AlarmTable table = new AlarmTable(List.of("serial", "timestamp", "alarm"), Collections.emptyList());

        assertThrows(DataInsufficiencyException.class, () -> AlarmRecordReader.read(table));
    }
}
