package org.alarmlog.data;

import org.alarmlog.error.DataInsufficiencyException;
import org.alarmlog.error.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Turns a raw {@link AlarmTable} into typed {@link AlarmRecord}s. Rows with an
 * unparseable timestamp, a non-numeric alarm code or a blank serial are dropped.
 */
public final class AlarmRecordReader {

    public static final String SERIAL = "serial";
    public static final String TIMESTAMP = "timestamp";
    public static final String ALARM = "alarm";

    private static final Logger log = LoggerFactory.getLogger(AlarmRecordReader.class);

    private AlarmRecordReader() {
    }

    /**
     * @throws SchemaException             when serial, timestamp or alarm is missing
     * @throws DataInsufficiencyException when no row survives the cleaning
     */
    public static List<AlarmRecord> read(AlarmTable table) {
        List<String> missing = table.missingColumns(TIMESTAMP, ALARM, SERIAL);
        if (!missing.isEmpty()) {
            throw new SchemaException(missing);
        }
        if (table.rowCount() == 0) {
            throw new DataInsufficiencyException("Dataset contains no rows");
        }

        List<AlarmRecord> records = new ArrayList<>(table.rowCount());
        int badTimestamps = 0;
        int badValues = 0;
        for (int i = 0; i < table.rowCount(); i++) {
            OptionalDouble ts = TimestampParser.parseSortKey(table.get(i, TIMESTAMP));
            if (ts.isEmpty()) {
                badTimestamps++;
                continue;
            }
            String serial = SerialKeys.canonical(table.get(i, SERIAL));
            OptionalDouble alarm = parseCode(table.get(i, ALARM));
            if (serial == null || alarm.isEmpty()) {
                badValues++;
                continue;
            }
            records.add(new AlarmRecord(serial, ts.getAsDouble(), alarm.getAsDouble()));
        }

        if (badTimestamps > 0) {
            log.warn("Some timestamp values could not be parsed, dropped {} of {} rows", badTimestamps, table.rowCount());
        }
        if (badTimestamps == table.rowCount()) {
            throw new DataInsufficiencyException("No valid timestamp data after conversion");
        }
        if (badValues > 0) {
            log.warn("Dropped {} rows with a non-numeric alarm code or blank serial", badValues);
        }
        if (records.isEmpty()) {
            throw new DataInsufficiencyException("No usable rows: every row lacks a numeric alarm code or a serial");
        }
        return records;
    }

    static OptionalDouble parseCode(String text) {
        if (text == null || text.isBlank()) return OptionalDouble.empty();
        try {
            double v = Double.parseDouble(text.trim());
            return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
