package org.alarmlog.forecast;

import org.alarmlog.data.AlarmRecordReader;
import org.alarmlog.data.AlarmTable;
import org.alarmlog.data.TimestampParser;
import org.alarmlog.error.ConfigurationException;
import org.alarmlog.error.DataInsufficiencyException;
import org.alarmlog.error.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Alarm counts per regular period, from the first to the last period seen in the
 * log. Periods without alarms count as zero. Weeks are labelled by their Monday.
 */
public final class CountSeries {

    private static final Logger log = LoggerFactory.getLogger(CountSeries.class);

    private final ChronoUnit frequency;
    private final List<LocalDateTime> periods;
    private final double[] counts;

    CountSeries(ChronoUnit frequency, List<LocalDateTime> periods, double[] counts) {
        this.frequency = frequency;
        this.periods = Collections.unmodifiableList(new ArrayList<>(periods));
        this.counts = counts.clone();
    }

    /**
     * Counts the rows carrying an alarm per period.
     *
     * @throws SchemaException             when timestamp or alarm is missing
     * @throws DataInsufficiencyException when no row has a usable timestamp
     */
    public static CountSeries resample(AlarmTable table, ChronoUnit frequency) {
        checkFrequency(frequency);
        List<String> missing = table.missingColumns(AlarmRecordReader.TIMESTAMP, AlarmRecordReader.ALARM);
        if (!missing.isEmpty()) {
            throw new SchemaException(missing);
        }
        if (table.rowCount() == 0) {
            throw new DataInsufficiencyException("Dataset contains no rows");
        }

        TreeMap<LocalDateTime, Integer> buckets = new TreeMap<>();
        int dropped = 0;
        for (int i = 0; i < table.rowCount(); i++) {
            Optional<LocalDateTime> time = parse(table.get(i, AlarmRecordReader.TIMESTAMP));
            if (time.isEmpty()) {
                dropped++;
                continue;
            }
            String alarm = table.get(i, AlarmRecordReader.ALARM);
            int increment = alarm == null || alarm.isBlank() ? 0 : 1;
            buckets.merge(truncate(time.get(), frequency), increment, Integer::sum);
        }
        if (dropped > 0) {
            log.warn("Some timestamp values could not be parsed, dropped {} of {} rows", dropped, table.rowCount());
        }
        if (buckets.isEmpty()) {
            throw new DataInsufficiencyException("No valid timestamp data after conversion");
        }

        List<LocalDateTime> periods = new ArrayList<>();
        LocalDateTime last = buckets.lastKey();
        for (LocalDateTime p = buckets.firstKey(); !p.isAfter(last); p = p.plus(1, frequency)) {
            periods.add(p);
        }
        double[] counts = new double[periods.size()];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = buckets.getOrDefault(periods.get(i), 0);
        }
        log.info("Resampled {} rows into {} {} periods", table.rowCount() - dropped, counts.length,
                frequency.toString().toLowerCase(Locale.ROOT));
        return new CountSeries(frequency, periods, counts);
    }

    static Optional<LocalDateTime> parse(String text) {
        Optional<LocalDateTime> calendar = TimestampParser.parseDateTime(text);
        if (calendar.isPresent() || text == null) {
            return calendar;
        }
        // bare numbers are epoch seconds
        try {
            double seconds = Double.parseDouble(text.trim());
            if (!Double.isFinite(seconds)) return Optional.empty();
            long whole = (long) Math.floor(seconds);
            int nanos = (int) Math.round((seconds - whole) * 1_000_000_000L);
            return Optional.of(LocalDateTime.ofEpochSecond(whole, Math.min(nanos, 999_999_999), ZoneOffset.UTC));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    static LocalDateTime truncate(LocalDateTime time, ChronoUnit frequency) {
        switch (frequency) {
            case HOURS:
                return time.truncatedTo(ChronoUnit.HOURS);
            case DAYS:
                return time.truncatedTo(ChronoUnit.DAYS);
            case WEEKS:
                return time.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            default:
                throw new ConfigurationException("Unsupported forecast frequency: " + frequency);
        }
    }

    private static void checkFrequency(ChronoUnit frequency) {
        if (frequency != ChronoUnit.HOURS && frequency != ChronoUnit.DAYS && frequency != ChronoUnit.WEEKS) {
            throw new ConfigurationException("Unsupported forecast frequency: " + frequency);
        }
    }

    public List<LocalDateTime> futurePeriods(int steps) {
        List<LocalDateTime> future = new ArrayList<>(steps);
        LocalDateTime last = periods.get(periods.size() - 1);
        for (int h = 1; h <= steps; h++) {
            future.add(last.plus(h, frequency));
        }
        return future;
    }

    public ChronoUnit getFrequency() {
        return frequency;
    }

    public List<LocalDateTime> getPeriods() {
        return periods;
    }

    public double[] getCounts() {
        return counts.clone();
    }

    public int size() {
        return counts.length;
    }

    public LocalDateTime first() {
        return periods.get(0);
    }

    public LocalDateTime last() {
        return periods.get(periods.size() - 1);
    }
}
