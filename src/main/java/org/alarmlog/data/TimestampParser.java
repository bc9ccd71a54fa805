package org.alarmlog.data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Normalises the textual timestamp encodings found in alarm logs.
 */
public final class TimestampParser {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm"));

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"));

    private TimestampParser() {
    }

    /**
     * Parses {@code HH:MM:SS}, {@code MM:SS} (seconds may carry a fraction) or bare
     * seconds into a number of seconds.
     */
    public static OptionalDouble parseOffsetSeconds(String text) {
        if (text == null) return OptionalDouble.empty();
        String s = text.trim();
        if (s.isEmpty()) return OptionalDouble.empty();
        String[] parts = s.split(":");
        try {
            double value;
            if (parts.length == 3) {
                value = Integer.parseInt(parts[0].trim()) * 3600.0
                        + Integer.parseInt(parts[1].trim()) * 60.0
                        + Double.parseDouble(parts[2].trim());
            } else if (parts.length == 2) {
                value = Integer.parseInt(parts[0].trim()) * 60.0 + Double.parseDouble(parts[1].trim());
            } else if (parts.length == 1) {
                value = Double.parseDouble(s);
            } else {
                return OptionalDouble.empty();
            }
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Parses a calendar date or date-time. Offset date-times are converted to UTC.
     */
    public static Optional<LocalDateTime> parseDateTime(String text) {
        if (text == null) return Optional.empty();
        String s = text.trim();
        if (s.isEmpty()) return Optional.empty();
        for (DateTimeFormatter f : DATE_TIME_FORMATS) {
            LocalDateTime parsed = tryParse(s, f, false);
            if (parsed != null) return Optional.of(parsed);
        }
        LocalDateTime offset = tryParseOffset(s);
        if (offset != null) return Optional.of(offset);
        for (DateTimeFormatter f : DATE_FORMATS) {
            LocalDateTime parsed = tryParse(s, f, true);
            if (parsed != null) return Optional.of(parsed);
        }
        return Optional.empty();
    }

    private static LocalDateTime tryParse(String s, DateTimeFormatter f, boolean dateOnly) {
        try {
            return dateOnly ? LocalDate.parse(s, f).atStartOfDay() : LocalDateTime.parse(s, f);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDateTime tryParseOffset(String s) {
        try {
            return OffsetDateTime.parse(s).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Ordering key in seconds: clock offsets first, calendar date-times (epoch
     * seconds, UTC) otherwise.
     */
    public static OptionalDouble parseSortKey(String text) {
        OptionalDouble offset = parseOffsetSeconds(text);
        if (offset.isPresent()) {
            return offset;
        }
        return parseDateTime(text)
                .map(dt -> OptionalDouble.of(dt.toEpochSecond(ZoneOffset.UTC)))
                .orElse(OptionalDouble.empty());
    }
}
