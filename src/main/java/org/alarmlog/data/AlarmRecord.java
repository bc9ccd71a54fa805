package org.alarmlog.data;

import java.util.Objects;

/**
 * One alarm event of one machine. The timestamp is an ordering key in seconds.
 */
public final class AlarmRecord {

    private final String serial;
    private final double timestamp;
    private final double alarmCode;

    public AlarmRecord(String serial, double timestamp, double alarmCode) {
        this.serial = Objects.requireNonNull(serial, "serial");
        this.timestamp = timestamp;
        this.alarmCode = alarmCode;
    }

    public String getSerial() {
        return serial;
    }

    public double getTimestamp() {
        return timestamp;
    }

    public double getAlarmCode() {
        return alarmCode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlarmRecord)) return false;
        AlarmRecord that = (AlarmRecord) o;
        return Double.compare(that.timestamp, timestamp) == 0
                && Double.compare(that.alarmCode, alarmCode) == 0
                && serial.equals(that.serial);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serial, timestamp, alarmCode);
    }

    @Override
    public String toString() {
        return "AlarmRecord{serial=" + serial + ", timestamp=" + timestamp + ", alarm=" + alarmCode + "}";
    }
}
