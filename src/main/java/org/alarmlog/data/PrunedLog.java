package org.alarmlog.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-machine alarm records in time order, with no two adjacent records of a
 * machine sharing an alarm code. Machines iterate in {@link SerialKeys#ORDER}.
 */
public final class PrunedLog {

    private final Map<String, List<AlarmRecord>> byMachine;

    PrunedLog(Map<String, List<AlarmRecord>> byMachine) {
        Map<String, List<AlarmRecord>> copy = new LinkedHashMap<>();
        byMachine.forEach((serial, records) -> copy.put(serial, Collections.unmodifiableList(new ArrayList<>(records))));
        this.byMachine = Collections.unmodifiableMap(copy);
    }

    public List<String> serials() {
        return new ArrayList<>(byMachine.keySet());
    }

    public List<AlarmRecord> records(String serial) {
        return byMachine.getOrDefault(serial, Collections.emptyList());
    }

    public double[] alarmCodes(String serial) {
        List<AlarmRecord> records = records(serial);
        double[] codes = new double[records.size()];
        for (int i = 0; i < codes.length; i++) {
            codes[i] = records.get(i).getAlarmCode();
        }
        return codes;
    }

    /**
     * All records, machine by machine.
     */
    public List<AlarmRecord> allRecords() {
        List<AlarmRecord> all = new ArrayList<>();
        byMachine.values().forEach(all::addAll);
        return all;
    }

    public int size() {
        int n = 0;
        for (List<AlarmRecord> records : byMachine.values()) {
            n += records.size();
        }
        return n;
    }
}
