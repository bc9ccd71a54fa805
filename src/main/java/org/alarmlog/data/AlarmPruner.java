package org.alarmlog.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses consecutive repeats of the same alarm code per machine, so a burst of
 * one alarm counts as one event.
 */
public final class AlarmPruner {

    private static final Logger log = LoggerFactory.getLogger(AlarmPruner.class);

    private static final Comparator<AlarmRecord> SERIAL_THEN_TIME =
            Comparator.comparing(AlarmRecord::getSerial, SerialKeys.ORDER)
                    .thenComparingDouble(AlarmRecord::getTimestamp);

    private AlarmPruner() {
    }

    public static PrunedLog prune(List<AlarmRecord> records) {
        // 1. Stable sort by serial and timestamp
        List<AlarmRecord> sorted = new ArrayList<>(records);
        sorted.sort(SERIAL_THEN_TIME);

        // 2. Keep a row only when its code differs from the previous kept one
        Map<String, List<AlarmRecord>> groups = new LinkedHashMap<>();
        for (AlarmRecord record : sorted) {
            List<AlarmRecord> group = groups.computeIfAbsent(record.getSerial(), k -> new ArrayList<>());
            if (group.isEmpty()
                    || Double.compare(group.get(group.size() - 1).getAlarmCode(), record.getAlarmCode()) != 0) {
                group.add(record);
            }
        }

        PrunedLog pruned = new PrunedLog(groups);
        log.info("Pruned alarm log from {} to {} rows across {} machines",
                records.size(), pruned.size(), groups.size());
        return pruned;
    }

    public static PrunedLog prune(PrunedLog pruned) {
        return prune(pruned.allRecords());
    }
}
