package org.alarmlog.sequence;

import java.util.Collections;
import java.util.List;

/**
 * Sliding windows of one machine, in temporal order. Empty when the machine has
 * fewer pruned alarms than the window size.
 */
public final class MachineSequences {

    private final String serial;
    private final int windowSize;
    private final List<double[]> windows;
    private final List<ForecastPair> forecastPairs;

    MachineSequences(String serial, int windowSize, List<double[]> windows, List<ForecastPair> forecastPairs) {
        this.serial = serial;
        this.windowSize = windowSize;
        this.windows = Collections.unmodifiableList(windows);
        this.forecastPairs = Collections.unmodifiableList(forecastPairs);
    }

    public String getSerial() {
        return serial;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public List<double[]> getWindows() {
        return windows;
    }

    public List<ForecastPair> getForecastPairs() {
        return forecastPairs;
    }

    public int size() {
        return windows.size();
    }

    public boolean isEmpty() {
        return windows.isEmpty();
    }
}
