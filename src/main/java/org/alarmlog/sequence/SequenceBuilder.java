package org.alarmlog.sequence;

import org.alarmlog.data.PrunedLog;
import org.alarmlog.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Slides a fixed-width window over each machine's pruned alarm codes.
 */
public final class SequenceBuilder {

    public static final int DEFAULT_WINDOW_SIZE = 10;
    public static final int DEFAULT_FORECAST_HORIZON = 1;

    private static final Logger log = LoggerFactory.getLogger(SequenceBuilder.class);

    private SequenceBuilder() {
    }

    public static void validate(int windowSize, int forecastHorizon) {
        if (windowSize < 2) {
            throw new ConfigurationException("window_size must be at least 2, got " + windowSize);
        }
        if (forecastHorizon < 1 || forecastHorizon >= windowSize) {
            throw new ConfigurationException("forecast_horizon must be in [1, " + (windowSize - 1) + "], got "
                    + forecastHorizon);
        }
    }

    public static MachineSequences build(String serial, double[] codes, int windowSize, int forecastHorizon) {
        validate(windowSize, forecastHorizon);
        List<double[]> windows = new ArrayList<>();
        List<ForecastPair> pairs = new ArrayList<>();
        for (int i = 0; i + windowSize <= codes.length; i++) {
            double[] window = Arrays.copyOfRange(codes, i, i + windowSize);
            int split = windowSize - forecastHorizon;
            pairs.add(new ForecastPair(Arrays.copyOfRange(window, 0, split),
                    Arrays.copyOfRange(window, split, windowSize)));
            windows.add(window);
        }
        return new MachineSequences(serial, windowSize, windows, pairs);
    }

    /**
     * One entry per machine of the log, in log order, including machines without
     * enough history.
     */
    public static Map<String, MachineSequences> buildAll(PrunedLog pruned, int windowSize, int forecastHorizon) {
        validate(windowSize, forecastHorizon);
        Map<String, MachineSequences> result = new LinkedHashMap<>();
        for (String serial : pruned.serials()) {
            MachineSequences sequences = build(serial, pruned.alarmCodes(serial), windowSize, forecastHorizon);
            result.put(serial, sequences);
            log.info("Machine {}: generated {} forecasting and {} anomaly sequences",
                    serial, sequences.getForecastPairs().size(), sequences.size());
        }
        return result;
    }
}
