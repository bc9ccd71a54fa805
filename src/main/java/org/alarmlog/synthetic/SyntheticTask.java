package org.alarmlog.synthetic;

import org.alarmlog.error.ConfigurationException;

import java.util.Locale;

public enum SyntheticTask {
    /**
     * Overwrite a fraction of the alarm codes with a sentinel.
     */
    ANOMALY,
    /**
     * Daily alarm counts with Gaussian noise.
     */
    SERIES;

    public static SyntheticTask parse(String name) {
        if (name == null) {
            throw new ConfigurationException("Synthetic task is required, expected 'anomaly' or 'series'");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown synthetic task '" + name + "', expected 'anomaly' or 'series'", e);
        }
    }
}
