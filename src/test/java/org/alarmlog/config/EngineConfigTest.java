package org.alarmlog.config;

import org.alarmlog.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.temporal.ChronoUnit;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngineConfigTest {

    @Test
    void defaultsMatchTheReferenceSetup() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(20, config.getEpochs());
        assertEquals(0.001, config.getLearningRate(), 0.0);
        assertEquals(0.95, config.getThresholdQuantile(), 0.0);
        assertEquals(0.7, config.getTrainFraction(), 0.0);
        assertEquals(3, config.getMinSequences());
        assertEquals(4, config.getClusterCount());
        assertEquals(ChronoUnit.DAYS, config.getForecastFrequency());
        assertEquals(12, config.getSeasonalPeriod());
        assertEquals(7, config.getDecompositionPeriod());
        assertEquals(Paths.get("test.csv"), config.getSyntheticOutputPath());
        assertEquals("-1", config.getAnomalySentinel());
        assertNull(config.getSyntheticSeed());
    }

    @Test
    void classpathResourceLoads() {
        EngineConfig config = EngineConfig.load();

        assertEquals(20, config.getEpochs());
        assertTrue(config.isSecondaryForecastEnabled());
    }

    @Test
    void readsProperties() {
        Properties props = new Properties();
        props.setProperty("anomaly.epochs", "5");
        props.setProperty("forecast.frequency", "w");
        props.setProperty("forecast.secondary.enabled", "FALSE");
        props.setProperty("synthetic.seed", "99");
        props.setProperty("synthetic.output-path", " out/synthetic.csv ");

        EngineConfig config = EngineConfig.fromProperties(props);

        assertEquals(5, config.getEpochs());
        assertEquals(ChronoUnit.WEEKS, config.getForecastFrequency());
        assertFalse(config.isSecondaryForecastEnabled());
        assertEquals(99L, config.getSyntheticSeed());
        assertEquals(Paths.get("out/synthetic.csv"), config.getSyntheticOutputPath());
    }

    @Test
    void rejectsBadValues() {
        Properties notANumber = new Properties();
        notANumber.setProperty("anomaly.epochs", "many");
        assertThrows(ConfigurationException.class, () -> EngineConfig.fromProperties(notANumber));

        Properties badFrequency = new Properties();
        badFrequency.setProperty("forecast.frequency", "fortnight");
        assertThrows(ConfigurationException.class, () -> EngineConfig.fromProperties(badFrequency));

        assertThrows(ConfigurationException.class, () -> EngineConfig.builder().trainFraction(1.0).build());
        assertThrows(ConfigurationException.class, () -> EngineConfig.builder().confidenceLevel(0).build());
    }

    @Test
    void toBuilderKeepsOtherSettings() {
        EngineConfig base = EngineConfig.builder().epochs(7).build();

        EngineConfig changed = base.toBuilder().clusterCount(2).build();

        assertEquals(7, changed.getEpochs());
        assertEquals(2, changed.getClusterCount());
    }
}
