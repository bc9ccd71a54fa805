package org.alarmlog.synthetic;

import org.alarmlog.config.EngineConfig;
import org.alarmlog.data.AlarmRecordReader;
import org.alarmlog.data.AlarmTable;
import org.alarmlog.data.DatasetLoader;
import org.alarmlog.error.ConfigurationException;
import org.alarmlog.error.SchemaException;
import org.alarmlog.forecast.CountSeries;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes modified copies of an alarm log for evaluating the engines: either
 * with injected anomalies or as a noisy daily count series. Errors are thrown,
 * there is no partial result.
 */
public class SyntheticDataGenerator {

    private static final Logger log = LoggerFactory.getLogger(SyntheticDataGenerator.class);

    public static final double DEFAULT_SERIES_NOISE = 0.1;

    private final EngineConfig config;
    private final DatasetLoader loader;

    public SyntheticDataGenerator(EngineConfig config) {
        this(config, new DatasetLoader());
    }

    public SyntheticDataGenerator(EngineConfig config, DatasetLoader loader) {
        this.config = config;
        this.loader = loader;
    }

    public String generate(Path source, SyntheticTask task, Double anomalyPct, double seriesNoise) {
        return generate(source, task, anomalyPct, seriesNoise, config.getSyntheticOutputPath());
    }

    /**
     * @return the path of the written file
     */
    public String generate(Path source, SyntheticTask task, Double anomalyPct, double seriesNoise, Path output) {
        if (task == null) {
            throw new ConfigurationException("Synthetic task is required, expected 'anomaly' or 'series'");
        }
        AlarmTable table = loader.load(source);
        AlarmTable result;
        switch (task) {
            case ANOMALY:
                result = injectAnomalies(table, anomalyPct);
                break;
            case SERIES:
                result = noisySeries(table, seriesNoise);
                break;
            default:
                throw new ConfigurationException("Unsupported synthetic task: " + task);
        }
        Path written = loader.write(result, output);
        log.info("Synthetic {} data written to {}", task.name().toLowerCase(Locale.ROOT), written);
        return written.toString();
    }

    /**
     * Copy of {@code table} with {@code floor(rows * anomalyPct)} distinct rows,
     * picked uniformly, carrying the sentinel alarm code.
     */
    public AlarmTable injectAnomalies(AlarmTable table, Double anomalyPct) {
        if (anomalyPct == null) {
            throw new ConfigurationException("anomaly_pct is required for the anomaly task");
        }
        if (!(anomalyPct > 0 && anomalyPct <= 1)) {
            throw new ConfigurationException("anomaly_pct must be in (0, 1], got " + anomalyPct);
        }
        List<String> missing = table.missingColumns(AlarmRecordReader.ALARM);
        if (!missing.isEmpty()) {
            throw new SchemaException(missing);
        }

        AlarmTable copy = table.copy();
        int n = copy.rowCount();
        int k = (int) Math.floor(n * anomalyPct);
        if (k > 0) {
            for (int row : random().nextPermutation(n, k)) {
                copy.set(row, AlarmRecordReader.ALARM, config.getAnomalySentinel());
            }
        }
        log.info("Injected {} anomalies into {} rows", k, n);
        return copy;
    }

    /**
     * Daily alarm counts plus N(0, (noise * sd)^2), rounded to whole counts.
     */
    public AlarmTable noisySeries(AlarmTable table, double seriesNoise) {
        if (seriesNoise < 0 || Double.isNaN(seriesNoise)) {
            throw new ConfigurationException("series_noise must not be negative, got " + seriesNoise);
        }
        CountSeries series = CountSeries.resample(table, ChronoUnit.DAYS);
        double[] counts = series.getCounts();
        double sigma = counts.length > 1 ? seriesNoise * new StandardDeviation().evaluate(counts) : 0;
        RandomDataGenerator random = random();

        List<String[]> rows = new ArrayList<>(counts.length);
        for (int i = 0; i < counts.length; i++) {
            double noise = sigma > 0 ? random.nextGaussian(0, sigma) : 0;
            long value = Math.round(counts[i] + noise);
            rows.add(new String[]{series.getPeriods().get(i).toLocalDate().toString(), Long.toString(value)});
        }
        log.info("Built noisy series of {} days, noise sd {}", counts.length, sigma);
        return new AlarmTable(List.of(AlarmRecordReader.TIMESTAMP, AlarmRecordReader.ALARM), rows);
    }

    private RandomDataGenerator random() {
        RandomDataGenerator random = new RandomDataGenerator();
        if (config.getSyntheticSeed() != null) {
            random.reSeed(config.getSyntheticSeed());
        }
        return random;
    }
}
