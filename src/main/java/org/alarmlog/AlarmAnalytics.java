package org.alarmlog;

import org.alarmlog.anomaly.AnomalyEngine;
import org.alarmlog.anomaly.AnomalyResult;
import org.alarmlog.config.EngineConfig;
import org.alarmlog.forecast.ForecastEngine;
import org.alarmlog.forecast.ForecastResult;
import org.alarmlog.result.AnalysisOutcome;
import org.alarmlog.sequence.SequenceBuilder;
import org.alarmlog.synthetic.SyntheticDataGenerator;
import org.alarmlog.synthetic.SyntheticTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Entry point for the three alarm log tools. Each call builds its own engine,
 * so calls share nothing but the immutable configuration.
 */
public class AlarmAnalytics {

    private static final Logger log = LoggerFactory.getLogger(AlarmAnalytics.class);

    private final EngineConfig config;

    public AlarmAnalytics() {
        this(EngineConfig.load());
    }

    public AlarmAnalytics(EngineConfig config) {
        this.config = config;
    }

    public AnalysisOutcome<AnomalyResult> runAnomalyDetection(Path path) {
        return runAnomalyDetection(path, SequenceBuilder.DEFAULT_WINDOW_SIZE, SequenceBuilder.DEFAULT_FORECAST_HORIZON, null);
    }

    public AnalysisOutcome<AnomalyResult> runAnomalyDetection(Path path, int windowSize, int forecastHorizon,
                                                              String machineSerial) {
        return new AnomalyEngine(config).run(path, windowSize, forecastHorizon, machineSerial);
    }

    public AnalysisOutcome<ForecastResult> runForecasting(Path path) {
        return runForecasting(path, ForecastEngine.DEFAULT_STEPS);
    }

    public AnalysisOutcome<ForecastResult> runForecasting(Path path, int steps) {
        return new ForecastEngine(config).run(path, steps);
    }

    public String generateSyntheticData(Path path, SyntheticTask task, Double anomalyPct) {
        return generateSyntheticData(path, task, anomalyPct, SyntheticDataGenerator.DEFAULT_SERIES_NOISE);
    }

    public String generateSyntheticData(Path path, SyntheticTask task, Double anomalyPct, double seriesNoise) {
        return new SyntheticDataGenerator(config).generate(path, task, anomalyPct, seriesNoise);
    }

    /**
     * Same as the four argument form but writes to {@code output} instead of the
     * configured path, for callers generating several files at once.
     */
    public String generateSyntheticData(Path path, SyntheticTask task, Double anomalyPct, double seriesNoise,
                                        Path output) {
        return new SyntheticDataGenerator(config).generate(path, task, anomalyPct, seriesNoise, output);
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: anomaly <file> [window] [horizon] [serial]");
            System.err.println("       forecast <file> [steps]");
            System.err.println("       synthetic <file> <anomaly|series> [anomalyPct] [seriesNoise]");
            System.exit(2);
        }
        AlarmAnalytics analytics = new AlarmAnalytics();
        Path path = Paths.get(args[1]);
        switch (args[0]) {
            case "anomaly": {
                int window = args.length > 2 ? Integer.parseInt(args[2]) : SequenceBuilder.DEFAULT_WINDOW_SIZE;
                int horizon = args.length > 3 ? Integer.parseInt(args[3]) : SequenceBuilder.DEFAULT_FORECAST_HORIZON;
                String serial = args.length > 4 ? args[4] : null;
                AnalysisOutcome<AnomalyResult> outcome = analytics.runAnomalyDetection(path, window, horizon, serial);
                System.out.println(outcome.summary());
                System.out.println("Figures: " + outcome.figures().size());
                break;
            }
            case "forecast": {
                int steps = args.length > 2 ? Integer.parseInt(args[2]) : ForecastEngine.DEFAULT_STEPS;
                AnalysisOutcome<ForecastResult> outcome = analytics.runForecasting(path, steps);
                System.out.println(outcome.summary());
                outcome.value().ifPresent(r -> r.forecast().forEach((period, value) ->
                        System.out.println(period.toLocalDate() + "\t" + value)));
                System.out.println("Figures: " + outcome.figures().size());
                break;
            }
            case "synthetic": {
                if (args.length < 3) {
                    System.err.println("Missing synthetic task");
                    System.exit(2);
                }
                SyntheticTask task = SyntheticTask.parse(args[2]);
                Double pct = args.length > 3 ? Double.valueOf(args[3]) : null;
                double noise = args.length > 4 ? Double.parseDouble(args[4]) : SyntheticDataGenerator.DEFAULT_SERIES_NOISE;
                System.out.println(analytics.generateSyntheticData(path, task, pct, noise));
                break;
            }
            default:
                log.error("Unknown command {}", args[0]);
                System.exit(2);
        }
    }
}
