package org.alarmlog.anomaly;

import org.alarmlog.chart.ChartRenderer;
import org.alarmlog.config.EngineConfig;
import org.alarmlog.data.AlarmPruner;
import org.alarmlog.data.AlarmRecord;
import org.alarmlog.data.AlarmRecordReader;
import org.alarmlog.data.AlarmTable;
import org.alarmlog.data.DatasetLoader;
import org.alarmlog.data.PrunedLog;
import org.alarmlog.data.SerialKeys;
import org.alarmlog.error.AlarmEngineException;
import org.alarmlog.error.DataInsufficiencyException;
import org.alarmlog.error.MachineNotFoundException;
import org.alarmlog.result.AnalysisOutcome;
import org.alarmlog.result.FailureReason;
import org.alarmlog.sequence.MachineSequences;
import org.alarmlog.sequence.SequenceBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flags anomalous recent behaviour of one machine. An autoencoder is trained on
 * the machine's early alarm windows and the later windows whose reconstruction
 * error exceeds a quantile of the training errors are reported.
 *
 * <p>Every problem, from a missing file to an unknown serial, comes back as a
 * failed {@link AnalysisOutcome}; {@code run} and {@code detect} do not throw.
 */
public class AnomalyEngine {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEngine.class);

    private final EngineConfig config;
    private final DatasetLoader loader;
    private final ChartRenderer charts;

    public AnomalyEngine(EngineConfig config) {
        this(config, new DatasetLoader());
    }

    public AnomalyEngine(EngineConfig config, DatasetLoader loader) {
        this.config = config;
        this.loader = loader;
        this.charts = new ChartRenderer(config);
    }

    public AnalysisOutcome<AnomalyResult> run(Path path, int windowSize, int forecastHorizon, String machineSerial) {
        log.info("Starting anomaly detection on {}", path);
        AlarmTable table;
        try {
            table = loader.load(path);
        } catch (AlarmEngineException e) {
            log.error("Failed to load dataset: {}", e.getMessage());
            return AnalysisOutcome.failure(e.getReason(), "Error loading dataset: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to load dataset {}", path, e);
            return AnalysisOutcome.failure(FailureReason.LOAD_ERROR, "Error loading dataset: " + e.getMessage());
        }
        return detect(table, windowSize, forecastHorizon, machineSerial);
    }

    public AnalysisOutcome<AnomalyResult> detect(AlarmTable table, int windowSize, int forecastHorizon,
                                                 String machineSerial) {
        try {
            AnomalyResult result = execute(table, windowSize, forecastHorizon, machineSerial);
            log.info("Anomaly detection completed: {}", result.summary());
            return AnalysisOutcome.success(result, result.summary(), result.getFigures());
        } catch (AlarmEngineException e) {
            log.error("Anomaly detection stopped: {}", e.getMessage());
            return AnalysisOutcome.failure(e.getReason(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Anomaly detection failed", e);
            return AnalysisOutcome.failure(FailureReason.INTERNAL_ERROR, "Error: " + e.getMessage());
        }
    }

    private AnomalyResult execute(AlarmTable table, int windowSize, int forecastHorizon, String machineSerial) {
        // 1. Validate parameters and columns
        SequenceBuilder.validate(windowSize, forecastHorizon);
        List<AlarmRecord> records = AlarmRecordReader.read(table);
        if (records.size() < windowSize) {
            throw new DataInsufficiencyException("Insufficient data: need at least " + windowSize
                    + " rows, but have " + records.size());
        }

        // 2. Prune and build windows per machine
        PrunedLog pruned = AlarmPruner.prune(records);
        Map<String, MachineSequences> sequences = SequenceBuilder.buildAll(pruned, windowSize, forecastHorizon);
        List<String> serials = new ArrayList<>(sequences.keySet());
        if (sequences.values().stream().allMatch(MachineSequences::isEmpty)) {
            throw new DataInsufficiencyException("Insufficient data: no machine has at least " + windowSize
                    + " pruned alarms to build a sequence. Available: " + String.join(", ", serials));
        }

        // 3. Pick the machine
        String serial = selectMachine(sequences, machineSerial);
        MachineSequences machine = sequences.get(serial);
        if (machine.size() < config.getMinSequences()) {
            throw new DataInsufficiencyException("Insufficient data for machine " + serial + ": need at least "
                    + config.getMinSequences() + " sequences, have " + machine.size());
        }

        // 4. Chronological split
        SequenceSplit split = SequenceSplit.chronological(machine.getWindows(), config.getTrainFraction());
        double[][] train = SequenceSplit.toMatrix(split.getTrain());
        double[][] future = SequenceSplit.toMatrix(split.getFuture());
        log.info("Machine {}: {} training and {} future sequences", serial, train.length, future.length);

        // 5. Train and score
        AutoencoderModel model = AutoencoderModel.create(windowSize, config);
        model.fit(train, config.getEpochs());
        double[] trainErrors = model.reconstructionErrors(train);
        double[] futureErrors = model.reconstructionErrors(future);

        // 6. Threshold from the training errors
        double threshold = ThresholdCalculator.quantile(trainErrors, config.getThresholdQuantile());
        ModelArtifact artifact = new ModelArtifact(serial, model, threshold);
        boolean[] flags = artifact.flag(futureErrors);

        // 7. Figures, each one optional
        List<String> figures = new ArrayList<>();
        double silhouette = Double.NaN;
        if (config.isVisualizationEnabled()) {
            try {
                figures.add(charts.reconstructionErrors(futureErrors, threshold));
            } catch (RuntimeException e) {
                log.warn("Skipping reconstruction error figure: {}", e.getMessage());
            }
            try {
                silhouette = addClusterFigure(artifact, train, figures);
            } catch (RuntimeException e) {
                log.warn("Skipping latent cluster figure: {}", e.getMessage());
            }
        }

        return new AnomalyResult(serial, trainErrors, futureErrors, flags, threshold,
                split.isDegenerate(), silhouette, figures);
    }

    private String selectMachine(Map<String, MachineSequences> sequences, String requested) {
        List<String> serials = new ArrayList<>(sequences.keySet());
        if (requested == null || requested.isBlank()) {
            String first = serials.get(0);
            log.info("No machine serial specified, using: {}", first);
            return first;
        }
        String key = SerialKeys.canonical(requested);
        if (key == null || !sequences.containsKey(key)) {
            log.warn("Machine serial {} not found, available: {}", requested, serials);
            throw new MachineNotFoundException(requested.trim(), serials);
        }
        return key;
    }

    private double addClusterFigure(ModelArtifact artifact, double[][] train, List<String> figures) {
        double[][] latent = artifact.getModel().encode(train);
        LatentClusterer.Clustering clustering =
                new LatentClusterer(config.getClusterCount(), config.getSeed()).cluster(latent);
        double[][] projection =
                new TsneProjector(config.getTsnePerplexity(), config.getTsneIterations(), config.getSeed()).project(latent);
        figures.add(charts.latentClusters(projection, clustering.getLabels(), clustering.getClusterCount()));
        if (!Double.isNaN(clustering.getSilhouette())) {
            log.info("Silhouette score of the training latent space: {}", clustering.getSilhouette());
        }
        return clustering.getSilhouette();
    }
}
