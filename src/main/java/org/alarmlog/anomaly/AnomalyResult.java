package org.alarmlog.anomaly;

import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Scores of one machine's future windows against its training windows.
 */
public final class AnomalyResult {

    private final String machineSerial;
    private final double[] trainErrors;
    private final double[] futureErrors;
    private final boolean[] anomalies;
    private final double threshold;
    private final int anomalyCount;
    private final boolean degenerateSplit;
    private final double silhouette;
    private final List<String> figures;

    AnomalyResult(String machineSerial, double[] trainErrors, double[] futureErrors, boolean[] anomalies,
                  double threshold, boolean degenerateSplit, double silhouette, List<String> figures) {
        this.machineSerial = machineSerial;
        this.trainErrors = trainErrors;
        this.futureErrors = futureErrors;
        this.anomalies = anomalies;
        this.threshold = threshold;
        this.degenerateSplit = degenerateSplit;
        this.silhouette = silhouette;
        this.figures = List.copyOf(figures);
        this.anomalyCount = ThresholdCalculator.countAbove(futureErrors, threshold);
    }

    public String getMachineSerial() {
        return machineSerial;
    }

    public double[] getTrainErrors() {
        return trainErrors.clone();
    }

    public double[] getFutureErrors() {
        return futureErrors.clone();
    }

    public boolean[] getAnomalies() {
        return anomalies.clone();
    }

    public double getThreshold() {
        return threshold;
    }

    public int getAnomalyCount() {
        return anomalyCount;
    }

    public int getTrainSize() {
        return trainErrors.length;
    }

    public int getFutureSize() {
        return futureErrors.length;
    }

    public boolean isDegenerateSplit() {
        return degenerateSplit;
    }

    /**
     * Silhouette of the latent clustering, empty when no clustering was done.
     */
    public OptionalDouble getSilhouette() {
        return Double.isNaN(silhouette) ? OptionalDouble.empty() : OptionalDouble.of(silhouette);
    }

    public List<String> getFigures() {
        return figures;
    }

    public String summary() {
        return String.format(Locale.ROOT, "Machine %s: %d/%d anomalies (threshold=%.4f)",
                machineSerial, anomalyCount, futureErrors.length, threshold);
    }
}
