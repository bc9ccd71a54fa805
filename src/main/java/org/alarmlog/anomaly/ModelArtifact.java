package org.alarmlog.anomaly;

/**
 * A trained autoencoder with the threshold derived from its training errors, for
 * one machine. Lives for a single detection run.
 */
public final class ModelArtifact {

    private final String machineSerial;
    private final AutoencoderModel model;
    private final double threshold;

    public ModelArtifact(String machineSerial, AutoencoderModel model, double threshold) {
        this.machineSerial = machineSerial;
        this.model = model;
        this.threshold = threshold;
    }

    public String getMachineSerial() {
        return machineSerial;
    }

    public AutoencoderModel getModel() {
        return model;
    }

    public double getThreshold() {
        return threshold;
    }

    public boolean[] flag(double[] errors) {
        boolean[] flags = new boolean[errors.length];
        for (int i = 0; i < errors.length; i++) {
            flags[i] = errors[i] > threshold;
        }
        return flags;
    }
}
