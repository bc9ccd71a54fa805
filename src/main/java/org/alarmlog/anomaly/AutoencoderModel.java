package org.alarmlog.anomaly;

import org.alarmlog.config.EngineConfig;
import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;
import org.nd4j.linalg.ops.transforms.Transforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dense autoencoder over alarm windows: encoder {@code W -> latent} with ReLU,
 * decoder {@code latent -> W} followed by a linear {@code W -> W} output layer.
 */
public class AutoencoderModel {

    private static final Logger log = LoggerFactory.getLogger(AutoencoderModel.class);

    private final MultiLayerNetwork network;
    private final int windowSize;
    private final int latentSize;

    private AutoencoderModel(MultiLayerNetwork network, int windowSize, int latentSize) {
        this.network = network;
        this.windowSize = windowSize;
        this.latentSize = latentSize;
    }

    public static int latentSizeFor(int windowSize) {
        return Math.max(1, windowSize / 2);
    }

    public static AutoencoderModel create(int windowSize, EngineConfig config) {
        int latentSize = latentSizeFor(windowSize);
        MultiLayerConfiguration conf = new NeuralNetConfiguration.Builder()
                .seed(config.getSeed())
                .dataType(DataType.DOUBLE)
                .weightInit(WeightInit.XAVIER)
                .updater(new Adam(config.getLearningRate()))
                .list()
                .layer(new DenseLayer.Builder()
                        .nIn(windowSize)
                        .nOut(latentSize)
                        .activation(Activation.RELU)
                        .build())
                .layer(new DenseLayer.Builder()
                        .nIn(latentSize)
                        .nOut(windowSize)
                        .activation(Activation.IDENTITY)
                        .build())
                .layer(new OutputLayer.Builder(LossFunctions.LossFunction.MSE)
                        .nIn(windowSize)
                        .nOut(windowSize)
                        .activation(Activation.IDENTITY)
                        .build())
                .build();

        MultiLayerNetwork network = new MultiLayerNetwork(conf);
        network.init();
        return new AutoencoderModel(network, windowSize, latentSize);
    }

    /**
     * Full-batch training on the given windows; the windows are their own labels.
     */
    public void fit(double[][] train, int epochs) {
        INDArray features = toArray(train);
        DataSet dataSet = new DataSet(features, features);
        for (int epoch = 0; epoch < epochs; epoch++) {
            network.fit(dataSet);
            if ((epoch + 1) % 10 == 0 || epoch == epochs - 1) {
                log.debug("Epoch {} of {} complete, loss={}", epoch + 1, epochs, network.score());
            }
        }
        log.info("Trained autoencoder {}->{}->{} on {} windows for {} epochs, final loss={}",
                windowSize, latentSize, windowSize, train.length, epochs, network.score());
    }

    /**
     * Mean absolute reconstruction error of each window.
     */
    public double[] reconstructionErrors(double[][] windows) {
        INDArray input = toArray(windows);
        INDArray output = network.output(input, false);
        INDArray errors = Transforms.abs(input.sub(output), false).mean(1);
        return errors.toDoubleVector();
    }

    /**
     * Encoder activations, one latent vector per window.
     */
    public double[][] encode(double[][] windows) {
        INDArray latent = network.feedForwardToLayer(0, toArray(windows), false).get(1);
        return latent.toDoubleMatrix();
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getLatentSize() {
        return latentSize;
    }

    private INDArray toArray(double[][] windows) {
        for (double[] w : windows) {
            if (w.length != windowSize) {
                throw new IllegalArgumentException("Expected windows of length " + windowSize + ", got " + w.length);
            }
        }
        return Nd4j.create(windows);
    }
}
