package com.health.anomaly.engine.autoencoder;

import com.health.anomaly.engine.AnomalyModel;
import com.health.anomaly.model.TrainingParameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Dense autoencoder for scalar inputs with a 1-4-2-4-1 layout.
 * Hidden layers use ReLU, the output layer is linear, and training minimises
 * mean squared reconstruction error with Adam over shuffled mini-batches.
 */
public class Autoencoder implements AnomalyModel {

    public static final int[] LAYER_WIDTHS = {1, 4, 2, 4, 1};

    private List<DenseLayer> layers;
    private int epochs;
    private int batchSize;
    private double learningRate;
    private long seed;

    public Autoencoder() {
        this.layers = new ArrayList<>();
    }

    /**
     * Build an untrained network with seeded Glorot-uniform weights.
     *
     * @throws IllegalArgumentException if epochs or batch size is below 1, or the learning rate is not positive
     */
    public Autoencoder(TrainingParameters parameters) {
        requireTrainable(parameters.getEpochs(), parameters.getBatchSize(), parameters.getLearningRate());
        this.epochs = parameters.getEpochs();
        this.batchSize = parameters.getBatchSize();
        this.learningRate = parameters.getLearningRate();
        this.seed = parameters.getSeed();
        this.layers = initializeLayers(new Random(seed));
    }

    private static List<DenseLayer> initializeLayers(Random random) {
        List<DenseLayer> layers = new ArrayList<>(LAYER_WIDTHS.length - 1);
        for (int l = 1; l < LAYER_WIDTHS.length; l++) {
            Activation activation = l == LAYER_WIDTHS.length - 1 ? Activation.IDENTITY : Activation.RELU;
            layers.add(DenseLayer.initialize(LAYER_WIDTHS[l - 1], LAYER_WIDTHS[l], activation, random));
        }
        return layers;
    }

    /**
     * Train on the given standardized values. Each value is both input and target.
     */
    @Override
    public Autoencoder fit(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot fit an autoencoder on an empty series");
        }
        requireLayers();
        requireTrainable(epochs, batchSize, learningRate);

        AdamOptimizer optimizer = new AdamOptimizer(layers, learningRate);
        Random random = new Random(seed);
        int[] order = new int[values.length];
        for (int i = 0; i < order.length; i++) order[i] = i;

        for (int epoch = 0; epoch < epochs; epoch++) {
            shuffle(order, random);
            for (int start = 0; start < order.length; start += batchSize) {
                int end = Math.min(start + batchSize, order.length);
                trainBatch(values, order, start, end, optimizer);
            }
        }
        return this;
    }

    @Override
    public double[] predict(double[] values) {
        requireLayers();
        double[] reconstructed = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            reconstructed[i] = reconstruct(values[i]);
        }
        return reconstructed;
    }

    /**
     * Mean squared error between the values and their reconstruction.
     */
    public double reconstructionLoss(double[] values) {
        if (values.length == 0) return 0.0;
        double[] reconstructed = predict(values);
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            double d = reconstructed[i] - values[i];
            sum += d * d;
        }
        return sum / values.length;
    }

    private double reconstruct(double value) {
        double[] activation = {value};
        for (DenseLayer layer : layers) {
            activation = layer.forward(activation);
        }
        return activation[0];
    }

    private void trainBatch(double[] values, int[] order, int start, int end, AdamOptimizer optimizer) {
        int depth = layers.size();
        double[][][] weightGradients = new double[depth][][];
        double[][] biasGradients = new double[depth][];
        for (int l = 0; l < depth; l++) {
            DenseLayer layer = layers.get(l);
            weightGradients[l] = new double[layer.outputSize()][layer.inputSize()];
            biasGradients[l] = new double[layer.outputSize()];
        }

        int batch = end - start;
        for (int b = start; b < end; b++) {
            double target = values[order[b]];

            // activations[0] is the input; preActivations[l] belongs to layer l
            double[][] activations = new double[depth + 1][];
            double[][] preActivations = new double[depth][];
            activations[0] = new double[]{target};
            for (int l = 0; l < depth; l++) {
                preActivations[l] = layers.get(l).preActivation(activations[l]);
                activations[l + 1] = layers.get(l).activate(preActivations[l]);
            }

            double[] delta = new double[]{2.0 * (activations[depth][0] - target) / batch};
            for (int l = depth - 1; l >= 0; l--) {
                DenseLayer layer = layers.get(l);
                double[] z = preActivations[l];
                for (int o = 0; o < delta.length; o++) {
                    delta[o] *= layer.getActivation().derivative(z[o]);
                }

                double[][] weights = layer.getWeights();
                double[] input = activations[l];
                for (int o = 0; o < delta.length; o++) {
                    for (int i = 0; i < input.length; i++) {
                        weightGradients[l][o][i] += delta[o] * input[i];
                    }
                    biasGradients[l][o] += delta[o];
                }

                if (l > 0) {
                    double[] previous = new double[input.length];
                    for (int i = 0; i < input.length; i++) {
                        double sum = 0.0;
                        for (int o = 0; o < delta.length; o++) {
                            sum += weights[o][i] * delta[o];
                        }
                        previous[i] = sum;
                    }
                    delta = previous;
                }
            }
        }

        optimizer.apply(layers, weightGradients, biasGradients);
    }

    private static void shuffle(int[] order, Random random) {
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }

    private static void requireTrainable(int epochs, int batchSize, double learningRate) {
        if (epochs < 1) {
            throw new IllegalArgumentException("epochs must be at least 1, was " + epochs);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batch size must be at least 1, was " + batchSize);
        }
        if (!(learningRate > 0)) {
            throw new IllegalArgumentException("learning rate must be positive, was " + learningRate);
        }
    }

    private void requireLayers() {
        if (layers == null || layers.size() != LAYER_WIDTHS.length - 1) {
            throw new IllegalStateException("Autoencoder has no " + (LAYER_WIDTHS.length - 1) + "-layer network");
        }
    }

    // Getters/setters for serialization
    public List<DenseLayer> getLayers() { return layers; }
    public void setLayers(List<DenseLayer> layers) { this.layers = layers; }
    public int getEpochs() { return epochs; }
    public void setEpochs(int epochs) { this.epochs = epochs; }
    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    public double getLearningRate() { return learningRate; }
    public void setLearningRate(double learningRate) { this.learningRate = learningRate; }
    public long getSeed() { return seed; }
    public void setSeed(long seed) { this.seed = seed; }
}
