package com.health.anomaly.engine.autoencoder;

import java.util.Random;

/**
 * Fully connected layer. {@code weights[o][i]} connects input i to output o.
 */
public class DenseLayer {

    private double[][] weights;
    private double[] biases;
    private Activation activation;

    public DenseLayer() {
    }

    DenseLayer(double[][] weights, double[] biases, Activation activation) {
        this.weights = weights;
        this.biases = biases;
        this.activation = activation;
    }

    /**
     * Glorot-uniform weights, zero biases.
     */
    static DenseLayer initialize(int inputs, int outputs, Activation activation, Random random) {
        double limit = Math.sqrt(6.0 / (inputs + outputs));
        double[][] weights = new double[outputs][inputs];
        for (int o = 0; o < outputs; o++) {
            for (int i = 0; i < inputs; i++) {
                weights[o][i] = (random.nextDouble() * 2.0 - 1.0) * limit;
            }
        }
        return new DenseLayer(weights, new double[outputs], activation);
    }

    double[] preActivation(double[] input) {
        double[] z = new double[weights.length];
        for (int o = 0; o < weights.length; o++) {
            double sum = biases[o];
            for (int i = 0; i < input.length; i++) {
                sum += weights[o][i] * input[i];
            }
            z[o] = sum;
        }
        return z;
    }

    double[] activate(double[] z) {
        double[] a = new double[z.length];
        for (int o = 0; o < z.length; o++) {
            a[o] = activation.apply(z[o]);
        }
        return a;
    }

    double[] forward(double[] input) {
        return activate(preActivation(input));
    }

    int inputSize() { return weights.length == 0 ? 0 : weights[0].length; }
    int outputSize() { return weights.length; }

    // Getters/setters for serialization
    public double[][] getWeights() { return weights; }
    public void setWeights(double[][] weights) { this.weights = weights; }
    public double[] getBiases() { return biases; }
    public void setBiases(double[] biases) { this.biases = biases; }
    public Activation getActivation() { return activation; }
    public void setActivation(Activation activation) { this.activation = activation; }
}
