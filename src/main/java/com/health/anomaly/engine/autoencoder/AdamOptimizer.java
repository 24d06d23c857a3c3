package com.health.anomaly.engine.autoencoder;

import java.util.List;

/**
 * Adam with bias-corrected step size. Holds first and second moment estimates
 * for every weight and bias of the layers it was created for.
 */
class AdamOptimizer {

    static final double BETA_1 = 0.9;
    static final double BETA_2 = 0.999;
    static final double EPSILON = 1e-7;

    private final double learningRate;
    private final double[][][] weightMoment;
    private final double[][][] weightVelocity;
    private final double[][] biasMoment;
    private final double[][] biasVelocity;
    private int step;

    AdamOptimizer(List<DenseLayer> layers, double learningRate) {
        this.learningRate = learningRate;
        int count = layers.size();
        this.weightMoment = new double[count][][];
        this.weightVelocity = new double[count][][];
        this.biasMoment = new double[count][];
        this.biasVelocity = new double[count][];
        for (int l = 0; l < count; l++) {
            DenseLayer layer = layers.get(l);
            weightMoment[l] = new double[layer.outputSize()][layer.inputSize()];
            weightVelocity[l] = new double[layer.outputSize()][layer.inputSize()];
            biasMoment[l] = new double[layer.outputSize()];
            biasVelocity[l] = new double[layer.outputSize()];
        }
    }

    void apply(List<DenseLayer> layers, double[][][] weightGradients, double[][] biasGradients) {
        step++;
        double stepSize = learningRate * Math.sqrt(1.0 - Math.pow(BETA_2, step)) / (1.0 - Math.pow(BETA_1, step));

        for (int l = 0; l < layers.size(); l++) {
            double[][] weights = layers.get(l).getWeights();
            double[] biases = layers.get(l).getBiases();
            for (int o = 0; o < weights.length; o++) {
                for (int i = 0; i < weights[o].length; i++) {
                    weights[o][i] -= update(weightMoment[l][o], weightVelocity[l][o], i, weightGradients[l][o][i], stepSize);
                }
                biases[o] -= update(biasMoment[l], biasVelocity[l], o, biasGradients[l][o], stepSize);
            }
        }
    }

    private static double update(double[] moment, double[] velocity, int index, double gradient, double stepSize) {
        moment[index] = BETA_1 * moment[index] + (1.0 - BETA_1) * gradient;
        velocity[index] = BETA_2 * velocity[index] + (1.0 - BETA_2) * gradient * gradient;
        return stepSize * moment[index] / (Math.sqrt(velocity[index]) + EPSILON);
    }

    int getStep() { return step; }
}
