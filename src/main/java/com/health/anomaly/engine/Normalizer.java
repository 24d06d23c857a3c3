package com.health.anomaly.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Z-score scaler fitted on an indicator's pooled training values.
 */
public final class Normalizer {

    private final double mean;
    private final double std;

    @JsonCreator
    public Normalizer(@JsonProperty("mean") double mean, @JsonProperty("std") double std) {
        this.mean = mean;
        // std of 0 would make every transform divide by zero
        this.std = std > 0 ? std : 1.0;
    }

    /**
     * Fit mean and population standard deviation of the given values.
     */
    public static Normalizer fit(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot fit a normalizer on an empty series");
        }
        double sum = 0.0;
        for (double v : values) sum += v;
        double mean = sum / values.length;

        double squares = 0.0;
        for (double v : values) {
            double d = v - mean;
            squares += d * d;
        }
        double std = Math.sqrt(squares / values.length);
        return new Normalizer(mean, std);
    }

    public double transform(double value) {
        return (value - mean) / std;
    }

    public double[] transform(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = transform(values[i]);
        }
        return out;
    }

    public double getMean() { return mean; }
    public double getStd() { return std; }

    @Override
    public String toString() {
        return "Normalizer{mean=" + mean + ", std=" + std + "}";
    }
}
