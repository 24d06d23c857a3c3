package com.health.anomaly.engine.autoencoder;

public enum Activation {
    RELU {
        @Override
        double apply(double z) { return z > 0 ? z : 0.0; }

        @Override
        double derivative(double z) { return z > 0 ? 1.0 : 0.0; }
    },
    IDENTITY {
        @Override
        double apply(double z) { return z; }

        @Override
        double derivative(double z) { return 1.0; }
    };

    abstract double apply(double z);

    abstract double derivative(double z);
}
