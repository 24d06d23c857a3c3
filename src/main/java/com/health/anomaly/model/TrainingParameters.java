package com.health.anomaly.model;

import lombok.Value;

@Value
public class TrainingParameters {

    int epochs;
    int batchSize;
    double learningRate;
    long seed;
}
