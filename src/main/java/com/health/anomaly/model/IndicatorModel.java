package com.health.anomaly.model;

import com.health.anomaly.engine.AnomalyModel;
import com.health.anomaly.engine.Normalizer;
import lombok.Value;

/**
 * The fitted scaler and reconstruction model stored for one indicator.
 */
@Value
public class IndicatorModel {

    String indicatorCode;
    Normalizer normalizer;
    AnomalyModel model;
    long trainedAt;
    int trainingSamples;
}
