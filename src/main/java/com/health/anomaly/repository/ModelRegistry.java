package com.health.anomaly.repository;

import com.health.anomaly.engine.AnomalyModel;
import com.health.anomaly.engine.Normalizer;
import com.health.anomaly.model.IndicatorModel;

import java.util.Map;
import java.util.Optional;

/**
 * Stores one fitted (normalizer, model) pair per indicator code.
 */
public interface ModelRegistry {

    boolean exists(String indicatorCode);

    /**
     * @return the stored pair, or empty when the indicator has not been trained
     */
    Optional<IndicatorModel> load(String indicatorCode);

    void save(String indicatorCode, Normalizer normalizer, AnomalyModel model, int trainingSamples);

    Optional<Map<String, Object>> getModelMetadata(String indicatorCode);
}
