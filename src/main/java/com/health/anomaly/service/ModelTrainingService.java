package com.health.anomaly.service;

import com.health.anomaly.config.AnalysisProperties;
import com.health.anomaly.config.MetricsConfig;
import com.health.anomaly.engine.Normalizer;
import com.health.anomaly.engine.autoencoder.Autoencoder;
import com.health.anomaly.model.IndicatorObservation;
import com.health.anomaly.model.TrainingParameters;
import com.health.anomaly.repository.IndicatorObservationRepository;
import com.health.anomaly.repository.ModelRegistry;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Service
public class ModelTrainingService {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainingService.class);

    // Indicators with fewer pooled values than this are not trained.
    public static final int MIN_TRAINING_POINTS = 10;

    private final IndicatorObservationRepository observationRepository;
    private final ModelRegistry modelRegistry;
    private final AnalysisProperties properties;
    private final MetricsConfig metricsConfig;

    public ModelTrainingService(IndicatorObservationRepository observationRepository,
                                ModelRegistry modelRegistry,
                                AnalysisProperties properties,
                                MetricsConfig metricsConfig) {
        this.observationRepository = observationRepository;
        this.modelRegistry = modelRegistry;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Train every indicator found in the stored observations with the configured hyperparameters.
     */
    @Observed(name = "training.train", contextualName = "train-indicator-models")
    public List<String> trainAll() {
        return trainAll(observationRepository.findAll());
    }

    @Observed(name = "training.train", contextualName = "train-indicator-models")
    public List<String> trainAll(List<IndicatorObservation> observations) {
        return train(poolByIndicator(observations), properties.trainingParameters());
    }

    /**
     * Fit and store a normalizer and autoencoder for each indicator with enough pooled values.
     *
     * @param pooledValues raw values per indicator code, pooled across all countries
     * @return codes of the indicators that were trained, sorted
     */
    public List<String> train(Map<String, double[]> pooledValues, TrainingParameters parameters) {
        log.info("=== Starting model training for {} indicators ===", pooledValues.size());

        List<Map.Entry<String, double[]>> units = new ArrayList<>(new TreeMap<>(pooledValues).entrySet());
        List<Optional<String>> outcomes = IndicatorWorkerPool.runAll(properties.getWorkerThreads(), units,
                unit -> trainIndicator(unit.getKey(), unit.getValue(), parameters));

        List<String> trained = new ArrayList<>();
        outcomes.forEach(outcome -> outcome.ifPresent(trained::add));

        log.info("=== Model training complete: {} of {} indicators trained ===", trained.size(), pooledValues.size());
        return trained;
    }

    /**
     * @return the indicator code when a model was stored, empty when the indicator has too little data
     */
    public Optional<String> trainIndicator(String indicatorCode, double[] rawValues, TrainingParameters parameters) {
        if (rawValues.length < MIN_TRAINING_POINTS) {
            log.debug("Indicator {} has {} pooled values (< {}). Skipping training.",
                    indicatorCode, rawValues.length, MIN_TRAINING_POINTS);
            metricsConfig.recordIndicatorSkipped("training", "insufficient_history");
            return Optional.empty();
        }

        Normalizer normalizer = Normalizer.fit(rawValues);
        double[] normalized = normalizer.transform(rawValues);

        Autoencoder model = new Autoencoder(parameters).fit(normalized);
        double loss = model.reconstructionLoss(normalized);

        if (modelRegistry.exists(indicatorCode)) {
            log.info("Replacing stored model for {}", indicatorCode);
        }
        modelRegistry.save(indicatorCode, normalizer, model, rawValues.length);
        metricsConfig.recordModelTrained(indicatorCode, loss);

        log.info("Trained model for {}: {} samples, {} epochs, reconstruction MSE {}",
                indicatorCode, rawValues.length, parameters.getEpochs(), String.format("%.6f", loss));
        return Optional.of(indicatorCode);
    }

    static Map<String, double[]> poolByIndicator(List<IndicatorObservation> observations) {
        Map<String, List<Double>> pooled = new TreeMap<>();
        for (IndicatorObservation observation : observations) {
            pooled.computeIfAbsent(observation.getIndicatorCode(), code -> new ArrayList<>())
                    .add(observation.getValue());
        }

        Map<String, double[]> result = new TreeMap<>();
        pooled.forEach((code, values) ->
                result.put(code, values.stream().mapToDouble(Double::doubleValue).toArray()));
        return result;
    }
}
