package com.health.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.health.anomaly.config.AerospikeConfig;
import com.health.anomaly.engine.AnomalyModel;
import com.health.anomaly.engine.Normalizer;
import com.health.anomaly.engine.autoencoder.Autoencoder;
import com.health.anomaly.model.IndicatorModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class AerospikeModelRegistry implements ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(AerospikeModelRegistry.class);

    static final String ARCHITECTURE = Arrays.stream(Autoencoder.LAYER_WIDTHS)
            .mapToObj(String::valueOf)
            .collect(Collectors.joining("-"));

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    // In-memory cache of loaded models
    private final Map<String, IndicatorModel> modelCache = new ConcurrentHashMap<>();

    public AerospikeModelRegistry(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public boolean exists(String indicatorCode) {
        if (modelCache.containsKey(indicatorCode)) return true;
        return client.exists(readPolicy, key(indicatorCode));
    }

    @Override
    public void save(String indicatorCode, Normalizer normalizer, AnomalyModel model, int trainingSamples) {
        String normalizerJson;
        String modelJson;
        try {
            normalizerJson = objectMapper.writeValueAsString(normalizer);
            modelJson = objectMapper.writeValueAsString(model);
        } catch (JsonProcessingException e) {
            throw new ModelPersistenceException("Failed to serialize model for " + indicatorCode, e);
        }

        long trainedAt = System.currentTimeMillis();
        client.put(writePolicy, key(indicatorCode),
                new Bin("indicatorCode", indicatorCode),
                new Bin("normalizer", normalizerJson),
                new Bin("modelJson", modelJson),
                new Bin("architecture", ARCHITECTURE),
                new Bin("trainedAt", trainedAt),
                new Bin("trainSamples", trainingSamples));

        modelCache.put(indicatorCode,
                new IndicatorModel(indicatorCode, normalizer, model, trainedAt, trainingSamples));

        log.info("Saved model for {}: {} samples, {}", indicatorCode, trainingSamples, normalizer);
    }

    @Override
    public Optional<IndicatorModel> load(String indicatorCode) {
        IndicatorModel cached = modelCache.get(indicatorCode);
        if (cached != null) return Optional.of(cached);

        Record record = client.get(readPolicy, key(indicatorCode));
        if (record == null) return Optional.empty();

        String normalizerJson = record.getString("normalizer");
        String modelJson = record.getString("modelJson");
        if (normalizerJson == null || modelJson == null) {
            log.warn("Stored model for {} is missing its normalizer or network", indicatorCode);
            return Optional.empty();
        }

        try {
            IndicatorModel loaded = new IndicatorModel(indicatorCode,
                    objectMapper.readValue(normalizerJson, Normalizer.class),
                    objectMapper.readValue(modelJson, Autoencoder.class),
                    record.getLong("trainedAt"),
                    record.getInt("trainSamples"));
            modelCache.put(indicatorCode, loaded);
            return Optional.of(loaded);
        } catch (JsonProcessingException e) {
            log.error("Failed to load model for {}", indicatorCode, e);
            return Optional.empty();
        }
    }

    @Override
    public Optional<Map<String, Object>> getModelMetadata(String indicatorCode) {
        Record record = client.get(readPolicy, key(indicatorCode));
        if (record == null) return Optional.empty();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("indicatorCode", indicatorCode);
        metadata.put("architecture", record.getString("architecture"));
        metadata.put("trainingSamples", record.getInt("trainSamples"));
        metadata.put("trainedAt", record.getLong("trainedAt"));
        return Optional.of(metadata);
    }

    private Key key(String indicatorCode) {
        return new Key(namespace, AerospikeConfig.SET_INDICATOR_MODELS, indicatorCode);
    }
}
