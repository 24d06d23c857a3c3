package com.health.anomaly.config;

import com.health.anomaly.model.TrainingParameters;
import com.health.anomaly.model.ZScoreThresholds;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnalysisProperties {

    public static final String DEFAULT_THRESHOLDS_KEY = "default";

    // Severity cut-offs keyed by indicator code; "default" applies to every other indicator.
    private Map<String, IndicatorThresholds> thresholds = new LinkedHashMap<>(
            Map.of(DEFAULT_THRESHOLDS_KEY, new IndicatorThresholds(new ZScoreThresholds(3.0, 2.0, 1.0))));

    private Analysis analysis = new Analysis();

    private Model model = new Model();

    // Indicators processed concurrently during training and analysis. 1 keeps runs sequential.
    private int workerThreads = 1;

    /**
     * Per-indicator thresholds when configured, otherwise the default triple.
     */
    public ZScoreThresholds thresholdsFor(String indicatorCode) {
        IndicatorThresholds specific = thresholds.get(indicatorCode);
        if (specific != null && specific.getZscore() != null) {
            return specific.getZscore();
        }
        return thresholds.get(DEFAULT_THRESHOLDS_KEY).getZscore();
    }

    public TrainingParameters trainingParameters() {
        return new TrainingParameters(model.getEpochs(), model.getBatchSize(),
                model.getLearningRate(), model.getSeed());
    }

    @PostConstruct
    public void validate() {
        IndicatorThresholds fallback = thresholds.get(DEFAULT_THRESHOLDS_KEY);
        if (fallback == null || fallback.getZscore() == null) {
            throw new IllegalStateException("anomaly.thresholds.default.zscore must be configured");
        }
        thresholds.forEach((code, configured) -> {
            if (configured.getZscore() != null && !configured.getZscore().isOrdered()) {
                throw new IllegalStateException("anomaly.thresholds." + code
                        + ".zscore must satisfy high >= medium >= low, got " + configured.getZscore());
            }
        });
        if (analysis.getTrendSlopeThreshold() < 0) {
            throw new IllegalStateException("anomaly.analysis.trend-slope-threshold must not be negative");
        }
        if (analysis.getMinPointsPerSeries() < 1) {
            throw new IllegalStateException("anomaly.analysis.min-points-per-series must be positive");
        }
        if (model.getEpochs() < 1 || model.getBatchSize() < 1) {
            throw new IllegalStateException("anomaly.model.epochs and anomaly.model.batch-size must be positive");
        }
        if (!(model.getLearningRate() > 0)) {
            throw new IllegalStateException("anomaly.model.learning-rate must be positive");
        }
        if (workerThreads < 1) {
            throw new IllegalStateException("anomaly.worker-threads must be positive");
        }
    }

    @Data
    public static class IndicatorThresholds {
        private ZScoreThresholds zscore;

        public IndicatorThresholds() {
        }

        public IndicatorThresholds(ZScoreThresholds zscore) {
            this.zscore = zscore;
        }
    }

    @Data
    public static class Analysis {
        // Slopes within +/- this value count as stable.
        private double trendSlopeThreshold = 0.05;
        // Country series shorter than this are not scored.
        private int minPointsPerSeries = 5;
    }

    @Data
    public static class Model {
        private int epochs = 50;
        private int batchSize = 16;
        private double learningRate = 0.001;
        private long seed = 42L;
    }
}
