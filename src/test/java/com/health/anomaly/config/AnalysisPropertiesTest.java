package com.health.anomaly.config;

import com.health.anomaly.model.TrainingParameters;
import com.health.anomaly.model.ZScoreThresholds;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisPropertiesTest {

    @Test
    void defaults_areValid() {
        AnalysisProperties properties = new AnalysisProperties();

        assertThatCode(properties::validate).doesNotThrowAnyException();
        assertThat(properties.thresholdsFor("ANY")).isEqualTo(new ZScoreThresholds(3.0, 2.0, 1.0));
    }

    @Test
    void thresholdsFor_prefersIndicatorSpecificTriple() {
        AnalysisProperties properties = new AnalysisProperties();
        ZScoreThresholds specific = new ZScoreThresholds(4.0, 2.5, 1.5);
        properties.getThresholds().put("MORT_001", new AnalysisProperties.IndicatorThresholds(specific));

        assertThat(properties.thresholdsFor("MORT_001")).isEqualTo(specific);
        assertThat(properties.thresholdsFor("OTHER")).isEqualTo(new ZScoreThresholds(3.0, 2.0, 1.0));
    }

    @Test
    void thresholdsFor_entryWithoutZscore_fallsBackToDefault() {
        AnalysisProperties properties = new AnalysisProperties();
        properties.getThresholds().put("EMPTY", new AnalysisProperties.IndicatorThresholds());

        assertThat(properties.thresholdsFor("EMPTY")).isEqualTo(new ZScoreThresholds(3.0, 2.0, 1.0));
    }

    @Test
    void validate_missingDefault_fails() {
        AnalysisProperties properties = new AnalysisProperties();
        properties.getThresholds().remove(AnalysisProperties.DEFAULT_THRESHOLDS_KEY);

        assertThatThrownBy(properties::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("default");
    }

    @Test
    void validate_unorderedTriple_fails() {
        AnalysisProperties properties = new AnalysisProperties();
        properties.getThresholds().put("BAD",
                new AnalysisProperties.IndicatorThresholds(new ZScoreThresholds(1.0, 2.0, 3.0)));

        assertThatThrownBy(properties::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("BAD");
    }

    @Test
    void validate_nonPositiveHyperparameters_fail() {
        AnalysisProperties epochs = new AnalysisProperties();
        epochs.getModel().setEpochs(0);
        assertThatThrownBy(epochs::validate).isInstanceOf(IllegalStateException.class);

        AnalysisProperties rate = new AnalysisProperties();
        rate.getModel().setLearningRate(0.0);
        assertThatThrownBy(rate::validate).isInstanceOf(IllegalStateException.class);

        AnalysisProperties points = new AnalysisProperties();
        points.getAnalysis().setMinPointsPerSeries(0);
        assertThatThrownBy(points::validate).isInstanceOf(IllegalStateException.class);

        AnalysisProperties workers = new AnalysisProperties();
        workers.setWorkerThreads(0);
        assertThatThrownBy(workers::validate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void trainingParameters_copiesModelSection() {
        AnalysisProperties properties = new AnalysisProperties();
        properties.getModel().setEpochs(20);
        properties.getModel().setBatchSize(4);
        properties.getModel().setLearningRate(0.01);
        properties.getModel().setSeed(9L);

        assertThat(properties.trainingParameters()).isEqualTo(new TrainingParameters(20, 4, 0.01, 9L));
    }
}
