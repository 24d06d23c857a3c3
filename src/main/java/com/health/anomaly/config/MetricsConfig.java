package com.health.anomaly.config;

import com.health.anomaly.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordModelTrained(String indicatorCode, double reconstructionLoss) {
        Counter.builder("training.models.count")
                .register(registry)
                .increment();

        DistributionSummary.builder("training.reconstruction_loss")
                .tag("indicator", indicatorCode)
                .register(registry)
                .record(reconstructionLoss);
    }

    public void recordIndicatorSkipped(String phase, String reason) {
        Counter.builder("indicator.skipped.count")
                .tag("phase", phase)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAnalysisResult(Severity severity) {
        Counter.builder("analysis.results.count")
                .tag("severity", severity.label())
                .register(registry)
                .increment();
    }
}
