package com.health.anomaly.service;

import com.health.anomaly.config.AnalysisProperties;
import com.health.anomaly.config.MetricsConfig;
import com.health.anomaly.engine.Normalizer;
import com.health.anomaly.engine.SeverityClassifier;
import com.health.anomaly.engine.TrendEstimator;
import com.health.anomaly.model.AnalysisResult;
import com.health.anomaly.model.ClinicalReport;
import com.health.anomaly.model.IndicatorModel;
import com.health.anomaly.model.IndicatorObservation;
import com.health.anomaly.model.IndicatorSeries;
import com.health.anomaly.model.Severity;
import com.health.anomaly.model.TrendResult;
import com.health.anomaly.model.ZScoreThresholds;
import com.health.anomaly.report.ReportGenerator;
import com.health.anomaly.repository.AnalysisResultRepository;
import com.health.anomaly.repository.IndicatorObservationRepository;
import com.health.anomaly.repository.ModelRegistry;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Scores the latest observation of every country series against its indicator's stored model
 * and appends one {@link AnalysisResult} per scored series.
 */
@Service
public class TrendAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(TrendAnalysisService.class);

    static final String REPORT_SUBJECT_TYPE = "Country";

    private final IndicatorObservationRepository observationRepository;
    private final AnalysisResultRepository resultRepository;
    private final ModelRegistry modelRegistry;
    private final ReportGenerator reportGenerator;
    private final AnalysisProperties properties;
    private final MetricsConfig metricsConfig;

    public TrendAnalysisService(IndicatorObservationRepository observationRepository,
                                AnalysisResultRepository resultRepository,
                                ModelRegistry modelRegistry,
                                ReportGenerator reportGenerator,
                                AnalysisProperties properties,
                                MetricsConfig metricsConfig) {
        this.observationRepository = observationRepository;
        this.resultRepository = resultRepository;
        this.modelRegistry = modelRegistry;
        this.reportGenerator = reportGenerator;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "analysis.analyze", contextualName = "analyze-indicator-series")
    public int analyzeAll() {
        return analyze(observationRepository.findAll());
    }

    /**
     * Score every indicator present in the observations.
     *
     * @return total number of results saved
     */
    @Observed(name = "analysis.analyze", contextualName = "analyze-indicator-series")
    public int analyze(List<IndicatorObservation> observations) {
        resultRepository.ensureIndexes();

        Map<String, List<IndicatorObservation>> byIndicator = new LinkedHashMap<>();
        for (IndicatorObservation observation : observations) {
            byIndicator.computeIfAbsent(observation.getIndicatorCode(), code -> new ArrayList<>()).add(observation);
        }
        log.info("Analyzing {} observations across {} indicators", observations.size(), byIndicator.size());

        List<Map.Entry<String, List<IndicatorObservation>>> units = new ArrayList<>(byIndicator.entrySet());
        List<Integer> savedPerIndicator = IndicatorWorkerPool.runAll(properties.getWorkerThreads(), units,
                unit -> analyzeIndicator(unit.getKey(), unit.getValue()));

        int totalSaved = savedPerIndicator.stream().mapToInt(Integer::intValue).sum();
        log.info("Analysis complete: {} results saved", totalSaved);
        return totalSaved;
    }

    /**
     * Score each country series of one indicator.
     *
     * @return number of results saved; 0 when the indicator has no stored model
     */
    public int analyzeIndicator(String indicatorCode, List<IndicatorObservation> observations) {
        Optional<IndicatorModel> stored = modelRegistry.load(indicatorCode);
        if (stored.isEmpty()) {
            log.debug("No model stored for {}. Skipping.", indicatorCode);
            metricsConfig.recordIndicatorSkipped("analysis", "no_model");
            return 0;
        }

        IndicatorModel model = stored.get();
        ZScoreThresholds thresholds = properties.thresholdsFor(indicatorCode);
        int minPoints = properties.getAnalysis().getMinPointsPerSeries();

        Map<String, List<IndicatorObservation>> byCountry = new TreeMap<>();
        for (IndicatorObservation observation : observations) {
            byCountry.computeIfAbsent(observation.getCountry(), country -> new ArrayList<>()).add(observation);
        }

        int saved = 0;
        for (Map.Entry<String, List<IndicatorObservation>> group : byCountry.entrySet()) {
            IndicatorSeries series = IndicatorSeries.of(indicatorCode, group.getKey(), group.getValue());
            if (series.size() < minPoints) {
                log.debug("Series {}/{} has {} points (< {}). Skipping.",
                        indicatorCode, group.getKey(), series.size(), minPoints);
                continue;
            }

            AnalysisResult result = score(series, model, thresholds);
            resultRepository.save(result);
            metricsConfig.recordAnalysisResult(result.getSeverity());
            saved++;
        }

        log.debug("Indicator {}: {} of {} country series scored", indicatorCode, saved, byCountry.size());
        return saved;
    }

    AnalysisResult score(IndicatorSeries series, IndicatorModel model, ZScoreThresholds thresholds) {
        double[] values = series.values();
        Normalizer normalizer = model.getNormalizer();

        double[] normalized = normalizer.transform(values);
        double[] reconstructed = model.getModel().predict(normalized);

        int last = values.length - 1;
        double standardizedLatest = normalized[last];
        double reconstructionError = Math.abs(normalized[last] - reconstructed[last]);

        // Severity follows the standardized value; the reconstruction error is recorded alongside it.
        Severity severity = SeverityClassifier.classify(Math.abs(standardizedLatest), thresholds);
        TrendResult trend = TrendEstimator.estimate(values, properties.getAnalysis().getTrendSlopeThreshold());

        String explanation = String.format(Locale.ROOT,
                "Latest z-score: %.2f. Trend: %s. Reconstruction error: %.4f.",
                standardizedLatest, trend.getTrend().label(), reconstructionError);

        ClinicalReport report = null;
        if (severity.isReportable()) {
            report = reportGenerator.generate(series.getCountry(), REPORT_SUBJECT_TYPE,
                    series.getIndicatorCode(), series.getIndicatorCode(),
                    severity, trend.getTrend(), explanation);
        }

        return AnalysisResult.builder()
                .timestamp(Instant.now())
                .subjectType(AnalysisResult.SUBJECT_TYPE_COUNTRY)
                .subjectId(series.getCountry())
                .indicatorCode(series.getIndicatorCode())
                .severity(severity)
                .trend(trend.getTrend())
                .slope(trend.getSlope())
                .latestValue(values[last])
                .standardizedLatest(standardizedLatest)
                .reconstructionError(reconstructionError)
                .explanation(explanation)
                .report(report)
                .build();
    }
}
