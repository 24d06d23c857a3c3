package com.health.anomaly.service;

import com.health.anomaly.model.IndicatorObservation;
import com.health.anomaly.repository.IndicatorObservationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * The train and analyze batch commands. Each returns the line it reports to the operator.
 */
@Service
public class PipelineCommands {

    private static final Logger log = LoggerFactory.getLogger(PipelineCommands.class);

    public static final String NO_DATA_MESSAGE = "No health indicator data found. Load source data first.";

    private final IndicatorObservationRepository observationRepository;
    private final ModelTrainingService trainingService;
    private final TrendAnalysisService analysisService;

    public PipelineCommands(IndicatorObservationRepository observationRepository,
                            ModelTrainingService trainingService,
                            TrendAnalysisService analysisService) {
        this.observationRepository = observationRepository;
        this.trainingService = trainingService;
        this.analysisService = analysisService;
    }

    public String train() {
        List<IndicatorObservation> observations = observationRepository.findAll();
        if (observations.isEmpty()) {
            log.warn("Training requested but no observations are stored");
            return NO_DATA_MESSAGE;
        }
        List<String> trained = trainingService.trainAll(observations);
        return "Trained models for indicators: " + trained;
    }

    public String analyze() {
        List<IndicatorObservation> observations = observationRepository.findAll();
        if (observations.isEmpty()) {
            log.warn("Analysis requested but no observations are stored");
            return NO_DATA_MESSAGE;
        }
        int saved = analysisService.analyze(observations);
        return "Analysis complete. Records saved: " + saved;
    }
}
