package com.health.anomaly.controller;

import com.health.anomaly.model.AnalysisResult;
import com.health.anomaly.repository.AnalysisResultRepository;
import com.health.anomaly.service.TrendAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/analysis")
@Tag(name = "Analysis", description = "Score indicator series and browse stored results")
public class AnalysisController {

    private final TrendAnalysisService analysisService;
    private final AnalysisResultRepository resultRepository;

    public AnalysisController(TrendAnalysisService analysisService, AnalysisResultRepository resultRepository) {
        this.analysisService = analysisService;
        this.resultRepository = resultRepository;
    }

    @Operation(summary = "Run analysis",
            description = "Scores the latest observation of every country series that has a trained indicator model " +
                    "and enough points, and appends one result per scored series.")
    @PostMapping("/run")
    public ResponseEntity<Map<String, Integer>> run() {
        int saved = analysisService.analyzeAll();
        return ResponseEntity.ok(Map.of("saved", saved));
    }

    @Operation(summary = "Results for a country", description = "Newest first.")
    @GetMapping("/results/subject/{subjectId}")
    public ResponseEntity<List<AnalysisResult>> getBySubject(
            @Parameter(description = "Country code", example = "KEN")
            @PathVariable String subjectId,
            @Parameter(description = "Maximum number of results", example = "50")
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(resultRepository.findBySubjectId(subjectId, limit));
    }

    @Operation(summary = "Results for an indicator", description = "Newest first.")
    @GetMapping("/results/indicator/{indicatorCode}")
    public ResponseEntity<List<AnalysisResult>> getByIndicator(
            @Parameter(description = "Indicator code", example = "WHOSIS_000001")
            @PathVariable String indicatorCode,
            @Parameter(description = "Maximum number of results", example = "50")
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(resultRepository.findByIndicatorCode(indicatorCode, limit));
    }
}
