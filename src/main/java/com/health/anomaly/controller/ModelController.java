package com.health.anomaly.controller;

import com.health.anomaly.repository.ModelRegistry;
import com.health.anomaly.service.ModelTrainingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Per-indicator autoencoder training and metadata")
public class ModelController {

    private final ModelTrainingService trainingService;
    private final ModelRegistry modelRegistry;

    public ModelController(ModelTrainingService trainingService, ModelRegistry modelRegistry) {
        this.trainingService = trainingService;
        this.modelRegistry = modelRegistry;
    }

    @Operation(summary = "Train models for all indicators",
            description = "Pools every stored value of each indicator across countries, fits a normalizer and a " +
                    "1-4-2-4-1 autoencoder, and stores both. Indicators with fewer than 10 values are skipped.")
    @PostMapping("/train")
    public ResponseEntity<Map<String, Object>> trainAll() {
        List<String> trained = trainingService.trainAll();
        return ResponseEntity.ok(Map.of(
                "trained", trained,
                "count", trained.size()));
    }

    @Operation(summary = "Get model metadata",
            description = "Returns the architecture, training sample count and training timestamp of an indicator's model.")
    @GetMapping("/{indicatorCode}")
    public ResponseEntity<?> getModelMetadata(
            @Parameter(description = "Indicator code", example = "WHOSIS_000001")
            @PathVariable String indicatorCode) {
        return modelRegistry.getModelMetadata(indicatorCode)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
