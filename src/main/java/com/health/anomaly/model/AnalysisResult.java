package com.health.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@Schema(description = "Outcome of scoring the latest observation of one country's indicator series")
public class AnalysisResult {

    public static final String SUBJECT_TYPE_COUNTRY = "country";

    @Schema(description = "When the series was scored (UTC)", example = "2024-05-01T09:30:00Z")
    Instant timestamp;

    @Schema(description = "Kind of subject the result is about", example = "country")
    String subjectType;

    @Schema(description = "Country code", example = "KEN")
    String subjectId;

    @Schema(description = "Indicator code", example = "WHOSIS_000001")
    String indicatorCode;

    @Schema(description = "Severity derived from the absolute standardized latest value",
            example = "medium", allowableValues = {"none", "low", "medium", "high"})
    Severity severity;

    @Schema(description = "Direction of the raw series", example = "declining",
            allowableValues = {"improving", "declining", "stable", "unknown"})
    Trend trend;

    @Schema(description = "Least-squares slope of the raw series per observation", example = "-0.42")
    double slope;

    @Schema(description = "Raw value of the latest observation", example = "61.3")
    double latestValue;

    @Schema(description = "Latest value standardized with the indicator's training mean/std", example = "-2.31")
    double standardizedLatest;

    @Schema(description = "Absolute difference between the standardized latest value and its reconstruction",
            example = "0.0412")
    double reconstructionError;

    @Schema(description = "One-line human readable summary")
    String explanation;

    @Schema(description = "Clinical report, present only for medium and high severity")
    ClinicalReport report;
}
