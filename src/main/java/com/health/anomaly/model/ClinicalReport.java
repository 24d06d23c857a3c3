package com.health.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

import java.util.Map;

@Value
@Schema(description = "FHIR-style Observation and DiagnosticReport resources describing a detected anomaly")
public class ClinicalReport {

    @Schema(description = "Observation resource")
    Map<String, Object> observation;

    @Schema(description = "DiagnosticReport resource")
    Map<String, Object> diagnosticReport;
}
