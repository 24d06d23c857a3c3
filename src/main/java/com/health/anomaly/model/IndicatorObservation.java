package com.health.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single numeric health-indicator value for one country and year")
public class IndicatorObservation {

    @Schema(description = "Indicator code", example = "WHOSIS_000001")
    private String indicatorCode;

    @Schema(description = "Country code", example = "KEN")
    private String country;

    @Schema(description = "Observation year", example = "2019")
    private int year;

    @Schema(description = "Observed value", example = "66.1")
    private double value;
}
