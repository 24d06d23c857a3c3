package com.health.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Absolute z-score cut-offs for each severity tier. Comparisons are inclusive.")
public class ZScoreThresholds {

    @Schema(description = "Magnitude at or above which severity is high", example = "3.0")
    private double high;

    @Schema(description = "Magnitude at or above which severity is medium", example = "2.0")
    private double medium;

    @Schema(description = "Magnitude at or above which severity is low", example = "1.0")
    private double low;

    public boolean isOrdered() {
        return high >= medium && medium >= low;
    }
}
