package com.health.anomaly.engine;

import com.health.anomaly.model.Severity;
import com.health.anomaly.model.ZScoreThresholds;

public final class SeverityClassifier {

    private SeverityClassifier() {}

    /**
     * Map a magnitude to the most severe tier whose threshold it reaches (inclusive).
     *
     * @param magnitude  absolute standardized value
     * @param thresholds tier cut-offs, high >= medium >= low
     */
    public static Severity classify(double magnitude, ZScoreThresholds thresholds) {
        if (magnitude >= thresholds.getHigh()) return Severity.HIGH;
        if (magnitude >= thresholds.getMedium()) return Severity.MEDIUM;
        if (magnitude >= thresholds.getLow()) return Severity.LOW;
        return Severity.NONE;
    }
}
