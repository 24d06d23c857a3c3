package com.health.anomaly.model;

import lombok.Value;

@Value
public class TrendResult {

    Trend trend;
    double slope;

    public static TrendResult unknown() {
        return new TrendResult(Trend.UNKNOWN, 0.0);
    }
}
