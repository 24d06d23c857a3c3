package com.health.anomaly.engine;

import com.health.anomaly.model.Trend;
import com.health.anomaly.model.TrendResult;

/**
 * Direction of a chronological series from its least-squares slope against positions 0..n-1.
 */
public final class TrendEstimator {

    private TrendEstimator() {}

    public static TrendResult estimate(double[] values, double slopeThreshold) {
        if (values.length < 2) {
            return TrendResult.unknown();
        }
        double slope = slope(values);
        if (slope > slopeThreshold) return new TrendResult(Trend.IMPROVING, slope);
        if (slope < -slopeThreshold) return new TrendResult(Trend.DECLINING, slope);
        return new TrendResult(Trend.STABLE, slope);
    }

    static double slope(double[] values) {
        int n = values.length;
        double meanX = (n - 1) / 2.0;
        double meanY = 0.0;
        for (double v : values) meanY += v;
        meanY /= n;

        double covariance = 0.0;
        double varianceX = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            covariance += dx * (values[i] - meanY);
            varianceX += dx * dx;
        }
        return covariance / varianceX;
    }
}
