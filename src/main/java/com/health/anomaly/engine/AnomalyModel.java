package com.health.anomaly.engine;

/**
 * A reconstruction model for a one-dimensional standardized series.
 * Values the model reconstructs poorly are atypical for the data it was fit on.
 */
public interface AnomalyModel {

    /**
     * Fit the model so that it reconstructs the given values.
     *
     * @param values standardized training values, pooled across all subjects
     * @return this model, fitted
     */
    AnomalyModel fit(double[] values);

    /**
     * Reconstruct each input value. Does not change the fitted parameters.
     *
     * @return one reconstructed value per input, in input order
     */
    double[] predict(double[] values);
}
