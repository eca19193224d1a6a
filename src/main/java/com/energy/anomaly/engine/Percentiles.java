package com.energy.anomaly.engine;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Linear-interpolation percentile (R-7, the numpy default), shared by threshold
 * selection and isolation forest offset calibration.
 */
public final class Percentiles {

    private Percentiles() {}

    /**
     * @param values     finite sample, not modified
     * @param percentile in (0, 100]
     */
    public static double of(double[] values, double percentile) {
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, percentile);
    }
}
