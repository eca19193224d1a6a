package com.energy.anomaly.model.params;

import com.energy.anomaly.exception.ConfigException;
import com.energy.anomaly.model.AlgorithmType;

/**
 * @param clusters           requested k (>= 2); clamped to rows - 1 on small datasets
 * @param maxIterations      Lloyd iteration cap; hitting it without convergence is an error
 * @param minClusterFraction clusters smaller than this share of rows are dissolved (0 disables)
 */
public record CentroidDistanceParams(int clusters, int maxIterations, double minClusterFraction)
        implements AlgorithmParams {

    public CentroidDistanceParams {
        if (clusters < 2) {
            throw new ConfigException("clusters must be >= 2, got " + clusters);
        }
        if (maxIterations < 1) {
            throw new ConfigException("maxIterations must be >= 1, got " + maxIterations);
        }
        if (!(minClusterFraction >= 0.0 && minClusterFraction < 0.5)) {
            throw new ConfigException("minClusterFraction must be in [0, 0.5), got " + minClusterFraction);
        }
    }

    @Override
    public AlgorithmType algorithm() {
        return AlgorithmType.CENTROID_DISTANCE;
    }
}
