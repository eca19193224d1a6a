package com.energy.anomaly.model.params;

import com.energy.anomaly.exception.ConfigException;
import com.energy.anomaly.model.AlgorithmType;

/**
 * @param radius     neighborhood radius in standardized feature space
 * @param minSamples rows (including the row itself) a neighborhood needs to be dense
 */
public record DensityParams(double radius, int minSamples) implements AlgorithmParams {

    public DensityParams {
        if (!(radius > 0.0) || Double.isInfinite(radius)) {
            throw new ConfigException("radius must be a positive finite number, got " + radius);
        }
        if (minSamples < 1) {
            throw new ConfigException("minSamples must be >= 1, got " + minSamples);
        }
    }

    @Override
    public AlgorithmType algorithm() {
        return AlgorithmType.DENSITY;
    }
}
