package com.energy.anomaly.model.params;

import com.energy.anomaly.exception.ConfigException;
import com.energy.anomaly.model.AlgorithmType;

/**
 * @param estimators    number of isolation trees
 * @param contamination expected anomaly share in (0, 0.5]; calibrates the decision offset
 * @param maxSamples    sub-sample size per tree (capped at the row count)
 */
public record IsolationForestParams(int estimators, double contamination, int maxSamples)
        implements AlgorithmParams {

    public static final int MAX_ESTIMATORS = 5000;

    public IsolationForestParams {
        if (estimators < 1 || estimators > MAX_ESTIMATORS) {
            throw new ConfigException("estimators must be in [1, " + MAX_ESTIMATORS + "], got " + estimators);
        }
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new ConfigException("contamination must be in (0, 0.5], got " + contamination);
        }
        if (maxSamples < 2) {
            throw new ConfigException("maxSamples must be >= 2, got " + maxSamples);
        }
    }

    @Override
    public AlgorithmType algorithm() {
        return AlgorithmType.ISOLATION_FOREST;
    }
}
