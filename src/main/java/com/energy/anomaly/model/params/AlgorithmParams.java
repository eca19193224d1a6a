package com.energy.anomaly.model.params;

import com.energy.anomaly.model.AlgorithmType;

/**
 * Typed parameter object for one algorithm. The variant selects the adapter.
 */
public sealed interface AlgorithmParams
        permits IsolationForestParams, ReconstructionParams, CentroidDistanceParams, DensityParams {

    AlgorithmType algorithm();
}
