package com.energy.anomaly.engine;

import com.energy.anomaly.model.AlgorithmType;
import com.energy.anomaly.model.RawScores;
import com.energy.anomaly.model.params.AlgorithmParams;

/**
 * Uniform contract for the detection algorithms: one raw score per matrix row plus the
 * orientation of those scores. Implementations are stateless; every call is a pure,
 * synchronous transform and numerical failures surface as AlgorithmException.
 *
 * @param <P> the algorithm's parameter object
 */
public interface AlgorithmAdapter<P extends AlgorithmParams> {

    /**
     * The algorithm this adapter implements.
     */
    AlgorithmType getAlgorithm();

    /**
     * Score every row of the matrix.
     *
     * @param matrix prepared (unstandardized) feature matrix
     * @param params validated parameters
     * @param seed   seed for any randomized step
     * @return raw scores, same length as {@code matrix.rows()}
     */
    RawScores score(FeatureMatrix matrix, P params, long seed);
}
