package com.energy.anomaly.model.params;

import com.energy.anomaly.exception.ConfigException;
import com.energy.anomaly.model.AlgorithmType;

import java.time.Duration;

/**
 * @param embeddingSize   width of the compressed representation
 * @param epochs          training iteration budget (passes over the data)
 * @param batchSize       mini-batch size for gradient steps
 * @param learningRate    Adam step size
 * @param trainingTimeout wall-clock budget for iterative training; exceeded means closed-form fallback
 */
public record ReconstructionParams(int embeddingSize, int epochs, int batchSize,
                                   double learningRate, Duration trainingTimeout)
        implements AlgorithmParams {

    public ReconstructionParams {
        if (embeddingSize < 1) {
            throw new ConfigException("embeddingSize must be >= 1, got " + embeddingSize);
        }
        if (epochs < 1 || epochs > 10_000) {
            throw new ConfigException("epochs must be in [1, 10000], got " + epochs);
        }
        if (batchSize < 1) {
            throw new ConfigException("batchSize must be >= 1, got " + batchSize);
        }
        if (!(learningRate > 0.0 && learningRate <= 1.0)) {
            throw new ConfigException("learningRate must be in (0, 1], got " + learningRate);
        }
        if (trainingTimeout == null || trainingTimeout.isNegative() || trainingTimeout.isZero()) {
            throw new ConfigException("trainingTimeout must be a positive duration");
        }
    }

    @Override
    public AlgorithmType algorithm() {
        return AlgorithmType.RECONSTRUCTION;
    }
}
