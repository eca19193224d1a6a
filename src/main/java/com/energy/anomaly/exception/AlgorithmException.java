package com.energy.anomaly.exception;

import com.energy.anomaly.model.AlgorithmType;

/**
 * Numerical failure inside a specific algorithm adapter (singular covariance,
 * clustering that did not converge, non-finite scores).
 */
public class AlgorithmException extends DetectionException {

    private final AlgorithmType algorithm;

    public AlgorithmException(AlgorithmType algorithm, String message) {
        super(algorithm.getDisplayName() + ": " + message);
        this.algorithm = algorithm;
    }

    public AlgorithmException(AlgorithmType algorithm, String message, Throwable cause) {
        super(algorithm.getDisplayName() + ": " + message, cause);
        this.algorithm = algorithm;
    }

    public AlgorithmType getAlgorithm() {
        return algorithm;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.ALGORITHM;
    }
}
