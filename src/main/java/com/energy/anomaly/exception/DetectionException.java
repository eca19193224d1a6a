package com.energy.anomaly.exception;

/**
 * Base type for every failure surfaced by a detection run.
 * A run that throws returns no partial result; the caller fixes its input and re-invokes.
 */
public abstract class DetectionException extends RuntimeException {

    protected DetectionException(String message) {
        super(message);
    }

    protected DetectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorType getErrorType();
}
