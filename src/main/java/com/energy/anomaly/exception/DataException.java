package com.energy.anomaly.exception;

/**
 * The dataset cannot support a run: too few rows, no numeric feature columns,
 * unparseable timestamps.
 */
public class DataException extends DetectionException {

    public DataException(String message) {
        super(message);
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.DATA;
    }
}
