package com.energy.anomaly.exception;

/**
 * Invalid run configuration: unknown algorithm id, out-of-range parameter,
 * invalid threshold percentile, unusable explicit feature list.
 */
public class ConfigException extends DetectionException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.CONFIG;
    }
}
