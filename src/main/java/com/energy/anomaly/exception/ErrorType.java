package com.energy.anomaly.exception;

public enum ErrorType {
    CONFIG,
    DATA,
    ALGORITHM
}
