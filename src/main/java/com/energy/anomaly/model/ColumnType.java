package com.energy.anomaly.model;

public enum ColumnType {
    NUMERIC,
    TIMESTAMP,
    CATEGORICAL
}
