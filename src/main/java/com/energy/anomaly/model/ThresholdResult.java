package com.energy.anomaly.model;

/**
 * Percentile cutoff and the mask {@code score > threshold}.
 */
public record ThresholdResult(double percentile, double threshold, boolean[] mask, int anomalyCount) {
}
