package com.energy.anomaly.model;

/**
 * Whether an adapter's raw scores already grow with anomalousness or must be sign-flipped.
 */
public enum ScoreOrientation {
    HIGHER_IS_ANOMALOUS,
    LOWER_IS_ANOMALOUS
}
