package com.energy.anomaly.engine.reconstruction;

/**
 * Iterative training stopped before producing usable scores: timeout, cancellation,
 * interruption or a diverging loss.
 */
public class TrainingAbortedException extends Exception {

    public TrainingAbortedException(String message) {
        super(message);
    }
}
