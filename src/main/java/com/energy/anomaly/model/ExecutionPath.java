package com.energy.anomaly.model;

/**
 * Which code path produced the raw scores of a run.
 */
public enum ExecutionPath {
    /** Single deterministic pass (isolation forest, clustering). */
    DIRECT,
    /** Iteratively trained reconstruction model. */
    ITERATIVE,
    /** Closed-form linear projection used after iterative training failed or timed out. */
    CLOSED_FORM_FALLBACK
}
