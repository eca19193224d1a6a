package com.energy.anomaly.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Map;

/**
 * One raw score per matrix row, with algorithm-specific semantics until normalized.
 */
@Getter
@Builder
public class RawScores {

    private final AlgorithmType algorithm;

    private final double[] values;

    private final ScoreOrientation orientation;

    @Builder.Default
    private final ExecutionPath executionPath = ExecutionPath.DIRECT;

    // Model details for insight pages (cluster sizes, effective k, training loss, ...)
    @Singular
    private final Map<String, Object> details;

    public int size() {
        return values.length;
    }
}
