package com.energy.anomaly.engine;

import com.energy.anomaly.exception.AlgorithmException;
import com.energy.anomaly.model.RawScores;
import com.energy.anomaly.model.ScoreOrientation;
import org.springframework.stereotype.Component;

/**
 * Maps raw adapter scores into the shared "higher is more anomalous" space.
 * Only the sign changes: ranking and spread are preserved for threshold selection.
 */
@Component
public class ScoreNormalizer {

    public double[] normalize(RawScores raw) {
        double[] values = raw.getValues();
        double sign = raw.getOrientation() == ScoreOrientation.LOWER_IS_ANOMALOUS ? -1.0 : 1.0;
        double[] normalized = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new AlgorithmException(raw.getAlgorithm(), "non-finite raw score at row " + i);
            }
            // 0.0 rather than -0.0 keeps equal scores equal under Double.compare
            normalized[i] = sign * values[i] + 0.0;
        }
        return normalized;
    }
}
