package com.energy.anomaly.engine;

import com.energy.anomaly.exception.AlgorithmException;
import com.energy.anomaly.model.AlgorithmType;
import com.energy.anomaly.model.RawScores;
import com.energy.anomaly.model.ScoreOrientation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoreNormalizerTest {

    private final ScoreNormalizer normalizer = new ScoreNormalizer();

    @Test
    void normalize_higherIsAnomalous_keepsValues() {
        double[] raw = {0.5, -1.0, 3.25};

        double[] normalized = normalizer.normalize(raw(raw, ScoreOrientation.HIGHER_IS_ANOMALOUS));

        assertThat(normalized).containsExactly(0.5, -1.0, 3.25);
    }

    @Test
    void normalize_lowerIsAnomalous_flipsSignWithoutRescaling() {
        double[] raw = {0.5, -1.0, 3.25};

        double[] normalized = normalizer.normalize(raw(raw, ScoreOrientation.LOWER_IS_ANOMALOUS));

        assertThat(normalized).containsExactly(-0.5, 1.0, -3.25);
    }

    @Test
    void normalize_doesNotMutateRawScores() {
        double[] raw = {2.0, 1.0};

        normalizer.normalize(raw(raw, ScoreOrientation.LOWER_IS_ANOMALOUS));

        assertThat(raw).containsExactly(2.0, 1.0);
    }

    @Test
    void normalize_nonFiniteScore_throwsAlgorithmException() {
        double[] raw = {1.0, Double.NaN};

        assertThatThrownBy(() -> normalizer.normalize(raw(raw, ScoreOrientation.HIGHER_IS_ANOMALOUS)))
                .isInstanceOf(AlgorithmException.class)
                .hasMessageContaining("row 1");
    }

    private static RawScores raw(double[] values, ScoreOrientation orientation) {
        return RawScores.builder()
                .algorithm(AlgorithmType.DENSITY)
                .values(values)
                .orientation(orientation)
                .build();
    }
}
