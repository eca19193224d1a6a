package com.energy.anomaly.engine.isolationforest;

import com.energy.anomaly.engine.AlgorithmAdapter;
import com.energy.anomaly.engine.FeatureMatrix;
import com.energy.anomaly.engine.Percentiles;
import com.energy.anomaly.exception.AlgorithmException;
import com.energy.anomaly.model.AlgorithmType;
import com.energy.anomaly.model.RawScores;
import com.energy.anomaly.model.ScoreOrientation;
import com.energy.anomaly.model.params.IsolationForestParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores rows with an Isolation Forest fitted on the standardized matrix.
 *
 * Scoring:
 *   s(x) = 2^(-E(h(x)) / c(n)) is near 1 for points isolated by short paths.
 *   decision(x) = -s(x) - offset, where offset is the contamination percentile of -s,
 *   so decision < 0 for roughly the contamination share of rows.
 *   raw score = -decision(x): larger means shorter average path, i.e. more anomalous.
 *
 * Contamination only places the decision offset; the run's output threshold comes from
 * the threshold percentile.
 */
@Component
public class IsolationForestDetector implements AlgorithmAdapter<IsolationForestParams> {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestDetector.class);

    @Override
    public AlgorithmType getAlgorithm() {
        return AlgorithmType.ISOLATION_FOREST;
    }

    @Override
    public RawScores score(FeatureMatrix matrix, IsolationForestParams params, long seed) {
        if (matrix.rows() < 2 || matrix.columns() == 0) {
            throw new AlgorithmException(getAlgorithm(),
                    "needs at least 2 rows and 1 feature, got " + matrix.rows() + "x" + matrix.columns());
        }

        double[][] data = matrix.standardized().toArray();
        IsolationForest forest = IsolationForest.fit(data, params.estimators(), params.maxSamples(), seed);

        double[] scoreSamples = forest.anomalyScores(data);
        for (int i = 0; i < scoreSamples.length; i++) {
            scoreSamples[i] = -scoreSamples[i];
        }
        double offset = Percentiles.of(scoreSamples, 100.0 * params.contamination());

        double[] raw = new double[scoreSamples.length];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = -(scoreSamples[i] - offset);
            if (!Double.isFinite(raw[i])) {
                throw new AlgorithmException(getAlgorithm(), "non-finite score at row " + i);
            }
        }

        log.debug("Isolation Forest fitted: {} trees, sample size {}, offset {}",
                params.estimators(), forest.getSampleSize(), offset);

        return RawScores.builder()
                .algorithm(getAlgorithm())
                .values(raw)
                .orientation(ScoreOrientation.HIGHER_IS_ANOMALOUS)
                .detail("estimators", params.estimators())
                .detail("contamination", params.contamination())
                .detail("sampleSize", forest.getSampleSize())
                .detail("maxDepth", IsolationForest.maxDepth(forest.getSampleSize()))
                .detail("offset", offset)
                .build();
    }
}
