package com.energy.anomaly.engine.reconstruction;

import com.energy.anomaly.engine.AlgorithmAdapter;
import com.energy.anomaly.engine.FeatureMatrix;
import com.energy.anomaly.exception.AlgorithmException;
import com.energy.anomaly.model.AlgorithmType;
import com.energy.anomaly.model.ExecutionPath;
import com.energy.anomaly.model.RawScores;
import com.energy.anomaly.model.ScoreOrientation;
import com.energy.anomaly.model.params.ReconstructionParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores rows by how badly a compressed representation reconstructs them.
 *
 * The iterative path trains an autoencoder on the standardized matrix. If training is
 * cancelled, runs past its time budget or diverges, the run falls back to a principal
 * component projection of the same width and reports {@link ExecutionPath#CLOSED_FORM_FALLBACK}.
 * Either way the raw score is the per-row mean squared reconstruction error.
 */
@Component
public class ReconstructionDetector implements AlgorithmAdapter<ReconstructionParams> {

    private static final Logger log = LoggerFactory.getLogger(ReconstructionDetector.class);

    private static final double MIN_TOTAL_VARIANCE = 1e-12;

    @Override
    public AlgorithmType getAlgorithm() {
        return AlgorithmType.RECONSTRUCTION;
    }

    @Override
    public RawScores score(FeatureMatrix matrix, ReconstructionParams params, long seed) {
        return score(matrix, params, seed, TrainingMonitor.unbounded());
    }

    public RawScores score(FeatureMatrix matrix, ReconstructionParams params, long seed,
                           TrainingMonitor monitor) {
        int n = matrix.rows();
        int d = matrix.columns();
        if (n < 2) {
            throw new AlgorithmException(getAlgorithm(), "needs at least 2 rows, got " + n);
        }
        if (d < 2) {
            throw new AlgorithmException(getAlgorithm(),
                    "needs at least 2 feature columns to compress, got " + d);
        }

        double[][] data = matrix.standardized().toArray();
        if (totalVariance(data) < MIN_TOTAL_VARIANCE) {
            throw new AlgorithmException(getAlgorithm(), "all feature columns are constant");
        }

        int embedding = Math.min(params.embeddingSize(), d - 1);
        if (embedding != params.embeddingSize()) {
            log.info("Reconstruction embedding size {} reduced to {} for {} features",
                    params.embeddingSize(), embedding, d);
        }

        TrainingMonitor budget = monitor.narrow(params.trainingTimeout());
        RawScores.RawScoresBuilder result = RawScores.builder()
                .algorithm(getAlgorithm())
                .orientation(ScoreOrientation.HIGHER_IS_ANOMALOUS)
                .detail("embeddingSize", embedding)
                .detail("requestedEmbeddingSize", params.embeddingSize())
                .detail("epochs", params.epochs())
                .detail("batchSize", params.batchSize());

        double[] errors;
        try {
            Autoencoder model = Autoencoder.build(d, embedding, params.learningRate(), seed);
            double finalLoss = model.train(data, params.epochs(), params.batchSize(), seed, budget);
            errors = model.reconstructionErrors(data);
            ensureFinite(errors);
            result.executionPath(ExecutionPath.ITERATIVE)
                    .detail("finalLoss", finalLoss);
            log.debug("Autoencoder trained: {} epochs, final loss {}", params.epochs(), finalLoss);
        } catch (TrainingAbortedException e) {
            log.warn("Iterative reconstruction training stopped ({}); using closed-form projection",
                    e.getMessage());
            errors = PrincipalComponentProjector.reconstructionErrors(data, embedding);
            ensureFinite(errors);
            result.executionPath(ExecutionPath.CLOSED_FORM_FALLBACK)
                    .detail("fallbackReason", e.getMessage());
        }

        return result.values(errors).build();
    }

    private void ensureFinite(double[] errors) {
        for (int i = 0; i < errors.length; i++) {
            if (!Double.isFinite(errors[i])) {
                throw new AlgorithmException(getAlgorithm(), "non-finite reconstruction error at row " + i);
            }
        }
    }

    private static double totalVariance(double[][] data) {
        int n = data.length;
        int d = data[0].length;
        double total = 0.0;
        for (int j = 0; j < d; j++) {
            double mean = 0.0;
            for (double[] row : data) {
                mean += row[j];
            }
            mean /= n;
            for (double[] row : data) {
                double diff = row[j] - mean;
                total += diff * diff;
            }
        }
        return total / n;
    }
}
