package com.energy.anomaly.engine;

import com.energy.anomaly.config.DetectionProperties;
import com.energy.anomaly.engine.clustering.CentroidDistanceDetector;
import com.energy.anomaly.engine.clustering.DensityDetector;
import com.energy.anomaly.engine.isolationforest.IsolationForestDetector;
import com.energy.anomaly.engine.reconstruction.ReconstructionDetector;
import com.energy.anomaly.engine.reconstruction.TrainingMonitor;
import com.energy.anomaly.exception.AlgorithmException;
import com.energy.anomaly.exception.ConfigException;
import com.energy.anomaly.model.AlgorithmType;
import com.energy.anomaly.model.Dataset;
import com.energy.anomaly.model.DetectionConfig;
import com.energy.anomaly.model.DetectionRun;
import com.energy.anomaly.model.RawScores;
import com.energy.anomaly.model.ThresholdResult;
import com.energy.anomaly.model.params.AlgorithmParams;
import com.energy.anomaly.model.params.CentroidDistanceParams;
import com.energy.anomaly.model.params.DensityParams;
import com.energy.anomaly.model.params.IsolationForestParams;
import com.energy.anomaly.model.params.ReconstructionParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One detection run, start to finish:
 * prepare features, score, normalize, threshold, assemble.
 *
 * Holds no state between calls; every run owns its matrix and intermediate arrays, so
 * concurrent runs are independent. Any failure propagates and no partial run is returned.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final FeaturePreparer featurePreparer;
    private final IsolationForestDetector isolationForestDetector;
    private final ReconstructionDetector reconstructionDetector;
    private final CentroidDistanceDetector centroidDistanceDetector;
    private final DensityDetector densityDetector;
    private final ScoreNormalizer scoreNormalizer;
    private final ThresholdSelector thresholdSelector;
    private final ResultAssembler resultAssembler;
    private final AlgorithmParameterParser parameterParser;
    private final TimestampParser timestampParser;
    private final DetectionProperties properties;

    public DetectionEngine(FeaturePreparer featurePreparer,
                           IsolationForestDetector isolationForestDetector,
                           ReconstructionDetector reconstructionDetector,
                           CentroidDistanceDetector centroidDistanceDetector,
                           DensityDetector densityDetector,
                           ScoreNormalizer scoreNormalizer,
                           ThresholdSelector thresholdSelector,
                           ResultAssembler resultAssembler,
                           AlgorithmParameterParser parameterParser,
                           TimestampParser timestampParser,
                           DetectionProperties properties) {
        this.featurePreparer = featurePreparer;
        this.isolationForestDetector = isolationForestDetector;
        this.reconstructionDetector = reconstructionDetector;
        this.centroidDistanceDetector = centroidDistanceDetector;
        this.densityDetector = densityDetector;
        this.scoreNormalizer = scoreNormalizer;
        this.thresholdSelector = thresholdSelector;
        this.resultAssembler = resultAssembler;
        this.parameterParser = parameterParser;
        this.timestampParser = timestampParser;
        this.properties = properties;
    }

    public DetectionRun run(Dataset dataset, DetectionConfig config) {
        return run(dataset, config, TrainingMonitor.unbounded());
    }

    /**
     * @param monitor cancellation and time budget for iterative training; cancelling it makes
     *                a reconstruction run fall back to its closed-form path
     */
    public DetectionRun run(Dataset dataset, DetectionConfig config, TrainingMonitor monitor) {
        long start = System.nanoTime();
        DetectionConfig resolved = resolve(config);

        thresholdSelector.validatePercentile(resolved.getThresholdPercentile());
        thresholdSelector.validateRowCount(dataset.rowCount());
        String timestampColumn = timestampParser.resolveColumn(dataset, resolved).orElse(null);
        Instant[] timestamps = timestampColumn == null ? null : timestampParser.parseColumn(dataset, timestampColumn);

        FeatureMatrix matrix = featurePreparer.prepare(dataset, resolved);
        log.debug("Prepared {}x{} feature matrix: {}", matrix.rows(), matrix.columns(), matrix.getColumnNames());

        RawScores raw = score(matrix, resolved.getParams(), resolved.getSeed(), monitor);
        if (raw.size() != dataset.rowCount()) {
            throw new AlgorithmException(raw.getAlgorithm(),
                    "produced " + raw.size() + " scores for " + dataset.rowCount() + " rows");
        }

        double[] scores = scoreNormalizer.normalize(raw);
        ThresholdResult threshold = thresholdSelector.select(scores, resolved.getThresholdPercentile());
        DetectionRun run = resultAssembler.assemble(dataset, matrix, scores, threshold, timestampColumn, timestamps);

        Map<String, Object> details = new LinkedHashMap<>(raw.getDetails());
        details.put("executionPath", raw.getExecutionPath().name());

        run.setRunId(UUID.randomUUID().toString());
        run.setConfig(resolved);
        run.setExecutionPath(raw.getExecutionPath());
        run.setModelDetails(details);
        run.setExecutionTimeMs((System.nanoTime() - start) / 1_000_000);
        run.setCompletedAt(Instant.now());
        return run;
    }

    /**
     * Fills algorithm, parameters, percentile and seed from defaults where the config is silent.
     */
    public DetectionConfig resolve(DetectionConfig config) {
        if (config == null) {
            throw new ConfigException("Detection config is required");
        }
        AlgorithmParams params = config.getParams();
        AlgorithmType algorithm = config.getAlgorithm();
        if (algorithm == null && params == null) {
            throw new ConfigException("Detection config names no algorithm");
        }
        if (algorithm == null) {
            algorithm = params.algorithm();
        }
        if (params == null) {
            params = parameterParser.defaults(algorithm);
        } else if (params.algorithm() != algorithm) {
            throw new ConfigException("Parameters for " + params.algorithm().getDisplayName()
                    + " given for algorithm " + algorithm.getDisplayName());
        }

        Double percentile = config.getThresholdPercentile();
        if (percentile == null) {
            percentile = params instanceof IsolationForestParams iforest
                    ? 100.0 * (1.0 - iforest.contamination())
                    : properties.getDefaultThresholdPercentile();
        }

        return DetectionConfig.builder()
                .algorithm(algorithm)
                .params(params)
                .thresholdPercentile(percentile)
                .featureColumns(config.getFeatureColumns() == null
                        ? DetectionConfig.ALL_NUMERIC_COLUMNS
                        : new ArrayList<>(config.getFeatureColumns()))
                .includeTimeFeatures(config.isIncludeTimeFeatures())
                .timestampColumn(config.getTimestampColumn())
                .seed(config.getSeed() != null ? config.getSeed() : properties.getDefaultSeed())
                .build();
    }

    private RawScores score(FeatureMatrix matrix, AlgorithmParams params, long seed, TrainingMonitor monitor) {
        if (params instanceof IsolationForestParams p) {
            return isolationForestDetector.score(matrix, p, seed);
        }
        if (params instanceof ReconstructionParams p) {
            return reconstructionDetector.score(matrix, p, seed, monitor);
        }
        if (params instanceof CentroidDistanceParams p) {
            return centroidDistanceDetector.score(matrix, p, seed);
        }
        if (params instanceof DensityParams p) {
            return densityDetector.score(matrix, p, seed);
        }
        throw new ConfigException("Unsupported parameters: " + params.getClass().getSimpleName());
    }
}
