package com.energy.anomaly.service;

import com.energy.anomaly.config.AsyncConfig;
import com.energy.anomaly.config.MetricsConfig;
import com.energy.anomaly.engine.DetectionEngine;
import com.energy.anomaly.engine.reconstruction.TrainingMonitor;
import com.energy.anomaly.exception.DetectionException;
import com.energy.anomaly.exception.ErrorType;
import com.energy.anomaly.model.Dataset;
import com.energy.anomaly.model.DetectionConfig;
import com.energy.anomaly.model.DetectionRun;
import com.energy.anomaly.model.ExecutionPath;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for callers of the detection engine.
 *
 * Wraps each run with logging and metrics. Failures are logged once here and rethrown
 * unchanged; nothing is retried.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final DetectionEngine engine;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionService(DetectionEngine engine, MetricsConfig metricsConfig) {
        this.engine = engine;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "detection.run", contextualName = "run-detection")
    public DetectionRun detect(Dataset dataset, DetectionConfig config) {
        return detect(dataset, config, TrainingMonitor.unbounded());
    }

    /**
     * Run detection with a caller-held training monitor, e.g. to cancel a long
     * reconstruction run from another thread.
     */
    public DetectionRun detect(Dataset dataset, DetectionConfig config, TrainingMonitor monitor) {
        String algorithm = algorithmTag(config);
        log.info("Starting {} detection on {} rows", algorithm, dataset.rowCount());
        long start = System.currentTimeMillis();

        DetectionRun run;
        try {
            run = engine.run(dataset, config, monitor);
        } catch (DetectionException e) {
            long elapsed = System.currentTimeMillis() - start;
            metricsConfig.recordRun(algorithm, e.getErrorType().name().toLowerCase(Locale.ROOT), elapsed);
            if (e.getErrorType() == ErrorType.ALGORITHM) {
                log.error("{} detection failed after {} ms: {}", algorithm, elapsed, e.getMessage(), e);
            } else {
                log.warn("{} detection rejected: {}", algorithm, e.getMessage());
            }
            throw e;
        }

        metricsConfig.recordRun(algorithm, "success", run.getExecutionTimeMs());
        metricsConfig.recordAnomalies(algorithm, run.getSummary().getAnomalyCount());
        if (run.getExecutionPath() == ExecutionPath.CLOSED_FORM_FALLBACK) {
            metricsConfig.recordReconstructionFallback();
        }

        log.info("Detection {} finished: {} of {} rows anomalous over {} features (threshold {} at p{}) in {} ms",
                run.getRunId(), run.getSummary().getAnomalyCount(), run.getSummary().getTotalRows(),
                run.getFeatureColumns() == null ? 0 : run.getFeatureColumns().size(),
                run.getThreshold(), run.getThresholdPercentile(), run.getExecutionTimeMs());
        return run;
    }

    /**
     * Same as {@link #detect(Dataset, DetectionConfig)} on the detection worker pool.
     * A failed run completes the future exceptionally.
     */
    @Async(AsyncConfig.DETECTION_EXECUTOR)
    @Observed(name = "detection.run", contextualName = "run-detection-async")
    public CompletableFuture<DetectionRun> detectAsync(Dataset dataset, DetectionConfig config) {
        return CompletableFuture.completedFuture(detect(dataset, config));
    }

    private static String algorithmTag(DetectionConfig config) {
        if (config == null) {
            return "unknown";
        }
        if (config.getAlgorithm() != null) {
            return config.getAlgorithm().getId();
        }
        if (config.getParams() != null) {
            return config.getParams().algorithm().getId();
        }
        return "unknown";
    }
}
