package com.energy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of one detection run, owned by the caller")
public class DetectionRun {

    @Schema(description = "Run identifier", example = "8f0c3c1e-4a57-4c8e-9d43-2b7d1d3f7a10")
    private String runId;

    @Schema(description = "Configuration the run executed with (defaults resolved)")
    private DetectionConfig config;

    @Schema(description = "Percentile the threshold was taken at", example = "95.0")
    private double thresholdPercentile;

    @Schema(description = "Score cutoff; rows scoring strictly above it are anomalies", example = "0.087")
    private double threshold;

    @Schema(description = "Code path that produced the scores", example = "DIRECT")
    private ExecutionPath executionPath;

    @Schema(description = "Flagged rows ordered by score descending")
    private List<AnomalyRecord> anomalies;

    @Schema(description = "Count, percentage, mean and standard deviation of scores")
    private DetectionSummary summary;

    @Schema(description = "Normalized score of every dataset row, in row order")
    private List<Double> scores;

    @Schema(description = "Feature matrix columns in order, derived time features included")
    private List<String> featureColumns;

    @Schema(description = "Dataset columns captured in each anomaly's feature snapshot")
    private List<String> snapshotColumns;

    @Schema(description = "Dataset timestamp column, when the dataset has one", example = "timestamp")
    private String timestampColumn;

    @Schema(description = "Missing values imputed with the column mean, per column")
    private Map<String, Integer> imputedCounts;

    @Schema(description = "Algorithm-specific model details")
    private Map<String, Object> modelDetails;

    @Schema(description = "Wall-clock duration of the run in milliseconds", example = "184")
    private long executionTimeMs;

    @Schema(description = "Completion time")
    private Instant completedAt;
}
