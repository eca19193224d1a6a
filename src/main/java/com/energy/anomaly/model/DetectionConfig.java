package com.energy.anomaly.model;

import com.energy.anomaly.model.params.AlgorithmParams;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Validated configuration of one detection run")
public class DetectionConfig {

    /** Sentinel feature selection: every numeric column of the dataset, in dataset order. */
    public static final List<String> ALL_NUMERIC_COLUMNS = List.of();

    @Schema(description = "Selected algorithm", example = "ISOLATION_FOREST")
    private AlgorithmType algorithm;

    @Schema(description = "Typed algorithm parameters; defaults are applied when absent")
    private AlgorithmParams params;

    @Schema(description = "Threshold percentile in (0, 100). When absent: 100*(1-contamination) for "
            + "Isolation Forest, the configured default otherwise", example = "95.0")
    private Double thresholdPercentile;

    @Schema(description = "Explicit feature columns; empty means all numeric columns")
    @Builder.Default
    private List<String> featureColumns = ALL_NUMERIC_COLUMNS;

    @Schema(description = "Derive hour-of-day sine/cosine and day-of-week from the timestamp column", example = "false")
    private boolean includeTimeFeatures;

    @Schema(description = "Timestamp column; defaults to the first TIMESTAMP column of the dataset", example = "timestamp")
    private String timestampColumn;

    @Schema(description = "Random seed; defaults to the configured seed", example = "42")
    private Long seed;

    public boolean usesAllNumericColumns() {
        return featureColumns == null || featureColumns.isEmpty();
    }
}
