package com.energy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Dataset plus run configuration submitted for anomaly detection")
public class DetectionRequest {

    @Schema(description = "Column metadata from the dataset loader")
    private List<DatasetColumn> columns;

    @Schema(description = "Rows keyed by column name; null or missing cells are treated as missing values")
    private List<Map<String, Object>> rows;

    @Schema(description = "Algorithm id: isolation_forest, reconstruction, centroid_distance or density "
            + "(aliases iforest, autoencoder, kmeans, dbscan)", example = "isolation_forest")
    private String algorithm;

    @Schema(description = "Algorithm parameters; absent keys take configured defaults",
            example = "{\"estimators\": 100, \"contamination\": 0.02}")
    private Map<String, Object> params;

    @Schema(description = "Threshold percentile in (0, 100)", example = "95.0")
    private Double thresholdPercentile;

    @Schema(description = "Feature columns; omit for all numeric columns")
    private List<String> featureColumns;

    @Schema(description = "Derive hour-of-day and day-of-week features from the timestamp", example = "false")
    private boolean includeTimeFeatures;

    @Schema(description = "Timestamp column; defaults to the first TIMESTAMP column", example = "timestamp")
    private String timestampColumn;

    @Schema(description = "Random seed for reproducible runs", example = "42")
    private Long seed;
}
