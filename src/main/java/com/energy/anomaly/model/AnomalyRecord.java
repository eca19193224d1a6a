package com.energy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A dataset row flagged as anomalous")
public class AnomalyRecord {

    @Schema(description = "Zero-based index of the row in the submitted dataset", example = "412")
    private int rowIndex;

    @Schema(description = "Row timestamp, when the dataset has one", example = "2024-03-01T14:00:00Z")
    private Instant timestamp;

    @Schema(description = "Normalized anomaly score (higher = more anomalous)", example = "0.183")
    private double score;

    @Schema(description = "Original values of the feature columns for this row (null = missing)")
    private Map<String, Object> features;
}
