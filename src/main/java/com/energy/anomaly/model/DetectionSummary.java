package com.energy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Summary statistics of a detection run")
public class DetectionSummary {

    @Schema(description = "Rows scored", example = "1000")
    private int totalRows;

    @Schema(description = "Rows flagged as anomalous", example = "50")
    private int anomalyCount;

    @Schema(description = "Flagged rows as a percentage of all rows", example = "5.0")
    private double anomalyPercentage;

    @Schema(description = "Mean normalized score over all rows", example = "0.021")
    private double meanScore;

    @Schema(description = "Sample standard deviation of normalized scores over all rows", example = "0.064")
    private double stdScore;
}
