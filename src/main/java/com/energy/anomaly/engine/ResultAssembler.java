package com.energy.anomaly.engine;

import com.energy.anomaly.model.AnomalyRecord;
import com.energy.anomaly.model.Dataset;
import com.energy.anomaly.model.DetectionRun;
import com.energy.anomaly.model.DetectionSummary;
import com.energy.anomaly.model.ThresholdResult;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins the anomaly mask back to the original rows.
 *
 * Records are ordered by score descending, ties by row index ascending. Each record carries
 * the dataset's own values for the feature columns (missing cells stay null); derived time
 * features are not part of the snapshot.
 */
@Component
public class ResultAssembler {

    private final TimestampParser timestampParser;

    public ResultAssembler(TimestampParser timestampParser) {
        this.timestampParser = timestampParser;
    }

    /**
     * @param timestampColumn dataset timestamp column, or null when the dataset has none
     */
    public DetectionRun assemble(Dataset dataset, FeatureMatrix matrix, double[] scores,
                                 ThresholdResult threshold, String timestampColumn) {
        Instant[] timestamps = timestampColumn == null ? null : timestampParser.parseColumn(dataset, timestampColumn);
        return assemble(dataset, matrix, scores, threshold, timestampColumn, timestamps);
    }

    /**
     * @param timestamps parsed timestamp per row, or null when the dataset has none
     * @return a run holding threshold, anomalies, summary, scores and feature bookkeeping;
     *         identity, config and timing are left to the caller
     */
    public DetectionRun assemble(Dataset dataset, FeatureMatrix matrix, double[] scores,
                                 ThresholdResult threshold, String timestampColumn, Instant[] timestamps) {
        List<String> sourceColumns = matrix.getColumnNames().stream()
                .filter(name -> !FeaturePreparer.DERIVED_COLUMNS.contains(name) || dataset.findColumn(name).isPresent())
                .toList();

        boolean[] mask = threshold.mask();
        List<AnomalyRecord> anomalies = new ArrayList<>(threshold.anomalyCount());
        for (int i = 0; i < mask.length; i++) {
            if (!mask[i]) {
                continue;
            }
            Map<String, Object> features = new LinkedHashMap<>();
            for (String column : sourceColumns) {
                features.put(column, dataset.value(i, column));
            }
            anomalies.add(AnomalyRecord.builder()
                    .rowIndex(i)
                    .timestamp(timestamps == null ? null : timestamps[i])
                    .score(scores[i])
                    .features(features)
                    .build());
        }
        anomalies.sort(Comparator.comparingDouble(AnomalyRecord::getScore).reversed()
                .thenComparingInt(AnomalyRecord::getRowIndex));

        List<Double> scoreList = new ArrayList<>(scores.length);
        for (double s : scores) {
            scoreList.add(s);
        }

        return DetectionRun.builder()
                .thresholdPercentile(threshold.percentile())
                .threshold(threshold.threshold())
                .anomalies(anomalies)
                .summary(summarize(scores, anomalies.size()))
                .scores(scoreList)
                .featureColumns(matrix.getColumnNames())
                .snapshotColumns(sourceColumns)
                .timestampColumn(timestampColumn)
                .imputedCounts(matrix.getImputedCounts())
                .build();
    }

    DetectionSummary summarize(double[] scores, int anomalyCount) {
        DescriptiveStatistics stats = new DescriptiveStatistics(scores);
        int total = scores.length;
        double std = total > 1 ? stats.getStandardDeviation() : 0.0;
        return DetectionSummary.builder()
                .totalRows(total)
                .anomalyCount(anomalyCount)
                .anomalyPercentage(total == 0 ? 0.0 : 100.0 * anomalyCount / total)
                .meanScore(total == 0 ? 0.0 : stats.getMean())
                .stdScore(std)
                .build();
    }
}
