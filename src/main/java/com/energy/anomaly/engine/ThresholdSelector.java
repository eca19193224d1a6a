package com.energy.anomaly.engine;

import com.energy.anomaly.config.DetectionProperties;
import com.energy.anomaly.exception.ConfigException;
import com.energy.anomaly.exception.DataException;
import com.energy.anomaly.model.ThresholdResult;
import org.springframework.stereotype.Component;

/**
 * Percentile cutoff over normalized scores. A row is anomalous when its score is strictly
 * above the cutoff, so raising the percentile never flags more rows.
 */
@Component
public class ThresholdSelector {

    private final int minRows;

    public ThresholdSelector(DetectionProperties properties) {
        this.minRows = properties.getMinRows();
    }

    public int getMinRows() {
        return minRows;
    }

    public ThresholdResult select(double[] scores, double percentile) {
        validatePercentile(percentile);
        validateRowCount(scores.length);

        double threshold = Percentiles.of(scores, percentile);
        boolean[] mask = new boolean[scores.length];
        int count = 0;
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] > threshold) {
                mask[i] = true;
                count++;
            }
        }
        return new ThresholdResult(percentile, threshold, mask, count);
    }

    public void validatePercentile(double percentile) {
        if (!(percentile > 0.0 && percentile < 100.0)) {
            throw new ConfigException("Threshold percentile must be strictly between 0 and 100, got " + percentile);
        }
    }

    public void validateRowCount(int rows) {
        if (rows < minRows) {
            throw new DataException("At least " + minRows + " rows are needed for a percentile threshold, got " + rows);
        }
    }
}
