package com.energy.anomaly.engine;

import com.energy.anomaly.exception.ConfigException;
import com.energy.anomaly.exception.DataException;
import com.energy.anomaly.model.ColumnType;
import com.energy.anomaly.model.Dataset;
import com.energy.anomaly.model.DatasetColumn;
import com.energy.anomaly.model.DetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts a dataset into a clean numeric feature matrix.
 *
 * Column order is the explicit list order, or dataset order for the all-numeric sentinel,
 * followed by derived time features when requested:
 *   hour_sin, hour_cos: hour of day (with minutes) on the unit circle
 *   day_of_week:        0 = Monday .. 6 = Sunday
 *
 * Missing numeric cells are imputed with the column mean and counted per column.
 * Columns with no values at all are dropped.
 */
@Component
public class FeaturePreparer {

    private static final Logger log = LoggerFactory.getLogger(FeaturePreparer.class);

    public static final String HOUR_SIN = "hour_sin";
    public static final String HOUR_COS = "hour_cos";
    public static final String DAY_OF_WEEK = "day_of_week";

    public static final Set<String> DERIVED_COLUMNS = Set.of(HOUR_SIN, HOUR_COS, DAY_OF_WEEK);

    private final TimestampParser timestampParser;

    public FeaturePreparer(TimestampParser timestampParser) {
        this.timestampParser = timestampParser;
    }

    public FeatureMatrix prepare(Dataset dataset, DetectionConfig config) {
        int n = dataset.rowCount();
        List<String> candidates = candidateColumns(dataset, config);

        List<String> names = new ArrayList<>();
        List<double[]> columns = new ArrayList<>();
        Map<String, Integer> imputedCounts = new LinkedHashMap<>();

        for (String name : candidates) {
            double[] values = readNumeric(dataset, name);
            int missing = 0;
            double sum = 0.0;
            for (double v : values) {
                if (Double.isNaN(v)) {
                    missing++;
                } else {
                    sum += v;
                }
            }
            if (missing == n) {
                log.warn("Dropping feature column '{}': no values present", name);
                continue;
            }
            if (missing > 0) {
                double mean = sum / (n - missing);
                for (int i = 0; i < n; i++) {
                    if (Double.isNaN(values[i])) {
                        values[i] = mean;
                    }
                }
                log.debug("Imputed {} missing values in '{}' with column mean {}", missing, name, mean);
            }
            names.add(name);
            columns.add(values);
            imputedCounts.put(name, missing);
        }

        if (names.isEmpty()) {
            if (config.usesAllNumericColumns()) {
                throw new DataException("Dataset has no usable numeric feature columns");
            }
            throw new ConfigException("None of the requested feature columns " + config.getFeatureColumns()
                    + " is a usable numeric column");
        }

        if (config.isIncludeTimeFeatures()) {
            appendTimeFeatures(dataset, config, names, columns);
        }

        double[][] matrix = new double[n][names.size()];
        for (int j = 0; j < columns.size(); j++) {
            double[] column = columns.get(j);
            for (int i = 0; i < n; i++) {
                matrix[i][j] = column[i];
            }
        }

        int totalImputed = imputedCounts.values().stream().mapToInt(Integer::intValue).sum();
        if (totalImputed > 0) {
            log.warn("Imputed {} missing values across {} columns", totalImputed, imputedCounts.size());
        }
        return new FeatureMatrix(names, matrix, imputedCounts);
    }

    private List<String> candidateColumns(Dataset dataset, DetectionConfig config) {
        if (config.usesAllNumericColumns()) {
            List<String> numeric = dataset.columnNames(ColumnType.NUMERIC);
            if (numeric.isEmpty()) {
                throw new DataException("Dataset has no numeric columns");
            }
            return numeric;
        }
        LinkedHashSet<String> selected = new LinkedHashSet<>();
        for (String name : config.getFeatureColumns()) {
            Optional<DatasetColumn> column = dataset.findColumn(name);
            if (column.isEmpty()) {
                log.warn("Requested feature column '{}' is not in the dataset; ignoring it", name);
            } else if (column.get().getType() != ColumnType.NUMERIC) {
                log.warn("Requested feature column '{}' is {}; ignoring it", name, column.get().getType());
            } else {
                selected.add(name);
            }
        }
        return new ArrayList<>(selected);
    }

    private double[] readNumeric(Dataset dataset, String name) {
        int n = dataset.rowCount();
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = toDouble(dataset.value(i, name), name, i);
        }
        return values;
    }

    private double toDouble(Object raw, String column, int row) {
        if (raw == null) {
            return Double.NaN;
        }
        if (raw instanceof Number number) {
            double v = number.doubleValue();
            if (Double.isInfinite(v)) {
                throw new DataException("Infinite value in column '" + column + "' at row " + row);
            }
            return v;
        }
        String text = raw.toString().trim();
        if (text.isEmpty() || text.equalsIgnoreCase("nan") || text.equalsIgnoreCase("null")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new DataException("Non-numeric value '" + text + "' in column '" + column
                    + "' at row " + row, e);
        }
    }

    private void appendTimeFeatures(Dataset dataset, DetectionConfig config,
                                    List<String> names, List<double[]> columns) {
        String tsColumn = timestampParser.resolveColumn(dataset, config)
                .orElseThrow(() -> new ConfigException("Time features requested but the dataset has no timestamp column"));

        int n = dataset.rowCount();
        double[] hourSin = new double[n];
        double[] hourCos = new double[n];
        double[] dayOfWeek = new double[n];
        for (int i = 0; i < n; i++) {
            Instant ts = timestampParser.parse(dataset.value(i, tsColumn), i);
            if (ts == null) {
                throw new DataException("Missing timestamp at row " + i + " in column '" + tsColumn + "'");
            }
            ZonedDateTime local = ts.atZone(timestampParser.getZone());
            double hour = local.getHour() + local.getMinute() / 60.0;
            double angle = 2.0 * Math.PI * hour / 24.0;
            hourSin[i] = Math.sin(angle);
            hourCos[i] = Math.cos(angle);
            dayOfWeek[i] = local.getDayOfWeek().getValue() - 1;
        }
        names.add(HOUR_SIN);
        columns.add(hourSin);
        names.add(HOUR_COS);
        columns.add(hourCos);
        names.add(DAY_OF_WEEK);
        columns.add(dayOfWeek);
    }
}
