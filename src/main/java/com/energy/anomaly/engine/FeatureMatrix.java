package com.energy.anomaly.engine;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense real-valued matrix with a fixed column order and one row per dataset row.
 * Never mutated after construction; transforms return new instances.
 */
public final class FeatureMatrix {

    private final List<String> columnNames;
    private final double[][] values;
    private final Map<String, Integer> imputedCounts;

    public FeatureMatrix(List<String> columnNames, double[][] values, Map<String, Integer> imputedCounts) {
        if (values.length > 0 && values[0].length != columnNames.size()) {
            throw new IllegalArgumentException("Column count " + values[0].length
                    + " does not match " + columnNames.size() + " names");
        }
        this.columnNames = List.copyOf(columnNames);
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            this.values[i] = Arrays.copyOf(values[i], values[i].length);
        }
        this.imputedCounts = Collections.unmodifiableMap(new LinkedHashMap<>(imputedCounts));
    }

    public FeatureMatrix(List<String> columnNames, double[][] values) {
        this(columnNames, values, Map.of());
    }

    public int rows() {
        return values.length;
    }

    public int columns() {
        return columnNames.size();
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public Map<String, Integer> getImputedCounts() {
        return imputedCounts;
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    public double[] row(int row) {
        return Arrays.copyOf(values[row], values[row].length);
    }

    public double[] column(int column) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i][column];
        }
        return out;
    }

    /**
     * Copy of the backing array, safe for adapters to work on.
     */
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = Arrays.copyOf(values[i], values[i].length);
        }
        return copy;
    }

    /**
     * Zero mean, unit (population) variance per column. Constant columns become all zeros.
     */
    public FeatureMatrix standardized() {
        int n = rows();
        int d = columns();
        double[][] out = new double[n][d];
        for (int j = 0; j < d; j++) {
            double mean = 0.0;
            for (int i = 0; i < n; i++) {
                mean += values[i][j];
            }
            mean /= n;
            double var = 0.0;
            for (int i = 0; i < n; i++) {
                double diff = values[i][j] - mean;
                var += diff * diff;
            }
            double std = Math.sqrt(var / n);
            double scale = std > 0 ? std : 1.0;
            for (int i = 0; i < n; i++) {
                out[i][j] = (values[i][j] - mean) / scale;
            }
        }
        return new FeatureMatrix(columnNames, out, imputedCounts);
    }
}
