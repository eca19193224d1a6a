package com.energy.anomaly.engine.clustering;

import org.apache.commons.math3.ml.clustering.Clusterable;

/**
 * A matrix row that remembers its position. Equality is identity, so duplicate rows
 * stay distinct points inside the clusterers' hash-based bookkeeping.
 */
final class IndexedPoint implements Clusterable {

    private final int index;
    private final double[] point;

    IndexedPoint(int index, double[] point) {
        this.index = index;
        this.point = point;
    }

    int getIndex() {
        return index;
    }

    @Override
    public double[] getPoint() {
        return point;
    }

    static IndexedPoint[] of(double[][] data) {
        IndexedPoint[] points = new IndexedPoint[data.length];
        for (int i = 0; i < data.length; i++) {
            points[i] = new IndexedPoint(i, data[i]);
        }
        return points;
    }
}
