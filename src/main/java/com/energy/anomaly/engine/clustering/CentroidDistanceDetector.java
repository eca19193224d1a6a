package com.energy.anomaly.engine.clustering;

import com.energy.anomaly.engine.AlgorithmAdapter;
import com.energy.anomaly.engine.FeatureMatrix;
import com.energy.anomaly.exception.AlgorithmException;
import com.energy.anomaly.model.AlgorithmType;
import com.energy.anomaly.model.RawScores;
import com.energy.anomaly.model.ScoreOrientation;
import com.energy.anomaly.model.params.CentroidDistanceParams;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions the standardized matrix with k-means++ and scores each row by its Euclidean
 * distance to the centroid it belongs to.
 *
 * Clusters holding fewer than {@code minClusterFraction} of the rows are dissolved and their
 * members reassigned to the nearest surviving centroid, so a tight group of outliers cannot
 * claim a centroid of its own. The largest cluster always survives.
 */
@Component
public class CentroidDistanceDetector implements AlgorithmAdapter<CentroidDistanceParams> {

    private static final Logger log = LoggerFactory.getLogger(CentroidDistanceDetector.class);

    private static final double CONVERGENCE_TOLERANCE = 1e-9;

    private final EuclideanDistance distance = new EuclideanDistance();

    @Override
    public AlgorithmType getAlgorithm() {
        return AlgorithmType.CENTROID_DISTANCE;
    }

    @Override
    public RawScores score(FeatureMatrix matrix, CentroidDistanceParams params, long seed) {
        int n = matrix.rows();
        if (n < 2 || matrix.columns() == 0) {
            throw new AlgorithmException(getAlgorithm(),
                    "needs at least 2 rows and 1 feature, got " + n + "x" + matrix.columns());
        }

        int k = Math.min(params.clusters(), n - 1);
        if (k != params.clusters()) {
            log.warn("Cluster count {} reduced to {} for a dataset of {} rows", params.clusters(), k, n);
        }

        double[][] data = matrix.standardized().toArray();
        List<IndexedPoint> points = Arrays.asList(IndexedPoint.of(data));

        List<CentroidCluster<IndexedPoint>> clusters;
        try {
            KMeansPlusPlusClusterer<IndexedPoint> clusterer = new KMeansPlusPlusClusterer<>(
                    k, params.maxIterations(), distance, new Well19937c(seed));
            clusters = clusterer.cluster(points);
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            throw new AlgorithmException(getAlgorithm(), "k-means failed: " + e.getMessage(), e);
        }

        if (!converged(clusters)) {
            throw new AlgorithmException(getAlgorithm(),
                    "k-means did not converge within " + params.maxIterations() + " iterations");
        }

        List<CentroidCluster<IndexedPoint>> surviving = survivingClusters(clusters, params.minClusterFraction(), n);
        int dissolved = clusters.size() - surviving.size();
        if (dissolved > 0) {
            log.debug("Dissolved {} clusters smaller than {} of {} rows",
                    dissolved, params.minClusterFraction(), n);
        }

        double[] raw = new double[n];
        int[] sizes = new int[surviving.size()];
        for (int i = 0; i < n; i++) {
            int nearest = 0;
            double best = Double.POSITIVE_INFINITY;
            for (int c = 0; c < surviving.size(); c++) {
                double dist = distance.compute(data[i], surviving.get(c).getCenter().getPoint());
                if (dist < best) {
                    best = dist;
                    nearest = c;
                }
            }
            if (!Double.isFinite(best)) {
                throw new AlgorithmException(getAlgorithm(), "non-finite centroid distance at row " + i);
            }
            raw[i] = best;
            sizes[nearest]++;
        }

        Map<Integer, Integer> distribution = new LinkedHashMap<>();
        for (int c = 0; c < sizes.length; c++) {
            distribution.put(c, sizes[c]);
        }

        return RawScores.builder()
                .algorithm(getAlgorithm())
                .values(raw)
                .orientation(ScoreOrientation.HIGHER_IS_ANOMALOUS)
                .detail("requestedClusters", params.clusters())
                .detail("effectiveClusters", k)
                .detail("dissolvedClusters", dissolved)
                .detail("clusterDistribution", distribution)
                .detail("minClusterFraction", params.minClusterFraction())
                .build();
    }

    /**
     * The clusterer stops silently at the iteration cap; a converged result has every
     * center equal to the mean of its members.
     */
    private static boolean converged(List<CentroidCluster<IndexedPoint>> clusters) {
        for (CentroidCluster<IndexedPoint> cluster : clusters) {
            List<IndexedPoint> members = cluster.getPoints();
            if (members.isEmpty()) {
                continue;
            }
            double[] center = cluster.getCenter().getPoint();
            for (int j = 0; j < center.length; j++) {
                double mean = 0.0;
                for (IndexedPoint p : members) {
                    mean += p.getPoint()[j];
                }
                mean /= members.size();
                if (Math.abs(mean - center[j]) > CONVERGENCE_TOLERANCE * Math.max(1.0, Math.abs(mean))) {
                    return false;
                }
            }
        }
        return true;
    }

    private static List<CentroidCluster<IndexedPoint>> survivingClusters(
            List<CentroidCluster<IndexedPoint>> clusters, double minFraction, int n) {
        List<CentroidCluster<IndexedPoint>> bySize = new ArrayList<>(clusters);
        bySize.sort(Comparator.comparingInt((CentroidCluster<IndexedPoint> c) -> c.getPoints().size()).reversed());

        double minSize = minFraction * n;
        List<CentroidCluster<IndexedPoint>> surviving = new ArrayList<>();
        surviving.add(bySize.get(0));
        for (int c = 1; c < bySize.size(); c++) {
            CentroidCluster<IndexedPoint> cluster = bySize.get(c);
            if (!cluster.getPoints().isEmpty() && cluster.getPoints().size() >= minSize) {
                surviving.add(cluster);
            }
        }
        return surviving;
    }
}
