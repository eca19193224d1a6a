package com.energy.anomaly.engine.clustering;

import com.energy.anomaly.engine.AlgorithmAdapter;
import com.energy.anomaly.engine.FeatureMatrix;
import com.energy.anomaly.exception.AlgorithmException;
import com.energy.anomaly.model.AlgorithmType;
import com.energy.anomaly.model.RawScores;
import com.energy.anomaly.model.ScoreOrientation;
import com.energy.anomaly.model.params.DensityParams;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * DBSCAN over the standardized matrix. Rows left outside every cluster are noise and score
 * 1.0, clustered rows score 0.0.
 *
 * Scores are binary, so the percentile threshold lands on 0.0 or 1.0: when noise exceeds
 * the share above the percentile, the cutoff is 1.0 and nothing is strictly above it.
 */
@Component
public class DensityDetector implements AlgorithmAdapter<DensityParams> {

    private static final Logger log = LoggerFactory.getLogger(DensityDetector.class);

    static final double NOISE_SCORE = 1.0;
    static final double CLUSTERED_SCORE = 0.0;

    @Override
    public AlgorithmType getAlgorithm() {
        return AlgorithmType.DENSITY;
    }

    @Override
    public RawScores score(FeatureMatrix matrix, DensityParams params, long seed) {
        int n = matrix.rows();
        if (n == 0 || matrix.columns() == 0) {
            throw new AlgorithmException(getAlgorithm(),
                    "needs at least 1 row and 1 feature, got " + n + "x" + matrix.columns());
        }

        double[][] data = matrix.standardized().toArray();
        List<IndexedPoint> points = Arrays.asList(IndexedPoint.of(data));

        List<Cluster<IndexedPoint>> clusters;
        try {
            // neighbor counts here exclude the point itself
            DBSCANClusterer<IndexedPoint> clusterer =
                    new DBSCANClusterer<>(params.radius(), params.minSamples() - 1);
            clusters = clusterer.cluster(points);
        } catch (MathIllegalArgumentException e) {
            throw new AlgorithmException(getAlgorithm(), "DBSCAN failed: " + e.getMessage(), e);
        }

        double[] raw = new double[n];
        Arrays.fill(raw, NOISE_SCORE);
        List<Integer> clusterSizes = new ArrayList<>();
        for (Cluster<IndexedPoint> cluster : clusters) {
            clusterSizes.add(cluster.getPoints().size());
            for (IndexedPoint p : cluster.getPoints()) {
                raw[p.getIndex()] = CLUSTERED_SCORE;
            }
        }

        int noise = 0;
        for (double v : raw) {
            if (v == NOISE_SCORE) noise++;
        }
        if (clusters.isEmpty()) {
            log.warn("DBSCAN found no clusters (radius {}, minSamples {}); every row is noise",
                    params.radius(), params.minSamples());
        } else {
            log.debug("DBSCAN found {} clusters and {} noise rows", clusters.size(), noise);
        }

        return RawScores.builder()
                .algorithm(getAlgorithm())
                .values(raw)
                .orientation(ScoreOrientation.HIGHER_IS_ANOMALOUS)
                .detail("radius", params.radius())
                .detail("minSamples", params.minSamples())
                .detail("clusterCount", clusters.size())
                .detail("noiseCount", noise)
                .detail("clusterSizes", clusterSizes)
                .build();
    }
}
