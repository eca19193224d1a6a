package com.energy.anomaly.engine.reconstruction;

import com.energy.anomaly.exception.AlgorithmException;
import com.energy.anomaly.model.AlgorithmType;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.correlation.Covariance;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Closed-form linear reconstruction: project centered rows onto the top principal
 * components of the sample covariance and measure what the projection loses.
 */
final class PrincipalComponentProjector {

    private PrincipalComponentProjector() {}

    /**
     * @param centered   rows with zero column means (standardized data qualifies)
     * @param components number of principal components kept, less than the column count
     * @return per-row mean squared reconstruction error
     */
    static double[] reconstructionErrors(double[][] centered, int components) {
        int d = centered[0].length;
        double[][] basis = topComponents(centered, components);

        double[] errors = new double[centered.length];
        double[] coordinates = new double[components];
        for (int i = 0; i < centered.length; i++) {
            double[] x = centered[i];
            for (int c = 0; c < components; c++) {
                double dot = 0.0;
                for (int j = 0; j < d; j++) {
                    dot += basis[c][j] * x[j];
                }
                coordinates[c] = dot;
            }
            double sum = 0.0;
            for (int j = 0; j < d; j++) {
                double reconstructed = 0.0;
                for (int c = 0; c < components; c++) {
                    reconstructed += coordinates[c] * basis[c][j];
                }
                double diff = x[j] - reconstructed;
                sum += diff * diff;
            }
            errors[i] = sum / d;
        }
        return errors;
    }

    private static double[][] topComponents(double[][] centered, int components) {
        EigenDecomposition eigen;
        try {
            RealMatrix covariance = new Covariance(centered).getCovarianceMatrix();
            eigen = new EigenDecomposition(covariance);
        } catch (MathIllegalArgumentException | MathArithmeticException | MaxCountExceededException e) {
            throw new AlgorithmException(AlgorithmType.RECONSTRUCTION,
                    "eigen decomposition of the covariance matrix failed", e);
        }

        double[] eigenvalues = eigen.getRealEigenvalues();
        Integer[] order = new Integer[eigenvalues.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> eigenvalues[i]).reversed());

        double[][] basis = new double[components][];
        for (int c = 0; c < components; c++) {
            RealVector vector = eigen.getEigenvector(order[c]);
            basis[c] = vector.toArray();
        }
        return basis;
    }
}
