package com.bmsedge.forecast.ml;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * L2-regularized least squares on standardized features with an unpenalized intercept.
 */
public final class RidgeRegression {

    public static final String ALGORITHM_TAG = "ridge-standardized";

    private RidgeRegression() {}

    public static ModelParameters fit(double[][] x, double[] y, double alpha) {
        if (x.length == 0 || x.length != y.length) {
            throw new IllegalArgumentException("Feature rows and targets must be non-empty and of equal length");
        }
        if (alpha < 0) {
            throw new IllegalArgumentException("Ridge alpha must be >= 0, got " + alpha);
        }
        int n = x.length;
        int p = x[0].length;

        double[] means = new double[p];
        double[] scales = new double[p];
        for (int j = 0; j < p; j++) {
            DescriptiveStatistics stats = new DescriptiveStatistics();
            for (double[] row : x) {
                stats.addValue(row[j]);
            }
            means[j] = stats.getMean();
            // population std; constant columns keep scale 1
            double std = Math.sqrt(stats.getPopulationVariance());
            scales[j] = std > 1e-12 ? std : 1.0;
        }

        double yMean = new DescriptiveStatistics(y).getMean();

        double[][] z = new double[n][p];
        double[] yc = new double[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < p; j++) {
                z[i][j] = (x[i][j] - means[j]) / scales[j];
            }
            yc[i] = y[i] - yMean;
        }

        RealMatrix zm = new Array2DRowRealMatrix(z, false);
        RealMatrix zt = zm.transpose();
        RealMatrix gram = zt.multiply(zm);
        for (int j = 0; j < p; j++) {
            gram.addToEntry(j, j, alpha);
        }
        RealVector rhs = zt.operate(new ArrayRealVector(yc, false));

        RealVector beta = solver(gram).solve(rhs);

        ModelParameters params = new ModelParameters();
        params.setMeans(means);
        params.setScales(scales);
        params.setCoefficients(beta.toArray());
        params.setIntercept(yMean);
        params.setAlpha(alpha);
        return params;
    }

    private static DecompositionSolver solver(RealMatrix gram) {
        try {
            return new CholeskyDecomposition(gram).getSolver();
        } catch (NonPositiveDefiniteMatrixException e) {
            // alpha = 0 with collinear columns
            return new SingularValueDecomposition(gram).getSolver();
        }
    }
}
