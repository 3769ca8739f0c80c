package com.github.trinity.recovery.projection;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;
import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.util.MatrixOps;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Nearest symmetric rank-r matrix: symmetrize as (X + X^T)/2, eigendecompose, keep the r
 * eigenpairs of largest magnitude and rebuild. The output is symmetrized once more to cancel
 * the rounding asymmetry of the reconstruction.
 *
 * @author Sean Phillips
 */
public class SymmetricRankProjection implements Projection {

    private final int rank;

    public SymmetricRankProjection(int rank) {
        if (rank < 1) {
            throw new ConfigurationException("Symmetric rank projection needs rank >= 1, got " + rank);
        }
        this.rank = rank;
    }

    @Override
    public RealMatrix project(RealMatrix x) {
        if (!x.isSquare()) {
            throw new ConfigurationException(String.format(
                "Symmetric rank projection needs a square matrix, got %dx%d",
                x.getRowDimension(), x.getColumnDimension()));
        }
        int n = x.getRowDimension();
        if (rank >= n) {
            return x.copy();
        }
        EigenDecomposition eig = new EigenDecomposition(MatrixOps.symmetrize(x));
        double[] values = eig.getRealEigenvalues();
        Integer[] order = byDescendingMagnitude(values);

        double[][] out = new double[n][n];
        for (int k = 0; k < rank; k++) {
            int idx = order[k];
            double lambda = values[idx];
            double[] v = eig.getEigenvector(idx).toArray();
            for (int i = 0; i < n; i++) {
                double lv = lambda * v[i];
                for (int j = 0; j < n; j++) {
                    out[i][j] += lv * v[j];
                }
            }
        }
        return MatrixOps.symmetrize(new Array2DRowRealMatrix(out, false));
    }

    public int getRank() {
        return rank;
    }

    static Integer[] byDescendingMagnitude(double[] values) {
        Integer[] order = IntStream.range(0, values.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> -Math.abs(values[i])));
        return order;
    }

    /**
     * Leading eigenvector (by magnitude of the eigenvalue) and its eigenvalue, for callers that
     * only need the dominant pair of a symmetric matrix.
     */
    public static EigenPair dominantEigenPair(RealMatrix symmetric) {
        EigenDecomposition eig = new EigenDecomposition(symmetric);
        double[] values = eig.getRealEigenvalues();
        int idx = byDescendingMagnitude(values)[0];
        return new EigenPair(values[idx], eig.getEigenvector(idx));
    }

    /**
     * An eigenvalue with its unit eigenvector.
     */
    public static final class EigenPair {
        private final double value;
        private final RealVector vector;

        EigenPair(double value, RealVector vector) {
            this.value = value;
            this.vector = vector;
        }

        public double getValue() {
            return value;
        }

        public RealVector getVector() {
            return vector;
        }
    }
}
