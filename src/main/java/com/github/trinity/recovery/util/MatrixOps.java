package com.github.trinity.recovery.util;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Numeric helpers shared by operators, projections, solvers and initializers.
 * <p>
 * Signals of every shape are carried as {@link RealMatrix}. Vectorization is row-major:
 * {@code vec(X)[i * cols + j] = X[i][j]}; every operator and reshape in the engine relies on it.
 * </p>
 *
 * @author Sean Phillips
 */
public final class MatrixOps {

    private MatrixOps() {
    }

    public static double[] vectorize(RealMatrix x) {
        int rows = x.getRowDimension();
        int cols = x.getColumnDimension();
        double[] v = new double[rows * cols];
        if (x instanceof Array2DRowRealMatrix) {
            double[][] data = ((Array2DRowRealMatrix) x).getDataRef();
            for (int i = 0; i < rows; i++) {
                System.arraycopy(data[i], 0, v, i * cols, cols);
            }
            return v;
        }
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                v[i * cols + j] = x.getEntry(i, j);
            }
        }
        return v;
    }

    public static RealMatrix reshape(double[] v, int rows, int cols) {
        double[][] data = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            System.arraycopy(v, i * cols, data[i], 0, cols);
        }
        return new Array2DRowRealMatrix(data, false);
    }

    /**
     * Direct access to the backing rows when the matrix is array based, a copy otherwise.
     * Callers must not write through the returned array.
     */
    public static double[][] rowsOf(RealMatrix x) {
        if (x instanceof Array2DRowRealMatrix) {
            return ((Array2DRowRealMatrix) x).getDataRef();
        }
        return x.getData();
    }

    /**
     * Frobenius inner product {@code <A, B> = sum_ij A_ij B_ij}.
     */
    public static double inner(RealMatrix a, RealMatrix b) {
        double[][] ad = rowsOf(a);
        double[][] bd = rowsOf(b);
        double sum = 0.0;
        for (int i = 0; i < ad.length; i++) {
            for (int j = 0; j < ad[i].length; j++) {
                sum += ad[i][j] * bd[i][j];
            }
        }
        return sum;
    }

    public static RealMatrix symmetrize(RealMatrix x) {
        int n = x.getRowDimension();
        double[][] d = rowsOf(x);
        double[][] s = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                s[i][j] = (d[i][j] + d[j][i]) / 2.0;
            }
        }
        return new Array2DRowRealMatrix(s, false);
    }

    /**
     * ||x - truth||_F / ||truth||_F, or ||x||_F when the reference is zero.
     */
    public static double relativeError(RealMatrix x, RealMatrix truth) {
        double reference = truth.getFrobeniusNorm();
        double diff = x.subtract(truth).getFrobeniusNorm();
        return reference > 0 ? diff / reference : diff;
    }

    public static RealMatrix gaussianMatrix(int rows, int cols, RandomGenerator rng) {
        double[][] data = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                data[i][j] = rng.nextGaussian();
            }
        }
        return new Array2DRowRealMatrix(data, false);
    }

    public static RealVector gaussianVector(int length, RandomGenerator rng) {
        double[] data = new double[length];
        for (int i = 0; i < length; i++) {
            data[i] = rng.nextGaussian();
        }
        return new ArrayRealVector(data, false);
    }

    /**
     * A rows x cols matrix with orthonormal columns (thin Q of a Gaussian matrix).
     */
    public static RealMatrix orthonormalColumns(int rows, int cols, RandomGenerator rng) {
        QRDecomposition qr = new QRDecomposition(gaussianMatrix(rows, cols, rng));
        return qr.getQ().getSubMatrix(0, rows - 1, 0, cols - 1);
    }

    public static RealMatrix diagonal(double[] values) {
        return MatrixUtils.createRealDiagonalMatrix(values);
    }

    /**
     * Number of singular values strictly greater than {@code tolerance}.
     */
    public static int numericalRank(RealMatrix x, double tolerance) {
        double[] sv = new SingularValueDecomposition(x).getSingularValues();
        int rank = 0;
        for (double s : sv) {
            if (s > tolerance) {
                rank++;
            }
        }
        return rank;
    }

    /**
     * Number of entries whose magnitude is strictly greater than {@code tolerance}.
     */
    public static int countAbove(RealMatrix x, double tolerance) {
        int count = 0;
        for (double[] row : rowsOf(x)) {
            for (double v : row) {
                if (Math.abs(v) > tolerance) {
                    count++;
                }
            }
        }
        return count;
    }

    public static boolean hasNaNsOrInfs(RealMatrix x) {
        for (double[] row : rowsOf(x)) {
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Sign with a guard for vanishing predictions: z/|z| when |z| exceeds epsilon, +1 otherwise.
     * A vanishing prediction is placed on the non-negative branch so that an iteration started
     * from zero still receives a descent direction.
     */
    public static double guardedSign(double z, double epsilon) {
        double abs = Math.abs(z);
        return abs > epsilon ? z / abs : 1.0;
    }

    public static RealMatrix zeros(int rows, int cols) {
        return new Array2DRowRealMatrix(rows, cols);
    }
}
