package com.github.trinity.recovery.util;

import com.github.trinity.recovery.exception.ConfigurationException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

/**
 * Fourth-order tensors T[i][j][k][l] of size d^4 are carried as their mode-(1,2) matricization,
 * a d^2 x d^2 matrix with {@code M[i*d + j][k*d + l] = T[i][j][k][l]}. Flattening that matrix
 * row-major gives the tensor in (i, j, k, l) order with strides d^3, d^2, d, 1.
 *
 * @author Sean Phillips
 */
public final class Tensors {

    private Tensors() {
    }

    /**
     * T = X (x) X for a square d x d matrix X.
     */
    public static RealMatrix lift(RealMatrix x) {
        if (!x.isSquare()) {
            throw new ConfigurationException(String.format(
                "Tensor lift needs a square matrix, got %dx%d", x.getRowDimension(), x.getColumnDimension()));
        }
        double[] v = MatrixOps.vectorize(x);
        int n = v.length;
        double[][] t = new double[n][n];
        for (int p = 0; p < n; p++) {
            double vp = v[p];
            for (int q = 0; q < n; q++) {
                t[p][q] = vp * v[q];
            }
        }
        return new Array2DRowRealMatrix(t, false);
    }

    /**
     * Side length d of a tensor given its d^2 x d^2 matricization.
     */
    public static int sideLength(RealMatrix matricization) {
        int n = matricization.getRowDimension();
        int d = (int) FastMath.round(FastMath.sqrt(n));
        if (d * d != n || !matricization.isSquare()) {
            throw new ConfigurationException(String.format(
                "%dx%d is not the matricization of a d^4 tensor",
                matricization.getRowDimension(), matricization.getColumnDimension()));
        }
        return d;
    }
}
