package com.github.trinity.recovery.projection;

import com.github.trinity.recovery.exception.ConfigurationException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Truncated SVD: keeps the r largest singular values. By Eckart-Young this is the nearest
 * rank-r matrix in Frobenius norm, and the residual equals the root sum of squares of the
 * discarded singular values.
 *
 * @author Sean Phillips
 */
public class RankProjection implements Projection {

    private final int rank;

    public RankProjection(int rank) {
        if (rank < 1) {
            throw new ConfigurationException("Rank projection needs rank >= 1, got " + rank);
        }
        this.rank = rank;
    }

    @Override
    public RealMatrix project(RealMatrix x) {
        int rows = x.getRowDimension();
        int cols = x.getColumnDimension();
        if (rank >= Math.min(rows, cols)) {
            return x.copy();
        }
        SingularValueDecomposition svd = new SingularValueDecomposition(x);
        RealMatrix u = svd.getU().getSubMatrix(0, rows - 1, 0, rank - 1);
        RealMatrix s = svd.getS().getSubMatrix(0, rank - 1, 0, rank - 1);
        RealMatrix v = svd.getV().getSubMatrix(0, cols - 1, 0, rank - 1);
        return u.multiply(s).multiply(v.transpose());
    }

    public int getRank() {
        return rank;
    }
}
