package com.github.trinity.recovery.trial;

import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.operator.SignalShape;
import com.github.trinity.recovery.util.MatrixOps;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Random unit-norm test signals. The nonzero magnitudes (sparse vectors) or singular values
 * (matrices) are spaced evenly from 1 down to 1/kappa before normalization, so kappa is the
 * condition number of the signal on its support.
 *
 * @author Sean Phillips
 */
public final class GroundTruth {

    private GroundTruth() {
    }

    public static RealMatrix create(SignalModel model, SignalShape shape, int budget,
                                    double conditionNumber, RandomGenerator rng) {
        switch (model) {
            case SPARSE_VECTOR:
                if (!shape.isVector()) {
                    throw new ConfigurationException("Sparse ground truth needs a vector shape, got " + shape);
                }
                return sparseVector(shape.getRows(), budget, conditionNumber, rng);
            case LOW_RANK:
                return lowRank(shape.getRows(), shape.getCols(), budget, conditionNumber, rng);
            case SYMMETRIC_PSD:
                shape.requireSquare("PSD ground truth");
                return psd(shape.getRows(), budget, conditionNumber, rng);
            default:
                throw new ConfigurationException("Unknown signal model " + model);
        }
    }

    /**
     * s nonzeros at uniformly random positions with random signs.
     */
    public static RealMatrix sparseVector(int d, int sparsity, double conditionNumber, RandomGenerator rng) {
        if (sparsity < 1 || sparsity > d) {
            throw new ConfigurationException(String.format("Sparsity %d outside [1, %d]", sparsity, d));
        }
        double[] magnitudes = spread(sparsity, conditionNumber);
        int[] support = new RandomDataGenerator(rng).nextPermutation(d, sparsity);
        double[] x = new double[d];
        for (int k = 0; k < sparsity; k++) {
            x[support[k]] = rng.nextBoolean() ? magnitudes[k] : -magnitudes[k];
        }
        return normalize(MatrixOps.reshape(x, d, 1));
    }

    /**
     * U diag(sigma) V^T with Haar-like orthonormal factors.
     */
    public static RealMatrix lowRank(int d1, int d2, int rank, double conditionNumber, RandomGenerator rng) {
        requireRank(rank, Math.min(d1, d2));
        RealMatrix u = MatrixOps.orthonormalColumns(d1, rank, rng);
        RealMatrix v = MatrixOps.orthonormalColumns(d2, rank, rng);
        RealMatrix sigma = MatrixOps.diagonal(spread(rank, conditionNumber));
        return normalize(u.multiply(sigma).multiply(v.transpose()));
    }

    /**
     * U diag(sigma) U^T, symmetric positive semidefinite.
     */
    public static RealMatrix psd(int d, int rank, double conditionNumber, RandomGenerator rng) {
        requireRank(rank, d);
        RealMatrix u = MatrixOps.orthonormalColumns(d, rank, rng);
        RealMatrix sigma = MatrixOps.diagonal(spread(rank, conditionNumber));
        return normalize(MatrixOps.symmetrize(u.multiply(sigma).multiply(u.transpose())));
    }

    static double[] spread(int count, double conditionNumber) {
        if (!(conditionNumber >= 1)) {
            throw new ConfigurationException("Condition number must be >= 1, got " + conditionNumber);
        }
        double[] values = new double[count];
        double last = 1.0 / conditionNumber;
        for (int k = 0; k < count; k++) {
            values[k] = count == 1 ? 1.0 : 1.0 + (last - 1.0) * k / (count - 1);
        }
        return values;
    }

    private static void requireRank(int rank, int max) {
        if (rank < 1 || rank > max) {
            throw new ConfigurationException(String.format("Rank %d outside [1, %d]", rank, max));
        }
    }

    private static RealMatrix normalize(RealMatrix x) {
        return x.scalarMultiply(1.0 / x.getFrobeniusNorm());
    }
}
