package com.github.trinity.recovery.operator;

import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.util.MatrixOps;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for the randomized sensing operators used by the trials, plus the fourth-order lift
 * used by the tensor initializer. Every random draw comes from the generator passed in, so an
 * operator is reproducible from its seed.
 *
 * @author Sean Phillips
 */
public final class SensingOperators {
    private static final Logger LOG = LoggerFactory.getLogger(SensingOperators.class);

    private SensingOperators() {
    }

    public static LinearOperator create(SensingModel model, int m, SignalShape shape, RandomGenerator rng) {
        switch (model) {
            case GAUSSIAN:
                return gaussian(m, shape, rng);
            case SYMMETRIC_GAUSSIAN:
                return symmetricGaussian(m, shape, rng);
            case RANK_ONE:
                return rankOneGaussian(m, shape, rng);
            case PARTIAL_FOURIER:
                return partialFourier(m, shape, rng);
            default:
                throw new ConfigurationException("Unsupported sensing model " + model);
        }
    }

    /**
     * Dense i.i.d. N(0,1) sensing.
     */
    public static DenseLinearOperator gaussian(int m, SignalShape shape, RandomGenerator rng) {
        requireMeasurements(m);
        int n = shape.size();
        double[][] rows = new double[m][n];
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < n; j++) {
                rows[i][j] = rng.nextGaussian();
            }
        }
        return new DenseLinearOperator(rows, shape);
    }

    /**
     * Each measurement matrix is (G + G^T)/2 with G Gaussian. Needed whenever the signal is
     * constrained symmetric.
     */
    public static DenseLinearOperator symmetricGaussian(int m, SignalShape shape, RandomGenerator rng) {
        requireMeasurements(m);
        shape.requireSquare("Symmetric Gaussian sensing");
        int d = shape.getRows();
        double[][] rows = new double[m][d * d];
        for (int i = 0; i < m; i++) {
            double[][] g = new double[d][d];
            for (int p = 0; p < d; p++) {
                for (int q = 0; q < d; q++) {
                    g[p][q] = rng.nextGaussian();
                }
            }
            for (int p = 0; p < d; p++) {
                for (int q = 0; q < d; q++) {
                    rows[i][p * d + q] = (g[p][q] + g[q][p]) / 2.0;
                }
            }
        }
        return new DenseLinearOperator(rows, shape);
    }

    /**
     * Phase retrieval sensing: each measurement matrix is a a^T with a ~ N(0, I_d), so that
     * {@code <a a^T, x x^T> = (a^T x)^2}.
     */
    public static DenseLinearOperator rankOneGaussian(int m, SignalShape shape, RandomGenerator rng) {
        requireMeasurements(m);
        shape.requireSquare("Rank-one sensing");
        int d = shape.getRows();
        double[][] rows = new double[m][d * d];
        double[] a = new double[d];
        for (int i = 0; i < m; i++) {
            for (int p = 0; p < d; p++) {
                a[p] = rng.nextGaussian();
            }
            for (int p = 0; p < d; p++) {
                for (int q = 0; q < d; q++) {
                    rows[i][p * d + q] = a[p] * a[q];
                }
            }
        }
        return new DenseLinearOperator(rows, shape);
    }

    /**
     * m distinct, randomly chosen rows of the n x n discrete Hartley matrix
     * H[k][j] = cos(2 pi k j / n) + sin(2 pi k j / n), the real-valued member of the Fourier family
     * (H H^T = n I). Requires m <= n.
     */
    public static DenseLinearOperator partialFourier(int m, SignalShape shape, RandomGenerator rng) {
        requireMeasurements(m);
        int n = shape.size();
        if (m > n) {
            throw new ConfigurationException(String.format(
                "Partial Fourier sensing selects distinct frequencies: m=%d exceeds n=%d", m, n));
        }
        int[] frequencies = new RandomDataGenerator(rng).nextPermutation(n, m);
        double[][] rows = new double[m][n];
        for (int i = 0; i < m; i++) {
            long k = frequencies[i];
            for (int j = 0; j < n; j++) {
                // reduce k*j mod n first to keep the angle accurate
                double angle = 2.0 * FastMath.PI * ((k * j) % n) / n;
                rows[i][j] = FastMath.cos(angle) + FastMath.sin(angle);
            }
        }
        return new DenseLinearOperator(rows, shape);
    }

    /**
     * Custom sensing from a supplied m x n matrix. The matrix is copied.
     */
    public static DenseLinearOperator fromMatrix(double[][] sensing, SignalShape shape) {
        if (sensing == null || sensing.length == 0) {
            throw new ConfigurationException("Custom sensing matrix must have at least one row");
        }
        double[][] rows = new double[sensing.length][];
        for (int i = 0; i < sensing.length; i++) {
            rows[i] = sensing[i].clone();
        }
        return new DenseLinearOperator(rows, shape);
    }

    /**
     * Lifts a square-signal operator to fourth order, A_i -> A_i (x) A_i. Each measurement
     * matrix is symmetrized first. Dense operators are lifted from their stored rows; any other
     * operator is applied to the d^2 basis matrices to recover its rows.
     */
    public static LiftedTensorOperator lift(LinearOperator operator) {
        SignalShape shape = operator.signalShape();
        shape.requireSquare("Tensor lift");
        int d = shape.getRows();
        int n = d * d;
        int m = operator.measurementCount();
        double[][] rows = new double[m][];
        if (operator instanceof DenseLinearOperator) {
            double[][] source = ((DenseLinearOperator) operator).rowsRef();
            for (int i = 0; i < m; i++) {
                rows[i] = source[i].clone();
            }
        } else {
            LOG.debug("Probing {} basis matrices to lift a {} operator", n, operator.getClass().getSimpleName());
            for (int i = 0; i < m; i++) {
                rows[i] = new double[n];
            }
            for (int p = 0; p < n; p++) {
                RealMatrix basis = MatrixOps.zeros(d, d);
                basis.setEntry(p / d, p % d, 1.0);
                RealVector column = operator.forward(basis);
                for (int i = 0; i < m; i++) {
                    rows[i][p] = column.getEntry(i);
                }
            }
        }
        for (double[] row : rows) {
            symmetrizeInPlace(row, d);
        }
        return new LiftedTensorOperator(rows, d);
    }

    private static void symmetrizeInPlace(double[] a, int d) {
        for (int p = 0; p < d; p++) {
            for (int q = p + 1; q < d; q++) {
                double avg = (a[p * d + q] + a[q * d + p]) / 2.0;
                a[p * d + q] = avg;
                a[q * d + p] = avg;
            }
        }
    }

    private static void requireMeasurements(int m) {
        if (m < 1) {
            throw new ConfigurationException("Measurement count must be positive, got " + m);
        }
    }
}
