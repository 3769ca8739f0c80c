package com.github.trinity.recovery.projection;

import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.util.MatrixOps;
import com.github.trinity.recovery.util.Tensors;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Multilinear (Tucker / truncated HOSVD) rank truncation of a d x d x d x d tensor to multirank
 * (r, r, r, r). For every mode k the leading r left singular vectors U_k of the mode-k unfolding
 * are taken from the eigendecomposition of its d x d Gram matrix, and the tensor is multiplied
 * along each mode by the projector U_k U_k^T:
 * <pre>
 *   T' = T x_1 P_1 x_2 P_2 x_3 P_3 x_4 P_4
 * </pre>
 * Tensors are passed as their d^2 x d^2 mode-(1,2) matricization (see {@link Tensors}).
 *
 * @author Sean Phillips
 */
public class TuckerProjection implements Projection {

    private static final int ORDER = 4;

    private final int rank;

    public TuckerProjection(int rank) {
        if (rank < 1) {
            throw new ConfigurationException("Tucker projection needs rank >= 1, got " + rank);
        }
        this.rank = rank;
    }

    @Override
    public RealMatrix project(RealMatrix matricization) {
        int d = Tensors.sideLength(matricization);
        if (rank >= d) {
            return matricization.copy();
        }
        double[] t = MatrixOps.vectorize(matricization);
        double[][][] projectors = new double[ORDER][][];
        // HOSVD: all factors come from the input tensor, then the projectors are applied together
        for (int mode = 0; mode < ORDER; mode++) {
            projectors[mode] = leadingProjector(modeGram(t, d, mode), rank);
        }
        for (int mode = 0; mode < ORDER; mode++) {
            t = modeProduct(t, d, mode, projectors[mode]);
        }
        return MatrixOps.reshape(t, d * d, d * d);
    }

    public int getRank() {
        return rank;
    }

    private static int stride(int d, int mode) {
        int s = 1;
        for (int k = mode + 1; k < ORDER; k++) {
            s *= d;
        }
        return s;
    }

    /**
     * Gram matrix of the mode-k unfolding: G[a][b] = sum over the other three indices of
     * T[..a..] T[..b..].
     */
    static double[][] modeGram(double[] t, int d, int mode) {
        int s = stride(d, mode);
        double[][] g = new double[d][d];
        double[] fiber = new double[d];
        for (int base = 0; base < t.length; base++) {
            if ((base / s) % d != 0) {
                continue;
            }
            for (int c = 0; c < d; c++) {
                fiber[c] = t[base + c * s];
            }
            for (int a = 0; a < d; a++) {
                double fa = fiber[a];
                if (fa == 0.0) {
                    continue;
                }
                for (int b = 0; b < d; b++) {
                    g[a][b] += fa * fiber[b];
                }
            }
        }
        return g;
    }

    /**
     * Mode-k product with a d x d matrix p: every mode-k fiber f is replaced by p f.
     */
    static double[] modeProduct(double[] t, int d, int mode, double[][] p) {
        int s = stride(d, mode);
        double[] out = new double[t.length];
        double[] fiber = new double[d];
        for (int base = 0; base < t.length; base++) {
            if ((base / s) % d != 0) {
                continue;
            }
            for (int c = 0; c < d; c++) {
                fiber[c] = t[base + c * s];
            }
            for (int a = 0; a < d; a++) {
                double sum = 0.0;
                double[] pa = p[a];
                for (int c = 0; c < d; c++) {
                    sum += pa[c] * fiber[c];
                }
                out[base + a * s] = sum;
            }
        }
        return out;
    }

    private static double[][] leadingProjector(double[][] gram, int rank) {
        int d = gram.length;
        EigenDecomposition eig = new EigenDecomposition(MatrixOps.symmetrize(new Array2DRowRealMatrix(gram, false)));
        double[] values = eig.getRealEigenvalues();
        Integer[] order = SymmetricRankProjection.byDescendingMagnitude(values);
        double[][] p = new double[d][d];
        for (int k = 0; k < rank; k++) {
            double[] u = eig.getEigenvector(order[k]).toArray();
            for (int a = 0; a < d; a++) {
                for (int b = 0; b < d; b++) {
                    p[a][b] += u[a] * u[b];
                }
            }
        }
        return p;
    }
}
