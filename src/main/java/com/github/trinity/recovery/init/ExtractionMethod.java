package com.github.trinity.recovery.init;

import com.github.trinity.recovery.projection.SymmetricRankProjection;
import com.github.trinity.recovery.projection.TuckerProjection;
import com.github.trinity.recovery.util.MatrixOps;
import com.github.trinity.recovery.util.Tensors;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.util.FastMath;

/**
 * Ways of reading a d x d matrix X back out of a tensor close to X (x) X. All of them use the
 * fact that the matricization of X (x) X is the rank-one matrix vec(X) vec(X)^T.
 *
 * @author Sean Phillips
 */
public enum ExtractionMethod {
    /**
     * Dominant eigenpair of the symmetrized matricization, reshaped and scaled by sqrt(|lambda|).
     */
    EIG {
        @Override
        public RealMatrix extract(RealMatrix tensor, int rank) {
            int d = Tensors.sideLength(tensor);
            SymmetricRankProjection.EigenPair pair =
                SymmetricRankProjection.dominantEigenPair(MatrixOps.symmetrize(tensor));
            return MatrixOps.reshape(pair.getVector().toArray(), d, d)
                .scalarMultiply(FastMath.sqrt(Math.abs(pair.getValue())));
        }
    },
    /**
     * Leading singular pair, left and right vectors sign-aligned and averaged.
     */
    SVD {
        @Override
        public RealMatrix extract(RealMatrix tensor, int rank) {
            int d = Tensors.sideLength(tensor);
            SingularValueDecomposition svd = new SingularValueDecomposition(tensor);
            RealVector left = svd.getU().getColumnVector(0);
            RealVector right = svd.getV().getColumnVector(0);
            if (left.dotProduct(right) < 0) {
                right = right.mapMultiply(-1.0);
            }
            RealVector mean = left.add(right);
            double norm = mean.getNorm();
            if (norm > 0) {
                mean = mean.mapDivide(norm);
            }
            return MatrixOps.reshape(mean.toArray(), d, d)
                .scalarMultiply(FastMath.sqrt(svd.getSingularValues()[0]));
        }
    },
    /**
     * Tucker truncation to multirank (r, r, r, r) first, then {@link #EIG}.
     */
    HOSVD {
        @Override
        public RealMatrix extract(RealMatrix tensor, int rank) {
            return EIG.extract(new TuckerProjection(rank).project(tensor), rank);
        }
    };

    public abstract RealMatrix extract(RealMatrix tensor, int rank);
}
