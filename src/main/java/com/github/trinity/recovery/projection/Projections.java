package com.github.trinity.recovery.projection;

import com.github.trinity.recovery.util.MatrixOps;

/**
 * Small combinators over {@link Projection}.
 *
 * @author Sean Phillips
 */
public final class Projections {

    private Projections() {
    }

    /** No constraint. */
    public static Projection identity() {
        return x -> x.copy();
    }

    /**
     * Symmetrize, project, symmetrize. Used for tensors that must keep the
     * T[i][j][k][l] = T[k][l][i][j] structure of X (x) X.
     */
    public static Projection symmetrized(Projection inner) {
        return x -> MatrixOps.symmetrize(inner.project(MatrixOps.symmetrize(x)));
    }

    /** Symmetric tensor projection used by the lifted solvers: symmetrized Tucker truncation. */
    public static Projection symmetricTensor(int rank) {
        return symmetrized(new TuckerProjection(rank));
    }
}
