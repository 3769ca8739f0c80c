package com.github.trinity.recovery.solver;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Outcome of {@link Solver#solve}.
 *
 * @author Sean Phillips
 */
public final class SolverResult {

    private final RealMatrix estimate;
    private final Diagnostics diagnostics;
    private final int completedIterations;
    private final boolean diverged;

    public SolverResult(RealMatrix estimate, Diagnostics diagnostics, int completedIterations, boolean diverged) {
        this.estimate = estimate;
        this.diagnostics = diagnostics;
        this.completedIterations = completedIterations;
        this.diverged = diverged;
    }

    public RealMatrix getEstimate() {
        return estimate;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    /** Number of trajectory entries produced by actual iterations, including the initial one. */
    public int getCompletedIterations() {
        return completedIterations;
    }

    public boolean isDiverged() {
        return diverged;
    }
}
