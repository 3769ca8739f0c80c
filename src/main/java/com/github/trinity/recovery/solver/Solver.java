package com.github.trinity.recovery.solver;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * An iterative recovery algorithm. Implementations are immutable and may be shared between
 * threads; all per-run state lives inside {@link #solve}.
 *
 * @author Sean Phillips
 */
public interface Solver {

    /**
     * Runs the configured number of iterations from {@code initial}. The argument is never
     * modified.
     *
     * @param initial signal-shaped starting point
     * @param problem measurements, operator and optional ground truth for diagnostics
     * @return the final estimate with per-iteration error and loss
     */
    SolverResult solve(RealMatrix initial, RecoveryProblem problem);
}
