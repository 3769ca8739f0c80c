package com.github.trinity.recovery.solver;

import com.github.trinity.recovery.exception.NumericalDivergenceException;

/**
 * A solver iterate stopped being finite. Carries the diagnostics recorded up to the last finite
 * iterate so that a trial can still report its trajectory.
 *
 * @author Sean Phillips
 */
public class SolverDivergenceException extends NumericalDivergenceException {

    private final int iteration;
    private final Diagnostics diagnostics;

    SolverDivergenceException(String message, int iteration, Diagnostics diagnostics) {
        super(message);
        this.iteration = iteration;
        this.diagnostics = diagnostics;
    }

    SolverDivergenceException(String message, int iteration, Diagnostics diagnostics, Throwable cause) {
        super(message, cause);
        this.iteration = iteration;
        this.diagnostics = diagnostics;
    }

    /** Iteration whose update produced a NaN or infinite entry. */
    public int getIteration() {
        return iteration;
    }

    /** Errors and losses of the iterations completed before the failure. */
    public Diagnostics getDiagnostics() {
        return diagnostics;
    }
}
