package com.github.trinity.recovery.trial;

import com.github.trinity.recovery.solver.Diagnostics;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Outcome of one trial. Failed trials carry whatever diagnostics were produced before the
 * failure, a NaN error, no estimate and the failure message.
 *
 * @author Sean Phillips
 */
public final class TrialResult {

    private final Diagnostics diagnostics;
    private final RealMatrix estimate;
    private final double finalError;
    private final int recoveredRank;
    private final int recoveredSparsity;
    private final boolean success;
    private final boolean diverged;
    private final String failure;

    TrialResult(Diagnostics diagnostics, RealMatrix estimate, double finalError, int recoveredRank,
                int recoveredSparsity, boolean success, boolean diverged, String failure) {
        this.diagnostics = diagnostics;
        this.estimate = estimate;
        this.finalError = finalError;
        this.recoveredRank = recoveredRank;
        this.recoveredSparsity = recoveredSparsity;
        this.success = success;
        this.diverged = diverged;
        this.failure = failure;
    }

    static TrialResult failed(Diagnostics diagnostics, String failure) {
        return new TrialResult(diagnostics, null, Double.NaN, 0, 0, false, false, failure);
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    /** @return the final estimate aligned with the ground truth, or {@code null} for a failed trial */
    public RealMatrix getEstimate() {
        return estimate == null ? null : estimate.copy();
    }

    public double getFinalError() {
        return finalError;
    }

    public int getRecoveredRank() {
        return recoveredRank;
    }

    public int getRecoveredSparsity() {
        return recoveredSparsity;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isDiverged() {
        return diverged;
    }

    public boolean isFailed() {
        return failure != null;
    }

    /** @return why the trial failed, or {@code null} */
    public String getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return "TrialResult{finalError=" + finalError
            + ", success=" + success
            + ", diverged=" + diverged
            + (failure != null ? ", failure=" + failure : "") + '}';
    }
}
