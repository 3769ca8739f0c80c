package com.github.trinity.recovery.solver;

import java.util.Arrays;

/**
 * Per-iteration relative error and loss of one solver run. Index 0 holds the values of the
 * starting point. Errors are NaN when the run had no ground truth.
 *
 * @author Sean Phillips
 */
public final class Diagnostics {

    private static final Diagnostics EMPTY = new Diagnostics(new double[0], new double[0]);

    private final double[] errors;
    private final double[] losses;

    public Diagnostics(double[] errors, double[] losses) {
        if (errors.length != losses.length) {
            throw new IllegalArgumentException(String.format(
                "Error and loss trajectories differ in length: %d vs %d", errors.length, losses.length));
        }
        this.errors = errors.clone();
        this.losses = losses.clone();
    }

    /** Diagnostics of a run that failed before its first iteration. */
    public static Diagnostics empty() {
        return EMPTY;
    }

    public int length() {
        return errors.length;
    }

    public boolean isEmpty() {
        return errors.length == 0;
    }

    public double getError(int iteration) {
        return errors[iteration];
    }

    public double getLoss(int iteration) {
        return losses[iteration];
    }

    public double[] getErrors() {
        return errors.clone();
    }

    public double[] getLosses() {
        return losses.clone();
    }

    public double initialError() {
        return isEmpty() ? Double.NaN : errors[0];
    }

    public double finalError() {
        return isEmpty() ? Double.NaN : errors[errors.length - 1];
    }

    public double finalLoss() {
        return isEmpty() ? Double.NaN : losses[losses.length - 1];
    }

    @Override
    public String toString() {
        return "Diagnostics{length=" + length()
            + ", initialError=" + initialError()
            + ", finalError=" + finalError()
            + ", finalLoss=" + finalLoss() + '}';
    }

    /**
     * Fixed-length recorder filled in by a running solver.
     */
    static final class Recorder {
        private final double[] errors;
        private final double[] losses;
        private int recorded;

        Recorder(int length) {
            errors = new double[length];
            losses = new double[length];
            Arrays.fill(errors, Double.NaN);
            Arrays.fill(losses, Double.NaN);
        }

        void record(int iteration, double error, double loss) {
            errors[iteration] = error;
            losses[iteration] = loss;
            recorded = Math.max(recorded, iteration + 1);
        }

        /** Repeats the last recorded values up to the end of the trajectory. */
        void padFromLast() {
            if (recorded == 0) {
                return;
            }
            Arrays.fill(errors, recorded, errors.length, errors[recorded - 1]);
            Arrays.fill(losses, recorded, losses.length, losses[recorded - 1]);
        }

        double lastError() {
            return recorded == 0 ? Double.NaN : errors[recorded - 1];
        }

        Diagnostics toDiagnostics() {
            return new Diagnostics(errors, losses);
        }

        /** Only the iterations recorded so far. */
        Diagnostics partial() {
            return new Diagnostics(Arrays.copyOf(errors, recorded), Arrays.copyOf(losses, recorded));
        }
    }
}
