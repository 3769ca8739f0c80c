package com.github.trinity.recovery.solver;

import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.operator.LinearOperator;
import com.github.trinity.recovery.util.MatrixOps;
import com.github.trinity.recovery.util.SignRectifier;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common driver for the solvers: validates the starting point, copies it, runs the algorithm
 * and logs the outcome. Subclasses implement {@link #iterate} and report errors through
 * {@link #error}, which picks plain or sign-rectified relative error.
 *
 * @author Sean Phillips
 */
public abstract class AbstractSolver implements Solver {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractSolver.class);

    protected final SolverConfig config;

    protected AbstractSolver(SolverConfig config) {
        if (config == null) {
            throw new ConfigurationException(getClass().getSimpleName() + " needs a configuration");
        }
        this.config = config;
    }

    @Override
    public final SolverResult solve(RealMatrix initial, RecoveryProblem problem) {
        problem.signalShape().check(initial);
        long start = System.nanoTime();
        LOG.debug("{} starting: {} iterations, m = {}, signal {}",
            name(), config.getIterations(), problem.measurementCount(), problem.signalShape());
        SolverResult result = iterate(initial.copy(), problem);
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} finished in {} ms: {} iterations, final error {}, final loss {}{}",
                name(), String.format("%.1f", (System.nanoTime() - start) / 1e6),
                result.getCompletedIterations(),
                String.format("%.4e", result.getDiagnostics().finalError()),
                String.format("%.4e", result.getDiagnostics().finalLoss()),
                result.isDiverged() ? " (diverged)" : "");
        }
        return result;
    }

    /**
     * Runs the algorithm on a private copy of the starting point.
     */
    protected abstract SolverResult iterate(RealMatrix x, RecoveryProblem problem);

    /**
     * Whether the reported error is taken up to a global sign. True for the magnitude-type
     * solvers.
     */
    protected boolean rectifiesSign() {
        return false;
    }

    public SolverConfig getConfig() {
        return config;
    }

    public String name() {
        return getClass().getSimpleName();
    }

    protected final double error(RealMatrix x, RecoveryProblem problem) {
        if (!problem.hasGroundTruth()) {
            return Double.NaN;
        }
        return rectifiesSign()
            ? SignRectifier.error(x, problem.getGroundTruth())
            : MatrixOps.relativeError(x, problem.getGroundTruth());
    }

    /**
     * Fails the run with {@link SolverDivergenceException} when an update produced a NaN or
     * infinite entry, before it reaches a projection or decomposition.
     */
    protected final RealMatrix requireFinite(RealMatrix update, int iteration, Diagnostics.Recorder recorder) {
        if (MatrixOps.hasNaNsOrInfs(update)) {
            throw new SolverDivergenceException(String.format(
                "%s produced a non-finite iterate at iteration %d", name(), iteration), iteration, recorder.partial());
        }
        return update;
    }

    /**
     * Normalized prediction {@code z = forward(x) / sqrt(m)}.
     */
    protected static RealVector predict(LinearOperator operator, RealMatrix x, double sqrtM) {
        return operator.forward(x).mapDivide(sqrtM);
    }

    /**
     * {@code 0.5 * ||z - y||^2}.
     */
    protected static double halfSquaredResidual(RealVector z, RealVector y) {
        double d = z.getDistance(y);
        return 0.5 * d * d;
    }

    protected static void requireSquare(RecoveryProblem problem, String solver) {
        problem.signalShape().requireSquare(solver);
    }
}
