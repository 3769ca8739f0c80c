package com.github.trinity.recovery.trial;

import com.github.trinity.recovery.exception.RecoveryException;
import com.github.trinity.recovery.init.InitResult;
import com.github.trinity.recovery.operator.LinearOperator;
import com.github.trinity.recovery.operator.SensingOperators;
import com.github.trinity.recovery.solver.Diagnostics;
import com.github.trinity.recovery.solver.RecoveryProblem;
import com.github.trinity.recovery.solver.SolverDivergenceException;
import com.github.trinity.recovery.solver.SolverResult;
import com.github.trinity.recovery.util.MatrixOps;
import com.github.trinity.recovery.util.Rectification;
import com.github.trinity.recovery.util.SignRectifier;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one trial end to end: ground truth, a fresh operator, measurements
 * {@code y = f(forward(x*) / sqrt(m))}, initialization, solve and scoring. Everything random is
 * drawn from the generator passed in, so a trial is reproducible from its seed. Any
 * {@link RecoveryException}, and any numerical failure raised inside commons-math (an eigen or
 * singular value decomposition that cannot converge on a degenerate iterate), is caught and turned
 * into a failed {@link TrialResult}.
 *
 * @author Sean Phillips
 */
public class TrialRunner {
    private static final Logger LOG = LoggerFactory.getLogger(TrialRunner.class);

    /** Singular values and entries at or below this count as zero in the recovered structure. */
    public static final double STRUCTURE_TOLERANCE = 1e-6;

    public TrialResult run(TrialConfig config, RandomGenerator rng) {
        Diagnostics diagnostics = Diagnostics.empty();
        try {
            RealMatrix truth = config.getGroundTruth() != null
                ? config.getGroundTruth().copy()
                : GroundTruth.create(config.getSignalModel(), config.getShape(),
                    config.structuralBudget(), config.getConditionNumber(), rng);
            LinearOperator operator = SensingOperators.create(
                config.getSensingModel(), config.getMeasurements(), config.getShape(), rng);
            RealVector y = config.getNonlinearity().apply(
                operator.forward(truth).mapDivide(FastMath.sqrt(config.getMeasurements())));
            RecoveryProblem problem = new RecoveryProblem(y, operator, truth, rng);

            InitResult init = config.getInitializer().initialize(problem);
            SolverResult solved = config.getSolver().solve(init.getEstimate(), problem);
            diagnostics = solved.getDiagnostics();

            RealMatrix estimate = solved.getEstimate();
            double error;
            if (config.getNonlinearity().isSignInvariant()) {
                Rectification rectification = SignRectifier.rectify(estimate, truth);
                error = rectification.getError();
                estimate = rectification.getAligned();
            } else {
                error = MatrixOps.relativeError(estimate, truth);
            }
            int recoveredRank = config.getShape().isVector()
                ? 0 : MatrixOps.numericalRank(estimate, STRUCTURE_TOLERANCE);
            int recoveredSparsity = MatrixOps.countAbove(estimate, STRUCTURE_TOLERANCE);
            boolean success = error < config.getSuccessThreshold() && !solved.isDiverged();

            LOG.info("Trial finished: error {}, rank {}, nnz {}, success {}{}",
                String.format("%.4e", error), recoveredRank, recoveredSparsity, success,
                solved.isDiverged() ? " (diverged)" : "");
            return new TrialResult(diagnostics, estimate, error, recoveredRank, recoveredSparsity,
                success, solved.isDiverged(), null);
        } catch (SolverDivergenceException ex) {
            LOG.warn("Trial failed: {}", ex.getMessage());
            return TrialResult.failed(ex.getDiagnostics(), ex.getMessage());
        } catch (RecoveryException ex) {
            LOG.warn("Trial failed: {}", ex.getMessage());
            return TrialResult.failed(diagnostics, ex.getMessage());
        } catch (MathIllegalStateException | MathArithmeticException ex) {
            LOG.warn("Trial failed inside a decomposition: {}", ex.getMessage());
            return TrialResult.failed(diagnostics, ex.getMessage());
        }
    }
}
