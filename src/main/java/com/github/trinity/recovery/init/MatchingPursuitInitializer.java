package com.github.trinity.recovery.init;

import com.github.trinity.recovery.projection.SparsityProjection;
import com.github.trinity.recovery.solver.RecoveryProblem;
import com.github.trinity.recovery.util.MatrixOps;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * One greedy selection step: keep the s entries of {@code adjoint(y) / sqrt(m)} that correlate
 * most with the measurements and scale them by {@code scale}.
 *
 * @author Sean Phillips
 */
public class MatchingPursuitInitializer implements Initializer {

    private final SparsityProjection projection;
    private final double scale;

    public MatchingPursuitInitializer(InitializerConfig config) {
        this.projection = new SparsityProjection(config.requireSparsity("Matching pursuit"));
        this.scale = config.getScale();
    }

    @Override
    public InitResult initialize(RecoveryProblem problem) {
        RealMatrix correlations = problem.getOperator().adjoint(problem.getMeasurements())
            .scalarMultiply(1.0 / problem.sqrtMeasurementCount());
        RealMatrix estimate = projection.project(correlations).scalarMultiply(scale);
        InitHistory.Builder history = InitHistory.builder("MatchingPursuit");
        if (problem.hasGroundTruth()) {
            history.finalError(MatrixOps.relativeError(estimate, problem.getGroundTruth()));
        }
        return new InitResult(estimate, history.build());
    }
}
