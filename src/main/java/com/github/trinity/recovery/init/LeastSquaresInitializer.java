package com.github.trinity.recovery.init;

import com.github.trinity.recovery.projection.SparsityProjection;
import com.github.trinity.recovery.solver.RecoveryProblem;
import com.github.trinity.recovery.util.MatrixOps;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

/**
 * Direction of the back-projection {@code adjoint(y)} rescaled to norm {@code scale * sqrt(s)}
 * and hard-thresholded to s entries. Falls back to the zero vector when there are fewer
 * measurements than unknowns or the back-projection vanishes.
 *
 * @author Sean Phillips
 */
public class LeastSquaresInitializer implements Initializer {

    private final int sparsity;
    private final double scale;

    public LeastSquaresInitializer(InitializerConfig config) {
        this.sparsity = config.requireSparsity("Least squares");
        this.scale = config.getScale();
    }

    @Override
    public InitResult initialize(RecoveryProblem problem) {
        int rows = problem.signalShape().getRows();
        int cols = problem.signalShape().getCols();
        RealMatrix estimate = MatrixOps.zeros(rows, cols);
        if (problem.measurementCount() >= problem.signalShape().size()) {
            RealMatrix backProjection = problem.getOperator().adjoint(problem.getMeasurements());
            double norm = backProjection.getFrobeniusNorm();
            if (norm > 0) {
                estimate = new SparsityProjection(sparsity).project(
                    backProjection.scalarMultiply(scale * FastMath.sqrt(sparsity) / norm));
            }
        }
        InitHistory.Builder history = InitHistory.builder("LeastSquares");
        if (problem.hasGroundTruth()) {
            history.finalError(MatrixOps.relativeError(estimate, problem.getGroundTruth()));
        }
        return new InitResult(estimate, history.build());
    }
}
