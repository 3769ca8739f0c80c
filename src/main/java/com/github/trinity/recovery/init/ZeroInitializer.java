package com.github.trinity.recovery.init;

import com.github.trinity.recovery.operator.SignalShape;
import com.github.trinity.recovery.solver.RecoveryProblem;
import com.github.trinity.recovery.util.MatrixOps;

/**
 * All-zero start, used with ISTA for sparse vectors.
 *
 * @author Sean Phillips
 */
public class ZeroInitializer implements Initializer {

    @Override
    public InitResult initialize(RecoveryProblem problem) {
        SignalShape shape = problem.signalShape();
        InitHistory.Builder history = InitHistory.builder("Zero");
        if (problem.hasGroundTruth()) {
            history.finalError(problem.getGroundTruth().getFrobeniusNorm() > 0 ? 1.0 : 0.0);
        }
        return new InitResult(MatrixOps.zeros(shape.getRows(), shape.getCols()), history.build());
    }
}
