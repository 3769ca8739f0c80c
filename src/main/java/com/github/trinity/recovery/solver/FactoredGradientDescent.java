package com.github.trinity.recovery.solver;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Factored gradient descent (GD) for symmetric low-rank recovery from linear measurements.
 * Each step forms the residual {@code y - forward(U U^T)/sqrt(m)}, maps it back with
 * {@code G = adjoint(residual)/sqrt(m)} and moves the factor by {@code eta (G U - lambda U)}.
 * The loss is {@code 0.5 ||forward(X)/sqrt(m) - y||^2 + 0.5 lambda ||U||_F^2}; errors are not
 * sign-rectified.
 *
 * @author Sean Phillips
 */
public class FactoredGradientDescent extends FactoredSolver {

    public FactoredGradientDescent(SolverConfig config) {
        super(config);
    }

    @Override
    protected RealMatrix direction(RealMatrix estimate, RecoveryProblem problem, int t) {
        return problem.getOperator().adjoint(residual(estimate, problem))
            .scalarMultiply(1.0 / problem.sqrtMeasurementCount());
    }

    @Override
    protected double loss(RealMatrix estimate, RealMatrix factor, RecoveryProblem problem) {
        return ridgeLoss(estimate, factor, problem);
    }
}
