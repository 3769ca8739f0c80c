package com.github.trinity.recovery.solver;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;

/**
 * Subgradient descent (SubGD) on the l1 residual {@code (1/m) ||forward(X)/sqrt(m) - y||_1}.
 * The direction is {@code G = adjoint(sign(residual)) / m} and the step decays geometrically,
 * {@code eta_t = eta * q^(t-1)}, which the non-smooth objective needs to settle.
 *
 * @author Sean Phillips
 */
public class SubgradientDescent extends FactoredSolver {

    public SubgradientDescent(SolverConfig config) {
        super(config);
    }

    @Override
    protected RealMatrix direction(RealMatrix estimate, RecoveryProblem problem, int t) {
        RealVector residual = residual(estimate, problem);
        double[] signs = new double[residual.getDimension()];
        for (int i = 0; i < signs.length; i++) {
            signs[i] = Math.signum(residual.getEntry(i));
        }
        return problem.getOperator().adjoint(new ArrayRealVector(signs, false))
            .scalarMultiply(1.0 / problem.measurementCount());
    }

    @Override
    protected double stepSize(int t) {
        return config.getStepSize() * FastMath.pow(config.getStepDecay(), t - 1);
    }

    @Override
    protected double loss(RealMatrix estimate, RealMatrix factor, RecoveryProblem problem) {
        return residual(estimate, problem).getL1Norm() / problem.measurementCount();
    }
}
