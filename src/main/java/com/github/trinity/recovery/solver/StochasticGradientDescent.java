package com.github.trinity.recovery.solver;

import org.apache.commons.math3.linear.OpenMapRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Stochastic variant of {@link FactoredGradientDescent}: every iteration draws one measurement
 * index uniformly from the problem's random source and uses only its residual,
 * {@code G = adjoint(r_i e_i) / sqrt(m)}. Runs are reproducible for a fixed random source.
 *
 * @author Sean Phillips
 */
public class StochasticGradientDescent extends FactoredSolver {

    public StochasticGradientDescent(SolverConfig config) {
        super(config);
    }

    @Override
    protected RealMatrix direction(RealMatrix estimate, RecoveryProblem problem, int t) {
        int m = problem.measurementCount();
        int i = problem.getRandom().nextInt(m);
        RealVector residual = residual(estimate, problem);
        OpenMapRealVector sample = new OpenMapRealVector(m);
        sample.setEntry(i, residual.getEntry(i));
        return problem.getOperator().adjoint(sample).scalarMultiply(1.0 / problem.sqrtMeasurementCount());
    }

    @Override
    protected double loss(RealMatrix estimate, RealMatrix factor, RecoveryProblem problem) {
        return ridgeLoss(estimate, factor, problem);
    }
}
