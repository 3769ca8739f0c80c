package com.github.trinity.recovery.solver;

import com.github.trinity.recovery.operator.LinearOperator;
import com.github.trinity.recovery.projection.Projection;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Projected gradient descent (PGD) on the linear least-squares loss
 * {@code 0.5 ||forward(X)/sqrt(m) - y||^2 + 0.5 lambda ||X||_F^2}:
 * <pre>
 *   grad = adjoint(forward(X)/sqrt(m) - y) / sqrt(m) + lambda X
 *   X   &lt;- P(X - mu grad)
 * </pre>
 *
 * @author Sean Phillips
 */
public class ProjectedGradientDescent extends AbstractSolver {

    private final Projection projection;

    public ProjectedGradientDescent(SolverConfig config) {
        super(config);
        this.projection = config.requireProjection("PGD");
    }

    @Override
    protected SolverResult iterate(RealMatrix x, RecoveryProblem problem) {
        LinearOperator operator = problem.getOperator();
        RealVector y = problem.getMeasurements();
        double sqrtM = problem.sqrtMeasurementCount();
        double mu = config.getStepSize();
        double lambda = config.getRegularization();
        int iterations = config.getIterations();
        Diagnostics.Recorder recorder = new Diagnostics.Recorder(iterations);

        RealVector z = predict(operator, x, sqrtM);
        recorder.record(0, error(x, problem), loss(x, z, y, lambda));
        for (int t = 1; t < iterations; t++) {
            RealMatrix gradient = operator.adjoint(z.subtract(y)).scalarMultiply(1.0 / sqrtM);
            if (lambda > 0) {
                gradient = gradient.add(x.scalarMultiply(lambda));
            }
            x = projection.project(requireFinite(x.subtract(gradient.scalarMultiply(mu)), t, recorder));
            z = predict(operator, x, sqrtM);
            recorder.record(t, error(x, problem), loss(x, z, y, lambda));
        }
        return new SolverResult(x, recorder.toDiagnostics(), iterations, false);
    }

    private static double loss(RealMatrix x, RealVector z, RealVector y, double lambda) {
        double norm = x.getFrobeniusNorm();
        return halfSquaredResidual(z, y) + 0.5 * lambda * norm * norm;
    }
}
