package com.github.trinity.recovery.solver;

import com.github.trinity.recovery.operator.LinearOperator;
import com.github.trinity.recovery.projection.Projection;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Projected gradient descent on the amplitude loss {@code (1/2m) sum_i (y_i - |z_i|)^2} for
 * magnitude-only measurements:
 * <pre>
 *   z    = forward(X) / sqrt(m)
 *   c_i  = (y_i - |z_i|) sgn(z_i)
 *   grad = -adjoint(c) / sqrt(m)
 *   X   &lt;- P(X - eta grad)
 * </pre>
 * sgn is guarded at |z_i| &lt;= epsilon, where the loss has a kink. Errors are reported up to the
 * global sign that magnitude measurements cannot resolve.
 *
 * @author Sean Phillips
 */
public class AmplitudeProjectedGradientDescent extends AbstractSolver {

    private final Projection projection;

    public AmplitudeProjectedGradientDescent(SolverConfig config) {
        super(config);
        this.projection = config.requireProjection("PGD-amplitude");
    }

    @Override
    protected boolean rectifiesSign() {
        return true;
    }

    @Override
    protected SolverResult iterate(RealMatrix x, RecoveryProblem problem) {
        LinearOperator operator = problem.getOperator();
        RealVector y = problem.getMeasurements();
        double sqrtM = problem.sqrtMeasurementCount();
        double eta = config.getStepSize();
        double epsilon = config.getEpsilon();
        int iterations = config.getIterations();
        Diagnostics.Recorder recorder = new Diagnostics.Recorder(iterations);

        RealVector z = predict(operator, x, sqrtM);
        recorder.record(0, error(x, problem), AmplitudeGradient.loss(z, y));
        for (int t = 1; t < iterations; t++) {
            RealMatrix gradient = AmplitudeGradient.gradient(operator, z, y, epsilon, sqrtM);
            x = projection.project(requireFinite(x.subtract(gradient.scalarMultiply(eta)), t, recorder));
            z = predict(operator, x, sqrtM);
            recorder.record(t, error(x, problem), AmplitudeGradient.loss(z, y));
        }
        return new SolverResult(x, recorder.toDiagnostics(), iterations, false);
    }
}
