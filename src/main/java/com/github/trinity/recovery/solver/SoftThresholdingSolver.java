package com.github.trinity.recovery.solver;

import com.github.trinity.recovery.operator.LinearOperator;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Iterative soft thresholding (ISTA) for sparse vectors:
 * <pre>
 *   x &lt;- soft(x + mu adjoint(y - forward(x)/sqrt(m)) / sqrt(m), lambda mu)
 *   soft(v, tau)_i = sign(v_i) max(|v_i| - tau, 0)
 * </pre>
 * The reported loss is the relative residual {@code ||y - forward(x)/sqrt(m)|| / ||y||}.
 *
 * @author Sean Phillips
 */
public class SoftThresholdingSolver extends AbstractSolver {

    public SoftThresholdingSolver(SolverConfig config) {
        super(config);
    }

    @Override
    protected SolverResult iterate(RealMatrix x, RecoveryProblem problem) {
        LinearOperator operator = problem.getOperator();
        RealVector y = problem.getMeasurements();
        double sqrtM = problem.sqrtMeasurementCount();
        double yNorm = y.getNorm();
        double mu = config.getStepSize();
        double threshold = config.getRegularization() * mu;
        int iterations = config.getIterations();
        Diagnostics.Recorder recorder = new Diagnostics.Recorder(iterations);

        RealVector residual = y.subtract(predict(operator, x, sqrtM));
        recorder.record(0, error(x, problem), relative(residual, yNorm));
        for (int t = 1; t < iterations; t++) {
            RealMatrix step = x.add(operator.adjoint(residual).scalarMultiply(mu / sqrtM));
            x = soft(requireFinite(step, t, recorder), threshold);
            residual = y.subtract(predict(operator, x, sqrtM));
            recorder.record(t, error(x, problem), relative(residual, yNorm));
        }
        return new SolverResult(x, recorder.toDiagnostics(), iterations, false);
    }

    static RealMatrix soft(RealMatrix v, double tau) {
        RealMatrix out = v.copy();
        for (int i = 0; i < out.getRowDimension(); i++) {
            for (int j = 0; j < out.getColumnDimension(); j++) {
                double e = out.getEntry(i, j);
                out.setEntry(i, j, Math.signum(e) * Math.max(Math.abs(e) - tau, 0.0));
            }
        }
        return out;
    }

    private static double relative(RealVector residual, double yNorm) {
        double norm = residual.getNorm();
        return yNorm > 0 ? norm / yNorm : norm;
    }
}
