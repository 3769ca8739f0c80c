package com.github.trinity.recovery.solver;

import com.github.trinity.recovery.operator.LinearOperator;
import com.github.trinity.recovery.projection.Projection;
import com.github.trinity.recovery.util.MatrixOps;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Alternating projection (AP) for magnitude measurements. Every outer iteration
 * <ol>
 *   <li>keeps the sign of the current prediction and imposes the observed magnitudes,
 *       {@code z_proj = y * sgn(forward(X)/sqrt(m))};</li>
 *   <li>fits a signal to {@code z_proj} with a short run of the owned inner
 *       {@link ProjectedGradientDescent} ({@code innerIterations} steps, started from X, with X
 *       standing in as ground truth) and projects the result.</li>
 * </ol>
 * The inner run's diagnostics are discarded. The loss is {@code ||f(z) - y|| / ||y||} with f the
 * configured nonlinearity, the absolute value unless set otherwise.
 *
 * @author Sean Phillips
 */
public class AlternatingProjection extends AbstractSolver {

    private final Projection projection;
    private final ProjectedGradientDescent inner;

    public AlternatingProjection(SolverConfig config) {
        super(config);
        this.projection = config.requireProjection("AP");
        this.inner = new ProjectedGradientDescent(config.toBuilder()
            .iterations(config.getInnerIterations())
            .build());
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
        double yNorm = y.getNorm();
        double epsilon = config.getEpsilon();
        int iterations = config.getIterations();
        Diagnostics.Recorder recorder = new Diagnostics.Recorder(iterations);

        RealVector z = predict(operator, x, sqrtM);
        recorder.record(0, error(x, problem), loss(z, y, yNorm));
        for (int t = 1; t < iterations; t++) {
            double[] target = new double[z.getDimension()];
            for (int i = 0; i < target.length; i++) {
                target[i] = y.getEntry(i) * MatrixOps.guardedSign(z.getEntry(i), epsilon);
            }
            RecoveryProblem fit = problem
                .withMeasurements(new ArrayRealVector(target, false))
                .withGroundTruth(x);
            RealMatrix fitted;
            try {
                fitted = inner.solve(x, fit).getEstimate();
            } catch (SolverDivergenceException ex) {
                throw new SolverDivergenceException(String.format(
                    "AP inner fit diverged at outer iteration %d", t), t, recorder.partial(), ex);
            }
            x = projection.project(fitted);
            z = predict(operator, x, sqrtM);
            recorder.record(t, error(x, problem), loss(z, y, yNorm));
        }
        return new SolverResult(x, recorder.toDiagnostics(), iterations, false);
    }

    ProjectedGradientDescent getInner() {
        return inner;
    }

    private double loss(RealVector z, RealVector y, double yNorm) {
        double distance = config.getNonlinearity().apply(z).getDistance(y);
        return yNorm > 0 ? distance / yNorm : distance;
    }
}
