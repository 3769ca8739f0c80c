package com.github.trinity.recovery.init;

import com.github.trinity.recovery.exception.NumericalDivergenceException;
import com.github.trinity.recovery.operator.LinearOperator;
import com.github.trinity.recovery.operator.SignalShape;
import com.github.trinity.recovery.projection.Projection;
import com.github.trinity.recovery.solver.RecoveryProblem;
import com.github.trinity.recovery.util.MatrixOps;
import com.github.trinity.recovery.util.SignRectifier;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Power iteration on the weighted covariance
 * <pre>
 *   Y = (1/m) sum_i f(y_i) A_i A_i^T
 * </pre>
 * applied implicitly as {@code V -> adjoint(f(y) * forward(V)) / m}, optionally followed by the
 * configured structural projection, then renormalized to unit Frobenius norm. For magnitude
 * measurements the leading eigenvector of Y concentrates around the signal direction, which makes
 * this the preferred start for phase retrieval. The result has unit norm.
 *
 * @author Sean Phillips
 */
public class PowerMethodInitializer implements Initializer {
    private static final Logger LOG = LoggerFactory.getLogger(PowerMethodInitializer.class);

    private final InitializerConfig config;

    public PowerMethodInitializer(InitializerConfig config) {
        this.config = config;
    }

    @Override
    public InitResult initialize(RecoveryProblem problem) {
        LinearOperator operator = problem.getOperator();
        SignalShape shape = problem.signalShape();
        int m = problem.measurementCount();
        int iterations = config.getPowerIterations();
        Projection projection = config.getProjection();
        RealVector weights = config.getPreprocessing().apply(problem.getMeasurements());

        RealMatrix v = startingPoint(shape);
        double[] norms = new double[iterations];
        double[] errors = new double[iterations];
        for (int t = 0; t < iterations; t++) {
            RealVector w = weights.ebeMultiply(operator.forward(v));
            RealMatrix next = operator.adjoint(w).scalarMultiply(1.0 / m);
            if (projection != null) {
                next = projection.project(next);
            }
            double norm = next.getFrobeniusNorm();
            if (!(norm > 0) || Double.isInfinite(norm)) {
                throw new NumericalDivergenceException(String.format(
                    "Power iteration %d produced an estimate of norm %s", t, norm));
            }
            norms[t] = norm;
            v = next.scalarMultiply(1.0 / norm);
            errors[t] = problem.hasGroundTruth() ? SignRectifier.error(v, problem.getGroundTruth()) : Double.NaN;
        }
        LOG.debug("Power method: {} iterations, leading eigenvalue estimate {}, error {}",
            iterations, String.format("%.4e", norms[iterations - 1]), String.format("%.4e", errors[iterations - 1]));
        InitHistory history = InitHistory.builder("PowerMethod")
            .norms(norms)
            .errors(errors)
            .finalError(errors[iterations - 1])
            .build();
        return new InitResult(v, history);
    }

    private RealMatrix startingPoint(SignalShape shape) {
        RealMatrix seed = config.getSeed();
        RealMatrix v;
        if (seed != null) {
            shape.check(seed);
            v = seed.copy();
        } else {
            v = MatrixOps.zeros(shape.getRows(), shape.getCols()).scalarAdd(1.0);
        }
        double norm = v.getFrobeniusNorm();
        if (!(norm > 0)) {
            throw new NumericalDivergenceException("Power method seed has zero norm");
        }
        return v.scalarMultiply(1.0 / norm);
    }
}
