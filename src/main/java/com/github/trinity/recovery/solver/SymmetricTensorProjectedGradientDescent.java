package com.github.trinity.recovery.solver;

import com.github.trinity.recovery.operator.LinearOperator;
import com.github.trinity.recovery.projection.Projection;
import com.github.trinity.recovery.util.MatrixOps;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Amplitude PGD in the lifted space of d x d x d x d tensors (see
 * {@link com.github.trinity.recovery.operator.LiftedTensorOperator}). Both the gradient and the
 * iterate are symmetrized every step so that the matricization keeps the symmetry of X (x) X;
 * the configured projection is expected to be a symmetric tensor rank truncation such as
 * {@link com.github.trinity.recovery.projection.Projections#symmetricTensor(int)}.
 *
 * @author Sean Phillips
 */
public class SymmetricTensorProjectedGradientDescent extends AbstractSolver {

    private final Projection projection;

    public SymmetricTensorProjectedGradientDescent(SolverConfig config) {
        super(config);
        this.projection = config.requireProjection("Symmetric tensor PGD");
    }

    @Override
    protected boolean rectifiesSign() {
        return true;
    }

    @Override
    protected SolverResult iterate(RealMatrix tensor, RecoveryProblem problem) {
        requireSquare(problem, "Symmetric tensor PGD");
        LinearOperator operator = problem.getOperator();
        RealVector y = problem.getMeasurements();
        double sqrtM = problem.sqrtMeasurementCount();
        double eta = config.getStepSize();
        double epsilon = config.getEpsilon();
        int iterations = config.getIterations();
        Diagnostics.Recorder recorder = new Diagnostics.Recorder(iterations);

        RealMatrix t = MatrixOps.symmetrize(tensor);
        RealVector z = predict(operator, t, sqrtM);
        recorder.record(0, error(t, problem), AmplitudeGradient.loss(z, y));
        for (int k = 1; k < iterations; k++) {
            RealMatrix gradient = MatrixOps.symmetrize(AmplitudeGradient.gradient(operator, z, y, epsilon, sqrtM));
            t = MatrixOps.symmetrize(projection.project(requireFinite(t.subtract(gradient.scalarMultiply(eta)), k, recorder)));
            z = predict(operator, t, sqrtM);
            recorder.record(k, error(t, problem), AmplitudeGradient.loss(z, y));
        }
        return new SolverResult(t, recorder.toDiagnostics(), iterations, false);
    }
}
