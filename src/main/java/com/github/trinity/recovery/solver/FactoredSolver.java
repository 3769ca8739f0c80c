package com.github.trinity.recovery.solver;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;
import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.util.MatrixOps;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;

/**
 * Burer-Monteiro style solvers that keep the estimate as X = U U^T with a d x r factor and move
 * the factor by
 * <pre>
 *   U &lt;- U + eta_t (G U - lambda U)
 * </pre>
 * where G is a signal-space descent direction supplied by the subclass.
 *
 * @author Sean Phillips
 */
abstract class FactoredSolver extends AbstractSolver {

    protected final int rank;

    protected FactoredSolver(SolverConfig config) {
        super(config);
        this.rank = config.requireRank(getClass().getSimpleName());
    }

    @Override
    protected SolverResult iterate(RealMatrix x, RecoveryProblem problem) {
        requireSquare(problem, name());
        int iterations = config.getIterations();
        double lambda = config.getRegularization();
        Diagnostics.Recorder recorder = new Diagnostics.Recorder(iterations);

        RealMatrix u = factorOf(x, rank);
        RealMatrix estimate = u.multiply(u.transpose());
        recorder.record(0, error(estimate, problem), loss(estimate, u, problem));

        for (int t = 1; t < iterations; t++) {
            RealMatrix g = direction(estimate, problem, t);
            RealMatrix update = g.multiply(u);
            if (lambda > 0) {
                update = update.subtract(u.scalarMultiply(lambda));
            }
            u = requireFinite(u.add(update.scalarMultiply(stepSize(t))), t, recorder);
            estimate = u.multiply(u.transpose());
            recorder.record(t, error(estimate, problem), loss(estimate, u, problem));
        }
        return new SolverResult(estimate, recorder.toDiagnostics(), iterations, false);
    }

    /**
     * Signal-space direction G at iteration {@code t >= 1}.
     */
    protected abstract RealMatrix direction(RealMatrix estimate, RecoveryProblem problem, int t);

    protected abstract double loss(RealMatrix estimate, RealMatrix factor, RecoveryProblem problem);

    protected double stepSize(int t) {
        return config.getStepSize();
    }

    /**
     * {@code y - forward(X) / sqrt(m)}.
     */
    protected static RealVector residual(RealMatrix estimate, RecoveryProblem problem) {
        return problem.getMeasurements().subtract(
            predict(problem.getOperator(), estimate, problem.sqrtMeasurementCount()));
    }

    /**
     * {@code 0.5 ||forward(X)/sqrt(m) - y||^2 + 0.5 lambda ||U||_F^2}.
     */
    protected double ridgeLoss(RealMatrix estimate, RealMatrix factor, RecoveryProblem problem) {
        double data = 0.5 * FastMath.pow(residual(estimate, problem).getNorm(), 2);
        double norm = factor.getFrobeniusNorm();
        return data + 0.5 * config.getRegularization() * norm * norm;
    }

    /**
     * Factor U with U U^T equal to the PSD part of the best rank-r approximation of the
     * symmetrized starting point: the r largest eigenpairs, each column scaled by
     * sqrt(max(lambda, 0)).
     */
    static RealMatrix factorOf(RealMatrix x, int rank) {
        int d = x.getRowDimension();
        if (rank > d) {
            throw new ConfigurationException(String.format("Rank %d exceeds the dimension %d", rank, d));
        }
        EigenDecomposition eig = new EigenDecomposition(MatrixOps.symmetrize(x));
        double[] values = eig.getRealEigenvalues();
        Integer[] order = IntStream.range(0, values.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> -values[i]));
        double[][] u = new double[d][rank];
        for (int k = 0; k < rank; k++) {
            double scale = FastMath.sqrt(Math.max(values[order[k]], 0.0));
            RealVector v = eig.getEigenvector(order[k]);
            for (int i = 0; i < d; i++) {
                u[i][k] = v.getEntry(i) * scale;
            }
        }
        return new Array2DRowRealMatrix(u, false);
    }
}
