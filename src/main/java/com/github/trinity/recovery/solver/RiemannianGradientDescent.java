package com.github.trinity.recovery.solver;

import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.util.MatrixOps;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Riemannian gradient descent (RGD) on the manifold of rank-r matrices. The iterate is held as
 * an explicit factorization X = U S V^T. Each step takes the scaled ambient gradient
 * {@code G = eta * adjoint(residual) / sqrt(m)}, projects it onto the tangent space at X and
 * retracts with a 2r x 2r core:
 * <pre>
 *   Y1      = U^T G V
 *   Q1 R1   = qr((I - U U^T) G V)
 *   Q2 R2   = qr((I - V V^T) G^T U)
 *   M       = [ S + Y1   R2^T ]
 *             [ R1        0   ]
 *   M       = Um Sm Vm^T,  keep r
 *   U, S, V = [U Q1] Um_r, Sm_r, [V Q2] Vm_r
 * </pre>
 * which equals the rank-r truncation of X + P_T(G) at the cost of one small SVD.
 * <p>
 * Unlike the other solvers RGD stops early when the iterate blows up: once the relative error
 * (or ||X|| / ||X_0|| without ground truth) exceeds the divergence threshold or stops being
 * finite, the run is flagged diverged, the trajectory is padded with its last recorded value and
 * the last stable estimate is returned.
 * </p>
 *
 * @author Sean Phillips
 */
public class RiemannianGradientDescent extends AbstractSolver {
    private static final Logger LOG = LoggerFactory.getLogger(RiemannianGradientDescent.class);

    private final int rank;

    public RiemannianGradientDescent(SolverConfig config) {
        super(config);
        this.rank = config.requireRank("RGD");
    }

    @Override
    protected SolverResult iterate(RealMatrix x, RecoveryProblem problem) {
        int d1 = x.getRowDimension();
        int d2 = x.getColumnDimension();
        if (rank > Math.min(d1, d2)) {
            throw new ConfigurationException(String.format("RGD rank %d exceeds min(%d, %d)", rank, d1, d2));
        }
        int iterations = config.getIterations();
        double sqrtM = problem.sqrtMeasurementCount();
        double eta = config.getStepSize();
        Diagnostics.Recorder recorder = new Diagnostics.Recorder(iterations);

        SingularValueDecomposition svd = new SingularValueDecomposition(x);
        RealMatrix u = svd.getU().getSubMatrix(0, d1 - 1, 0, rank - 1);
        RealMatrix s = svd.getS().getSubMatrix(0, rank - 1, 0, rank - 1);
        RealMatrix v = svd.getV().getSubMatrix(0, d2 - 1, 0, rank - 1);
        RealMatrix estimate = u.multiply(s).multiply(v.transpose());
        double initialNorm = estimate.getFrobeniusNorm();
        recorder.record(0, error(estimate, problem), loss(estimate, problem));

        for (int t = 1; t < iterations; t++) {
            RealMatrix g = problem.getOperator()
                .adjoint(problem.getMeasurements().subtract(predict(problem.getOperator(), estimate, sqrtM)))
                .scalarMultiply(eta / sqrtM);
            if (MatrixOps.hasNaNsOrInfs(g)) {
                LOG.warn("RGD diverged at iteration {}: gradient is not finite", t);
                recorder.padFromLast();
                return new SolverResult(estimate, recorder.toDiagnostics(), t, true);
            }

            RealMatrix y1 = u.transpose().multiply(g).multiply(v);
            RealMatrix gv = g.multiply(v).subtract(u.multiply(y1));
            RealMatrix gtu = g.transpose().multiply(u).subtract(v.multiply(y1.transpose()));
            QRDecomposition qr1 = new QRDecomposition(gv);
            QRDecomposition qr2 = new QRDecomposition(gtu);
            RealMatrix q1 = qr1.getQ().getSubMatrix(0, d1 - 1, 0, rank - 1);
            RealMatrix r1 = qr1.getR().getSubMatrix(0, rank - 1, 0, rank - 1);
            RealMatrix q2 = qr2.getQ().getSubMatrix(0, d2 - 1, 0, rank - 1);
            RealMatrix r2 = qr2.getR().getSubMatrix(0, rank - 1, 0, rank - 1);

            RealMatrix core = new Array2DRowRealMatrix(2 * rank, 2 * rank);
            core.setSubMatrix(s.add(y1).getData(), 0, 0);
            core.setSubMatrix(r2.transpose().getData(), 0, rank);
            core.setSubMatrix(r1.getData(), rank, 0);
            SingularValueDecomposition coreSvd = new SingularValueDecomposition(core);

            RealMatrix nextU = concat(u, q1).multiply(coreSvd.getU().getSubMatrix(0, 2 * rank - 1, 0, rank - 1));
            RealMatrix nextS = coreSvd.getS().getSubMatrix(0, rank - 1, 0, rank - 1);
            RealMatrix nextV = concat(v, q2).multiply(coreSvd.getV().getSubMatrix(0, 2 * rank - 1, 0, rank - 1));
            RealMatrix next = nextU.multiply(nextS).multiply(nextV.transpose());

            double err = error(next, problem);
            double monitor = problem.hasGroundTruth()
                ? err
                : next.getFrobeniusNorm() / (initialNorm > 0 ? initialNorm : 1.0);
            if (!Double.isFinite(monitor) || monitor > config.getDivergenceThreshold()) {
                LOG.warn("RGD diverged at iteration {}: monitored value {} exceeds {}",
                    t, String.format("%.4e", monitor), String.format("%.1e", config.getDivergenceThreshold()));
                recorder.padFromLast();
                return new SolverResult(estimate, recorder.toDiagnostics(), t, true);
            }
            u = nextU;
            s = nextS;
            v = nextV;
            estimate = next;
            recorder.record(t, err, loss(estimate, problem));
        }
        return new SolverResult(estimate, recorder.toDiagnostics(), iterations, false);
    }

    private double loss(RealMatrix estimate, RecoveryProblem problem) {
        return halfSquaredResidual(predict(problem.getOperator(), estimate, problem.sqrtMeasurementCount()),
            problem.getMeasurements());
    }

    private static RealMatrix concat(RealMatrix left, RealMatrix right) {
        int rows = left.getRowDimension();
        RealMatrix out = new Array2DRowRealMatrix(rows, left.getColumnDimension() + right.getColumnDimension());
        out.setSubMatrix(left.getData(), 0, 0);
        out.setSubMatrix(right.getData(), 0, left.getColumnDimension());
        return out;
    }
}
