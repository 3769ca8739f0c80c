package com.github.trinity.recovery.init;

import com.github.trinity.recovery.operator.LiftedTensorOperator;
import com.github.trinity.recovery.operator.SensingOperators;
import com.github.trinity.recovery.operator.SignalShape;
import com.github.trinity.recovery.projection.Projection;
import com.github.trinity.recovery.projection.Projections;
import com.github.trinity.recovery.projection.SymmetricRankProjection;
import com.github.trinity.recovery.solver.RecoveryProblem;
import com.github.trinity.recovery.solver.SolverConfig;
import com.github.trinity.recovery.solver.SolverResult;
import com.github.trinity.recovery.solver.SymmetricTensorProjectedGradientDescent;
import com.github.trinity.recovery.util.MatrixOps;
import com.github.trinity.recovery.util.SignRectifier;
import com.github.trinity.recovery.util.Tensors;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tensor-lift initialization for symmetric rank-r matrices.
 * <ol>
 *   <li>Lift the operator so that every A_i becomes A_i (x) A_i. Since
 *       {@code <A_i (x) A_i, X (x) X> = <A_i, X>^2}, the lifted measurements are
 *       {@code sqrt(m) y^2} for both linear and magnitude data.</li>
 *   <li>Run {@link SymmetricTensorProjectedGradientDescent} from the zero tensor with a
 *       symmetrized Tucker projection.</li>
 *   <li>Extract a matrix from the tensor, symmetrize it and project to symmetric rank r.</li>
 *   <li>Refine with a few power iterations seeded from the extraction.</li>
 * </ol>
 * The lifted state has d^4 entries, so this path is meant for d up to about 30.
 *
 * @author Sean Phillips
 */
public class TensorLiftInitializer implements Initializer {
    private static final Logger LOG = LoggerFactory.getLogger(TensorLiftInitializer.class);

    private final InitializerConfig config;
    private final int rank;

    public TensorLiftInitializer(InitializerConfig config) {
        this.config = config;
        this.rank = config.requireRank("Tensor lift");
    }

    @Override
    public InitResult initialize(RecoveryProblem problem) {
        SignalShape shape = problem.signalShape();
        shape.requireSquare("Tensor lift initialization");
        int d = shape.getRows();
        int n = d * d;

        LiftedTensorOperator lifted = SensingOperators.lift(problem.getOperator());
        RealVector y = problem.getMeasurements();
        RealVector liftedMeasurements = y.ebeMultiply(y).mapMultiply(problem.sqrtMeasurementCount());
        RealMatrix liftedTruth = problem.hasGroundTruth() ? Tensors.lift(problem.getGroundTruth()) : null;
        RecoveryProblem liftedProblem = new RecoveryProblem(liftedMeasurements, lifted, liftedTruth, null);

        SolverConfig tensorConfig = SolverConfig.builder()
            .iterations(config.getTensorIterations())
            .stepSize(config.tensorStepSizeFor(d))
            .rank(rank)
            .projection(Projections.symmetricTensor(rank))
            .build();
        SolverResult tensorResult = new SymmetricTensorProjectedGradientDescent(tensorConfig)
            .solve(MatrixOps.zeros(n, n), liftedProblem);

        SymmetricRankProjection symmetricRank = new SymmetricRankProjection(rank);
        RealMatrix extracted = symmetricRank.project(
            MatrixOps.symmetrize(config.getExtraction().extract(tensorResult.getEstimate(), rank)));
        if (LOG.isDebugEnabled() && problem.hasGroundTruth()) {
            LOG.debug("Tensor lift: lifted error {}, extracted error {}",
                String.format("%.4e", tensorResult.getDiagnostics().finalError()),
                String.format("%.4e", SignRectifier.error(extracted, problem.getGroundTruth())));
        }

        Projection projection = config.getProjection() != null ? config.getProjection() : symmetricRank;
        RealMatrix estimate = extracted;
        InitHistory refinement = null;
        if (config.getRefinementIterations() > 0 && extracted.getFrobeniusNorm() > 0) {
            InitializerConfig powerConfig = config.toBuilder()
                .seed(extracted)
                .powerIterations(config.getRefinementIterations())
                .projection(projection)
                .build();
            InitResult refined = new PowerMethodInitializer(powerConfig).initialize(problem);
            estimate = refined.getEstimate();
            refinement = refined.getHistory();
        }
        if (config.getProjection() != null) {
            estimate = config.getProjection().project(estimate);
        }

        InitHistory.Builder history = InitHistory.builder("TensorLift")
            .losses(tensorResult.getDiagnostics().getLosses());
        if (refinement != null) {
            history.errors(refinement.getErrors()).norms(refinement.getNorms());
        }
        if (problem.hasGroundTruth()) {
            estimate = SignRectifier.rectify(estimate, problem.getGroundTruth()).getAligned();
            history.finalError(MatrixOps.relativeError(estimate, problem.getGroundTruth()));
        }
        return new InitResult(estimate, history.build());
    }
}
