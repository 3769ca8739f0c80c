package com.github.trinity.recovery.init;

import com.github.trinity.recovery.projection.RankProjection;
import com.github.trinity.recovery.solver.RecoveryProblem;
import com.github.trinity.recovery.util.SignRectifier;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spectral (SVD) initialization: the back-projection {@code adjoint(y) / sqrt(m)} truncated to
 * the target rank. For linear Gaussian sensing the back-projection is an unbiased estimate of
 * the signal, so its leading singular subspace is a good starting point.
 *
 * @author Sean Phillips
 */
public class SpectralInitializer implements Initializer {
    private static final Logger LOG = LoggerFactory.getLogger(SpectralInitializer.class);

    private final RankProjection projection;

    public SpectralInitializer(InitializerConfig config) {
        this.projection = new RankProjection(config.requireRank("Spectral"));
    }

    @Override
    public InitResult initialize(RecoveryProblem problem) {
        RealMatrix backProjection = problem.getOperator().adjoint(problem.getMeasurements())
            .scalarMultiply(1.0 / problem.sqrtMeasurementCount());
        double[] spectrum = new SingularValueDecomposition(backProjection).getSingularValues();
        RealMatrix estimate = projection.project(backProjection);

        InitHistory.Builder history = InitHistory.builder("SVD").singularValues(spectrum);
        if (problem.hasGroundTruth()) {
            double error = SignRectifier.error(estimate, problem.getGroundTruth());
            history.errors(new double[]{error}).finalError(error);
            LOG.debug("Spectral initialization error: {}", String.format("%.4e", error));
        }
        LOG.debug("Rank-{} spectral estimate, top singular values [{}, {}]", projection.getRank(),
            String.format("%.4e", spectrum[0]), String.format("%.4e", spectrum[Math.min(1, spectrum.length - 1)]));
        return new InitResult(estimate, history.build());
    }
}
