package com.github.trinity.recovery.init;

import com.github.trinity.recovery.operator.SignalShape;
import com.github.trinity.recovery.projection.SparsityProjection;
import com.github.trinity.recovery.solver.RecoveryProblem;
import com.github.trinity.recovery.util.MatrixOps;
import com.github.trinity.recovery.util.SignRectifier;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Data-independent start. Matrix signals get {@code U U^T} (or {@code U V^T} when not square)
 * for Gaussian factors normalized to Frobenius norm {@code scale}; vector signals get a Gaussian
 * vector times {@code scale}, hard-thresholded when a sparsity is configured.
 *
 * @author Sean Phillips
 */
public class RandomInitializer implements Initializer {

    private final InitializerConfig config;

    public RandomInitializer(InitializerConfig config) {
        this.config = config;
    }

    @Override
    public InitResult initialize(RecoveryProblem problem) {
        SignalShape shape = problem.signalShape();
        RandomGenerator rng = problem.getRandom();
        double scale = config.getScale();
        RealMatrix estimate;
        if (shape.isVector()) {
            estimate = MatrixOps.gaussianMatrix(shape.getRows(), 1, rng).scalarMultiply(scale);
            if (config.getSparsity() > 0) {
                estimate = new SparsityProjection(config.getSparsity()).project(estimate);
            }
        } else {
            int rank = config.requireRank("Random");
            RealMatrix u = scaledFactor(shape.getRows(), rank, scale, rng);
            RealMatrix v = shape.isSquare() ? u : scaledFactor(shape.getCols(), rank, scale, rng);
            estimate = u.multiply(v.transpose());
        }
        InitHistory.Builder history = InitHistory.builder("Random");
        if (problem.hasGroundTruth()) {
            history.finalError(SignRectifier.error(estimate, problem.getGroundTruth()));
        }
        return new InitResult(estimate, history.build());
    }

    private static RealMatrix scaledFactor(int rows, int rank, double scale, RandomGenerator rng) {
        RealMatrix u = MatrixOps.gaussianMatrix(rows, rank, rng);
        return u.scalarMultiply(scale / u.getFrobeniusNorm());
    }
}
