package com.github.trinity.recovery.init;

import static org.junit.jupiter.api.Assertions.*;
import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.exception.DimensionMismatchException;
import com.github.trinity.recovery.exception.NumericalDivergenceException;
import com.github.trinity.recovery.operator.LinearOperator;
import com.github.trinity.recovery.operator.SensingOperators;
import com.github.trinity.recovery.operator.SignalShape;
import com.github.trinity.recovery.projection.SparsityProjection;
import com.github.trinity.recovery.projection.SymmetricRankProjection;
import com.github.trinity.recovery.solver.RecoveryProblem;
import com.github.trinity.recovery.trial.GroundTruth;
import com.github.trinity.recovery.util.MatrixOps;
import com.github.trinity.recovery.util.Nonlinearity;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class InitializerTest {

    private static RecoveryProblem linear(LinearOperator op, RealMatrix truth, RandomGenerator rng) {
        return new RecoveryProblem(op.forward(truth).mapDivide(FastMath.sqrt(op.measurementCount())), op, truth, rng);
    }

    @Test
    void testSpectralRequiresRank() {
        assertThrows(ConfigurationException.class,
            () -> new SpectralInitializer(InitializerConfig.builder().build()));
        assertThrows(ConfigurationException.class,
            () -> InitializerType.LEAST_SQUARES.create(InitializerConfig.builder().build()));
    }

    @Test
    void testSpectralEstimateHasTargetRank() {
        RandomGenerator rng = new MersenneTwister(10);
        RealMatrix truth = GroundTruth.lowRank(8, 6, 2, 1.0, rng);
        LinearOperator op = SensingOperators.gaussian(400, SignalShape.matrix(8, 6), rng);
        InitResult result = new SpectralInitializer(InitializerConfig.builder().rank(2).build())
            .initialize(linear(op, truth, rng));
        assertEquals(2, MatrixOps.numericalRank(result.getEstimate(), 1e-10));
        InitHistory history = result.getHistory();
        assertEquals("SVD", history.getMethod());
        assertEquals(6, history.getSingularValues().length);
        assertTrue(history.getFinalError() < 0.6, history.toString());
    }

    @Test
    void testPowerMethodWithZeroMeasurementsFails() {
        RandomGenerator rng = new MersenneTwister(11);
        LinearOperator op = SensingOperators.gaussian(30, SignalShape.vector(10), rng);
        RecoveryProblem problem = new RecoveryProblem(new ArrayRealVector(30), op);
        assertThrows(NumericalDivergenceException.class,
            () -> new PowerMethodInitializer(InitializerConfig.builder().build()).initialize(problem));
    }

    @Test
    void testPowerMethodFindsPhaseRetrievalDirection() {
        RandomGenerator rng = new MersenneTwister(12);
        RealMatrix truth = GroundTruth.psd(10, 1, 1.0, rng);
        LinearOperator op = SensingOperators.rankOneGaussian(300, SignalShape.matrix(10, 10), rng);
        RecoveryProblem problem = new RecoveryProblem(Nonlinearity.ABSOLUTE_VALUE.apply(
            op.forward(truth).mapDivide(FastMath.sqrt(300))), op, truth, rng);
        InitResult result = new PowerMethodInitializer(InitializerConfig.builder()
            .powerIterations(30).projection(new SymmetricRankProjection(1)).build())
            .initialize(problem);

        assertEquals(1.0, result.getEstimate().getFrobeniusNorm(), 1e-12);
        InitHistory history = result.getHistory();
        assertEquals(30, history.getNorms().length);
        assertEquals(30, history.getErrors().length);
        assertTrue(history.getFinalError() < 0.5, history.toString());
    }

    @Test
    void testPowerMethodRejectsMisshapedSeed() {
        RandomGenerator rng = new MersenneTwister(13);
        LinearOperator op = SensingOperators.gaussian(30, SignalShape.vector(10), rng);
        RecoveryProblem problem = new RecoveryProblem(MatrixOps.gaussianVector(30, rng), op);
        InitializerConfig config = InitializerConfig.builder().seed(MatrixOps.zeros(5, 1).scalarAdd(1.0)).build();
        assertThrows(DimensionMismatchException.class, () -> new PowerMethodInitializer(config).initialize(problem));
    }

    @Test
    void testZeroInitializer() {
        RandomGenerator rng = new MersenneTwister(14);
        RealMatrix truth = GroundTruth.sparseVector(12, 3, 1.0, rng);
        LinearOperator op = SensingOperators.gaussian(20, SignalShape.vector(12), rng);
        InitResult result = new ZeroInitializer().initialize(linear(op, truth, rng));
        assertEquals(0.0, result.getEstimate().getFrobeniusNorm(), 0.0);
        assertEquals(12, result.getEstimate().getRowDimension());
        assertEquals(1.0, result.getHistory().getFinalError(), 0.0);
    }

    @Test
    void testMatchingPursuitKeepsTopCorrelations() {
        RandomGenerator rng = new MersenneTwister(15);
        RealMatrix truth = GroundTruth.sparseVector(20, 3, 1.0, rng);
        LinearOperator op = SensingOperators.gaussian(40, SignalShape.vector(20), rng);
        RecoveryProblem problem = linear(op, truth, rng);
        InitResult result = new MatchingPursuitInitializer(InitializerConfig.builder().sparsity(3).scale(2.0).build())
            .initialize(problem);

        RealMatrix correlations = op.adjoint(problem.getMeasurements()).scalarMultiply(1.0 / FastMath.sqrt(40));
        RealMatrix expected = new SparsityProjection(3).project(correlations).scalarMultiply(2.0);
        assertEquals(0.0, result.getEstimate().subtract(expected).getFrobeniusNorm(), 1e-12);
        assertEquals(3, MatrixOps.countAbove(result.getEstimate(), 0.0));
    }

    @Test
    void testLeastSquaresFallsBackToZeroWhenUnderdetermined() {
        RandomGenerator rng = new MersenneTwister(16);
        RealMatrix truth = GroundTruth.sparseVector(20, 3, 1.0, rng);
        LinearOperator op = SensingOperators.gaussian(10, SignalShape.vector(20), rng);
        InitResult result = new LeastSquaresInitializer(InitializerConfig.builder().sparsity(3).build())
            .initialize(linear(op, truth, rng));
        assertEquals(0.0, result.getEstimate().getFrobeniusNorm(), 0.0);
    }

    @Test
    void testLeastSquaresIsSparseAndScaled() {
        RandomGenerator rng = new MersenneTwister(17);
        RealMatrix truth = GroundTruth.sparseVector(20, 3, 1.0, rng);
        LinearOperator op = SensingOperators.gaussian(60, SignalShape.vector(20), rng);
        InitResult result = new LeastSquaresInitializer(InitializerConfig.builder().sparsity(3).scale(0.5).build())
            .initialize(linear(op, truth, rng));
        RealMatrix estimate = result.getEstimate();
        assertEquals(3, MatrixOps.countAbove(estimate, 0.0));
        assertTrue(estimate.getFrobeniusNorm() <= 0.5 * FastMath.sqrt(3) + 1e-12);
        assertTrue(estimate.getFrobeniusNorm() > 0);
    }

    @Test
    void testRandomInitializerIsReproducible() {
        RandomGenerator rng = new MersenneTwister(18);
        LinearOperator op = SensingOperators.gaussian(30, SignalShape.matrix(6, 6), rng);
        InitializerConfig config = InitializerConfig.builder().rank(2).build();
        RecoveryProblem first = new RecoveryProblem(MatrixOps.gaussianVector(30, new MersenneTwister(1)), op, null,
            new MersenneTwister(5));
        RecoveryProblem second = new RecoveryProblem(MatrixOps.gaussianVector(30, new MersenneTwister(1)), op, null,
            new MersenneTwister(5));
        RealMatrix a = new RandomInitializer(config).initialize(first).getEstimate();
        RealMatrix b = new RandomInitializer(config).initialize(second).getEstimate();
        assertEquals(0.0, a.subtract(b).getFrobeniusNorm(), 0.0);
        assertEquals(2, MatrixOps.numericalRank(a, 1e-12));
        assertEquals(0.0, a.subtract(a.transpose()).getFrobeniusNorm(), 1e-15);
        assertTrue(Double.isNaN(new RandomInitializer(config).initialize(first).getHistory().getFinalError()));
    }

    @Test
    void testRandomInitializerNeedsRandomSource() {
        RandomGenerator rng = new MersenneTwister(19);
        LinearOperator op = SensingOperators.gaussian(30, SignalShape.vector(8), rng);
        RecoveryProblem problem = new RecoveryProblem(MatrixOps.gaussianVector(30, rng), op);
        assertThrows(ConfigurationException.class,
            () -> new RandomInitializer(InitializerConfig.builder().build()).initialize(problem));
    }

    @ParameterizedTest
    @EnumSource(InitializerType.class)
    void testEveryTypeProducesSignalShapedEstimate(InitializerType type) {
        RandomGenerator rng = new MersenneTwister(20);
        boolean sparse = type == InitializerType.MATCHING_PURSUIT || type == InitializerType.LEAST_SQUARES;
        SignalShape shape = sparse ? SignalShape.vector(16) : SignalShape.matrix(4, 4);
        RealMatrix truth = sparse ? GroundTruth.sparseVector(16, 2, 1.0, rng) : GroundTruth.psd(4, 1, 1.0, rng);
        LinearOperator op = SensingOperators.gaussian(40, shape, rng);
        InitializerConfig config = InitializerConfig.builder().rank(1).sparsity(2).build();
        RealMatrix estimate = type.create(config).initialize(linear(op, truth, rng)).getEstimate();
        shape.check(estimate);
        assertFalse(MatrixOps.hasNaNsOrInfs(estimate));
    }
}
