package com.github.trinity.recovery.solver;

import static org.junit.jupiter.api.Assertions.*;
import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.exception.DimensionMismatchException;
import com.github.trinity.recovery.operator.DenseLinearOperator;
import com.github.trinity.recovery.operator.SensingOperators;
import com.github.trinity.recovery.operator.SignalShape;
import com.github.trinity.recovery.projection.RankProjection;
import com.github.trinity.recovery.util.MatrixOps;
import com.github.trinity.recovery.util.Nonlinearity;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.random.MersenneTwister;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class SolverConfigTest {

    @Test
    void testDefaults() {
        SolverConfig config = SolverConfig.builder().build();
        assertEquals(200, config.getIterations());
        assertEquals(0.1, config.getStepSize(), 0.0);
        assertEquals(0.0, config.getRegularization(), 0.0);
        assertEquals(10, config.getInnerIterations());
        assertEquals(1e3, config.getDivergenceThreshold(), 0.0);
        assertEquals(1e-12, config.getEpsilon(), 0.0);
        assertEquals(0.95, config.getStepDecay(), 0.0);
        assertEquals(Nonlinearity.ABSOLUTE_VALUE, config.getNonlinearity());
        assertNull(config.getProjection());
        assertFalse(config.hasRank());
    }

    @Test
    void testToBuilderCopiesEverything() {
        RankProjection projection = new RankProjection(2);
        SolverConfig config = SolverConfig.builder()
            .iterations(7).stepSize(0.3).rank(2).sparsity(4).regularization(0.01)
            .projection(projection).innerIterations(3).divergenceThreshold(50)
            .epsilon(1e-9).stepDecay(0.5).nonlinearity(Nonlinearity.SQUARE)
            .build();
        SolverConfig copy = config.toBuilder().iterations(8).build();
        assertEquals(8, copy.getIterations());
        assertEquals(0.3, copy.getStepSize(), 0.0);
        assertEquals(2, copy.getRank());
        assertEquals(4, copy.getSparsity());
        assertEquals(0.01, copy.getRegularization(), 0.0);
        assertSame(projection, copy.getProjection());
        assertEquals(3, copy.getInnerIterations());
        assertEquals(50, copy.getDivergenceThreshold(), 0.0);
        assertEquals(1e-9, copy.getEpsilon(), 0.0);
        assertEquals(0.5, copy.getStepDecay(), 0.0);
        assertEquals(Nonlinearity.SQUARE, copy.getNonlinearity());
    }

    @Test
    void testValidation() {
        assertThrows(ConfigurationException.class, () -> SolverConfig.builder().iterations(0).build());
        assertThrows(ConfigurationException.class, () -> SolverConfig.builder().stepSize(0).build());
        assertThrows(ConfigurationException.class, () -> SolverConfig.builder().stepSize(Double.NaN).build());
        assertThrows(ConfigurationException.class, () -> SolverConfig.builder().rank(-1).build());
        assertThrows(ConfigurationException.class, () -> SolverConfig.builder().regularization(-0.1).build());
        assertThrows(ConfigurationException.class, () -> SolverConfig.builder().innerIterations(0).build());
        assertThrows(ConfigurationException.class, () -> SolverConfig.builder().stepDecay(1.5).build());
        assertThrows(ConfigurationException.class, () -> SolverConfig.builder().epsilon(0).build());
        assertThrows(ConfigurationException.class, () -> SolverConfig.builder().nonlinearity(null).build());
    }

    @Test
    void testRequiredFieldsCheckedAtConstruction() {
        SolverConfig bare = SolverConfig.builder().build();
        assertThrows(ConfigurationException.class, () -> new ProjectedGradientDescent(bare));
        assertThrows(ConfigurationException.class, () -> new AmplitudeProjectedGradientDescent(bare));
        assertThrows(ConfigurationException.class, () -> new SymmetricTensorProjectedGradientDescent(bare));
        assertThrows(ConfigurationException.class, () -> new AlternatingProjection(bare));
        assertThrows(ConfigurationException.class, () -> new FactoredGradientDescent(bare));
        assertThrows(ConfigurationException.class, () -> new SubgradientDescent(bare));
        assertThrows(ConfigurationException.class, () -> new StochasticGradientDescent(bare));
        assertThrows(ConfigurationException.class, () -> new RiemannianGradientDescent(bare));
        assertDoesNotThrow(() -> new SoftThresholdingSolver(bare));
    }

    @ParameterizedTest
    @EnumSource(SolverType.class)
    void testSolverTypeCreatesSolver(SolverType type) {
        SolverConfig config = SolverConfig.builder().rank(1).projection(new RankProjection(1)).build();
        Solver solver = type.create(config);
        assertNotNull(solver);
        assertSame(config, ((AbstractSolver) solver).getConfig());
    }

    @Test
    void testFactoredSolverNeedsSquareSignal() {
        DenseLinearOperator op = SensingOperators.gaussian(12, SignalShape.matrix(3, 2), new MersenneTwister(1));
        RecoveryProblem problem = new RecoveryProblem(new ArrayRealVector(12), op);
        Solver gd = new FactoredGradientDescent(SolverConfig.builder().rank(1).build());
        assertThrows(ConfigurationException.class, () -> gd.solve(MatrixOps.zeros(3, 2), problem));
    }

    @Test
    void testShapeChecks() {
        DenseLinearOperator op = SensingOperators.gaussian(12, SignalShape.matrix(3, 3), new MersenneTwister(1));
        assertThrows(DimensionMismatchException.class, () -> new RecoveryProblem(new ArrayRealVector(11), op));
        assertThrows(DimensionMismatchException.class,
            () -> new RecoveryProblem(new ArrayRealVector(12), op, MatrixOps.zeros(2, 2), null));
        RecoveryProblem problem = new RecoveryProblem(new ArrayRealVector(12), op);
        Solver pgd = new ProjectedGradientDescent(SolverConfig.builder().projection(new RankProjection(1)).build());
        assertThrows(DimensionMismatchException.class, () -> pgd.solve(MatrixOps.zeros(3, 2), problem));
        assertThrows(ConfigurationException.class, problem::getRandom);
    }
}
