package com.github.trinity.recovery.trial;

import static org.junit.jupiter.api.Assertions.*;
import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.init.InitializerConfig;
import com.github.trinity.recovery.init.InitializerType;
import com.github.trinity.recovery.operator.SensingModel;
import com.github.trinity.recovery.operator.SignalShape;
import com.github.trinity.recovery.projection.RankProjection;
import com.github.trinity.recovery.projection.SparsityProjection;
import com.github.trinity.recovery.solver.SolverConfig;
import com.github.trinity.recovery.solver.SolverType;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.random.MersenneTwister;
import org.junit.jupiter.api.Test;

class TrialRunnerTest {

    private static TrialConfig.Builder lowRankPgd() {
        return TrialConfig.builder()
            .signalModel(SignalModel.LOW_RANK)
            .shape(SignalShape.matrix(6, 5))
            .rank(1)
            .sensingModel(SensingModel.GAUSSIAN)
            .measurements(120)
            .initializer(InitializerType.SPECTRAL, InitializerConfig.builder().rank(1).build())
            .solver(SolverType.PGD, SolverConfig.builder()
                .iterations(200).stepSize(0.5).projection(new RankProjection(1)).build());
    }

    @Test
    void testSuccessfulTrial() {
        TrialResult result = new TrialRunner().run(lowRankPgd().build(), new MersenneTwister(21));
        assertFalse(result.isFailed());
        assertTrue(result.isSuccess(), result.toString());
        assertEquals(1, result.getRecoveredRank());
        assertEquals(200, result.getDiagnostics().length());
        assertEquals(result.getDiagnostics().finalError(), result.getFinalError(), 1e-12);
        assertNotNull(result.getEstimate());
    }

    @Test
    void testSameSeedSameTrial() {
        TrialConfig config = lowRankPgd().measurements(40).build();
        TrialResult a = new TrialRunner().run(config, new MersenneTwister(22));
        TrialResult b = new TrialRunner().run(config, new MersenneTwister(22));
        assertArrayEquals(a.getDiagnostics().getErrors(), b.getDiagnostics().getErrors(), 0.0);
        assertEquals(a.getFinalError(), b.getFinalError(), 0.0);
    }

    @Test
    void testSolverFailureIsRecorded() {
        TrialConfig config = lowRankPgd()
            .solver(SolverType.GD, SolverConfig.builder().rank(1).build())
            .build();
        TrialResult result = new TrialRunner().run(config, new MersenneTwister(23));
        assertTrue(result.isFailed());
        assertFalse(result.isSuccess());
        assertNull(result.getEstimate());
        assertTrue(Double.isNaN(result.getFinalError()));
        assertTrue(result.getDiagnostics().isEmpty());
        assertNotNull(result.getFailure());
    }

    @Test
    void testDecompositionFailureIsRecorded() {
        TrialConfig config = lowRankPgd()
            .solver((initial, problem) -> {
                throw new MaxCountExceededException(30);
            })
            .build();
        TrialResult result = new TrialRunner().run(config, new MersenneTwister(24));
        assertTrue(result.isFailed());
        assertFalse(result.isSuccess());
        assertNotNull(result.getFailure());
    }

    @Test
    void testDivergedTrialKeepsPartialTrajectory() {
        TrialConfig config = lowRankPgd()
            .solver(SolverType.PGD, SolverConfig.builder()
                .iterations(400).stepSize(1e6).projection(new SparsityProjection(30)).build())
            .build();
        TrialResult result = new TrialRunner().run(config, new MersenneTwister(25));
        assertTrue(result.isFailed());
        int recorded = result.getDiagnostics().length();
        assertTrue(recorded > 0 && recorded < 400, "recorded " + recorded);
        assertTrue(Double.isFinite(result.getDiagnostics().getError(0)));
    }

    @Test
    void testSparseTrialReportsSupport() {
        TrialConfig config = TrialConfig.builder()
            .signalModel(SignalModel.SPARSE_VECTOR)
            .shape(SignalShape.vector(30))
            .sparsity(3)
            .sensingModel(SensingModel.GAUSSIAN)
            .measurements(60)
            .initializer(InitializerType.ZERO, InitializerConfig.builder().build())
            .solver(SolverType.PGD, SolverConfig.builder()
                .iterations(300).stepSize(0.3).projection(new SparsityProjection(3)).build())
            .build();
        TrialResult result = new TrialRunner().run(config, new MersenneTwister(24));
        assertEquals(0, result.getRecoveredRank());
        assertTrue(result.getRecoveredSparsity() <= 3);
    }

    @Test
    void testConfigValidation() {
        assertThrows(ConfigurationException.class, () -> lowRankPgd().measurements(0).build());
        assertThrows(ConfigurationException.class, () -> lowRankPgd().rank(0).build());
        assertThrows(ConfigurationException.class, () -> lowRankPgd().successThreshold(0).build());
        assertThrows(ConfigurationException.class,
            () -> lowRankPgd().signalModel(SignalModel.SYMMETRIC_PSD).build());
        assertThrows(ConfigurationException.class,
            () -> lowRankPgd().signalModel(SignalModel.SPARSE_VECTOR).sparsity(2).build());
    }
}
