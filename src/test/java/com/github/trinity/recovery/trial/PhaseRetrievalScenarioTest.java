package com.github.trinity.recovery.trial;

import static org.junit.jupiter.api.Assertions.*;
import com.github.trinity.recovery.init.InitializerConfig;
import com.github.trinity.recovery.init.InitializerType;
import com.github.trinity.recovery.operator.SensingModel;
import com.github.trinity.recovery.operator.SignalShape;
import com.github.trinity.recovery.projection.SymmetricRankProjection;
import com.github.trinity.recovery.solver.SolverConfig;
import com.github.trinity.recovery.solver.SolverType;
import com.github.trinity.recovery.util.Nonlinearity;
import org.junit.jupiter.api.Test;

/**
 * Rank-one phase retrieval end to end: magnitude measurements from rank-one Gaussian sensing,
 * power method start, amplitude PGD.
 */
class PhaseRetrievalScenarioTest {

    @Test
    void testRecoversRankOneSignalUpToSign() {
        int d = 20;
        TrialConfig config = TrialConfig.builder()
            .signalModel(SignalModel.SYMMETRIC_PSD)
            .shape(SignalShape.matrix(d, d))
            .rank(1)
            .sensingModel(SensingModel.RANK_ONE)
            .measurements(400)
            .nonlinearity(Nonlinearity.ABSOLUTE_VALUE)
            .initializer(InitializerType.POWER_METHOD, InitializerConfig.builder()
                .powerIterations(30).projection(new SymmetricRankProjection(1)).build())
            .solver(SolverType.PGD_AMPLITUDE, SolverConfig.builder()
                .iterations(300).stepSize(0.3).projection(new SymmetricRankProjection(1)).build())
            .build();

        AggregateResult result = new MultiTrialAggregator().aggregate(config, 20, 2024L);
        assertEquals(0, result.getFailureCount());
        assertTrue(result.getSuccessProbability() >= 0.8, result.toString());
        double[] errors = result.getMeanErrors();
        assertTrue(errors[errors.length - 1] < errors[0]);
    }
}
