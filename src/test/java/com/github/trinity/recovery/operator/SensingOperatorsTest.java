package com.github.trinity.recovery.operator;

import static org.junit.jupiter.api.Assertions.*;
import java.util.stream.Stream;
import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.exception.DimensionMismatchException;
import com.github.trinity.recovery.util.MatrixOps;
import com.github.trinity.recovery.util.Tensors;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class SensingOperatorsTest {

    static Stream<Arguments> operators() {
        return Stream.of(
            Arguments.of(SensingModel.GAUSSIAN, SignalShape.matrix(5, 3), 40),
            Arguments.of(SensingModel.GAUSSIAN, SignalShape.vector(12), 7),
            Arguments.of(SensingModel.SYMMETRIC_GAUSSIAN, SignalShape.matrix(4, 4), 30),
            Arguments.of(SensingModel.RANK_ONE, SignalShape.matrix(5, 5), 25),
            Arguments.of(SensingModel.PARTIAL_FOURIER, SignalShape.matrix(4, 6), 18),
            Arguments.of(SensingModel.PARTIAL_FOURIER, SignalShape.vector(16), 16)
        );
    }

    @ParameterizedTest
    @MethodSource("operators")
    void testAdjointness(SensingModel model, SignalShape shape, int m) {
        RandomGenerator rng = new MersenneTwister(11);
        LinearOperator op = SensingOperators.create(model, m, shape, rng);
        assertEquals(m, op.measurementCount());
        assertEquals(shape, op.signalShape());
        for (int trial = 0; trial < 3; trial++) {
            RealMatrix x = MatrixOps.gaussianMatrix(shape.getRows(), shape.getCols(), rng);
            RealVector y = MatrixOps.gaussianVector(m, rng);
            double lhs = op.forward(x).dotProduct(y);
            double rhs = MatrixOps.inner(x, op.adjoint(y));
            assertEquals(lhs, rhs, 1e-9 * (1.0 + Math.abs(lhs)), model + " is not adjoint");
        }
    }

    @Test
    void testLiftedAdjointness() {
        RandomGenerator rng = new MersenneTwister(5);
        LiftedTensorOperator lifted = SensingOperators.lift(
            SensingOperators.symmetricGaussian(15, SignalShape.matrix(3, 3), rng));
        assertEquals(3, lifted.getSideLength());
        assertEquals(SignalShape.matrix(9, 9), lifted.signalShape());
        RealMatrix t = MatrixOps.gaussianMatrix(9, 9, rng);
        RealVector z = MatrixOps.gaussianVector(15, rng);
        double lhs = lifted.forward(t).dotProduct(z);
        double rhs = MatrixOps.inner(t, lifted.adjoint(z));
        assertEquals(lhs, rhs, 1e-9 * (1.0 + Math.abs(lhs)));
    }

    @Test
    void testLiftSquaresLinearMeasurementsOfSymmetricSignals() {
        RandomGenerator rng = new MersenneTwister(8);
        DenseLinearOperator base = SensingOperators.gaussian(20, SignalShape.matrix(4, 4), rng);
        RealMatrix x = MatrixOps.symmetrize(MatrixOps.gaussianMatrix(4, 4, rng));
        RealVector linear = base.forward(x);
        RealVector lifted = SensingOperators.lift(base).forward(Tensors.lift(x));
        for (int i = 0; i < 20; i++) {
            assertEquals(linear.getEntry(i) * linear.getEntry(i), lifted.getEntry(i), 1e-9);
        }
    }

    @Test
    void testLiftMaterializesNonDenseOperators() {
        RandomGenerator rng = new MersenneTwister(21);
        DenseLinearOperator dense = SensingOperators.rankOneGaussian(10, SignalShape.matrix(3, 3), rng);
        LinearOperator wrapped = new LinearOperator() {
            @Override
            public RealVector forward(RealMatrix signal) {
                return dense.forward(signal);
            }

            @Override
            public RealMatrix adjoint(RealVector measurements) {
                return dense.adjoint(measurements);
            }

            @Override
            public int measurementCount() {
                return dense.measurementCount();
            }

            @Override
            public SignalShape signalShape() {
                return dense.signalShape();
            }
        };
        RealMatrix t = MatrixOps.gaussianMatrix(9, 9, rng);
        RealVector expected = SensingOperators.lift(dense).forward(t);
        RealVector actual = SensingOperators.lift(wrapped).forward(t);
        assertEquals(0.0, expected.getDistance(actual), 1e-9);
    }

    @Test
    void testSymmetricMeasurementMatrices() {
        DenseLinearOperator op = SensingOperators.symmetricGaussian(5, SignalShape.matrix(4, 4), new MersenneTwister(3));
        for (int i = 0; i < 5; i++) {
            RealMatrix a = op.measurementMatrix(i);
            assertEquals(0.0, a.subtract(a.transpose()).getFrobeniusNorm(), 1e-12);
        }
    }

    @Test
    void testFromMatrixCopiesInput() {
        double[][] a = {{1, 2, 3}, {0, -1, 4}};
        DenseLinearOperator op = SensingOperators.fromMatrix(a, SignalShape.vector(3));
        a[0][0] = 100;
        RealVector y = op.forward(MatrixOps.reshape(new double[]{1, 1, 1}, 3, 1));
        assertArrayEquals(new double[]{6, 3}, y.toArray(), 1e-12);
    }

    @Test
    void testConfigurationErrors() {
        RandomGenerator rng = new MersenneTwister(1);
        assertThrows(ConfigurationException.class,
            () -> SensingOperators.symmetricGaussian(10, SignalShape.matrix(3, 4), rng));
        assertThrows(ConfigurationException.class,
            () -> SensingOperators.rankOneGaussian(10, SignalShape.matrix(2, 5), rng));
        assertThrows(ConfigurationException.class,
            () -> SensingOperators.partialFourier(13, SignalShape.matrix(3, 4), rng));
        assertThrows(ConfigurationException.class,
            () -> SensingOperators.gaussian(0, SignalShape.vector(4), rng));
        assertThrows(ConfigurationException.class,
            () -> SensingOperators.lift(SensingOperators.gaussian(4, SignalShape.matrix(2, 3), rng)));
    }

    @Test
    void testDimensionMismatch() {
        DenseLinearOperator op = SensingOperators.gaussian(6, SignalShape.matrix(3, 2), new MersenneTwister(2));
        assertThrows(DimensionMismatchException.class, () -> op.forward(MatrixOps.zeros(2, 3)));
        assertThrows(DimensionMismatchException.class, () -> op.adjoint(new ArrayRealVector(5)));
        assertThrows(DimensionMismatchException.class,
            () -> new DenseLinearOperator(new double[][]{{1, 2}, {3}}, SignalShape.vector(2)));
    }

    @Test
    void testAdjointIsSignalShaped() {
        DenseLinearOperator op = SensingOperators.gaussian(6, SignalShape.matrix(3, 2), new MersenneTwister(4));
        RealMatrix back = op.adjoint(new ArrayRealVector(6, 1.0));
        assertEquals(3, back.getRowDimension());
        assertEquals(2, back.getColumnDimension());
    }

    @Test
    void testLinearity() {
        RandomGenerator rng = new MersenneTwister(9);
        LinearOperator op = SensingOperators.partialFourier(10, SignalShape.matrix(3, 4), rng);
        RealMatrix a = MatrixOps.gaussianMatrix(3, 4, rng);
        RealMatrix b = MatrixOps.gaussianMatrix(3, 4, rng);
        RealVector combined = op.forward(a.scalarMultiply(2.0).add(b));
        RealVector separate = op.forward(a).mapMultiply(2.0).add(op.forward(b));
        assertEquals(0.0, combined.getDistance(separate), 1e-10);
    }
}
