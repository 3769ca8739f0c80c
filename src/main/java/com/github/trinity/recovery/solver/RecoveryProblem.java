package com.github.trinity.recovery.solver;

import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.exception.DimensionMismatchException;
import com.github.trinity.recovery.operator.LinearOperator;
import com.github.trinity.recovery.operator.SignalShape;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;

/**
 * What a solver or initializer works on: the observed measurements, the operator that produced
 * them, an optional ground truth and the random source for stochastic algorithms. The ground
 * truth is only read for error tracking and never enters an update rule.
 *
 * @author Sean Phillips
 */
public final class RecoveryProblem {

    private final RealVector measurements;
    private final LinearOperator operator;
    private final RealMatrix groundTruth;
    private final RandomGenerator random;

    public RecoveryProblem(RealVector measurements, LinearOperator operator,
                           RealMatrix groundTruth, RandomGenerator random) {
        if (measurements == null || operator == null) {
            throw new ConfigurationException("A recovery problem needs measurements and an operator");
        }
        if (measurements.getDimension() != operator.measurementCount()) {
            throw DimensionMismatchException.measurements(operator.measurementCount(), measurements.getDimension());
        }
        if (groundTruth != null) {
            operator.signalShape().check(groundTruth);
        }
        this.measurements = measurements;
        this.operator = operator;
        this.groundTruth = groundTruth;
        this.random = random;
    }

    public RecoveryProblem(RealVector measurements, LinearOperator operator) {
        this(measurements, operator, null, null);
    }

    public RecoveryProblem withMeasurements(RealVector replacement) {
        return new RecoveryProblem(replacement, operator, groundTruth, random);
    }

    public RecoveryProblem withGroundTruth(RealMatrix replacement) {
        return new RecoveryProblem(measurements, operator, replacement, random);
    }

    public RealVector getMeasurements() {
        return measurements;
    }

    public LinearOperator getOperator() {
        return operator;
    }

    /** @return the ground truth, or {@code null} when the problem carries none */
    public RealMatrix getGroundTruth() {
        return groundTruth;
    }

    public boolean hasGroundTruth() {
        return groundTruth != null;
    }

    /**
     * @throws ConfigurationException when a stochastic algorithm runs on a problem without one
     */
    public RandomGenerator getRandom() {
        if (random == null) {
            throw new ConfigurationException("This problem carries no random source");
        }
        return random;
    }

    public int measurementCount() {
        return operator.measurementCount();
    }

    public double sqrtMeasurementCount() {
        return FastMath.sqrt(operator.measurementCount());
    }

    public SignalShape signalShape() {
        return operator.signalShape();
    }
}
