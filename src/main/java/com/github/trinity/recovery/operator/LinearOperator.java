package com.github.trinity.recovery.operator;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * A linear measurement map and its adjoint.
 * <p>
 * {@link #forward(RealMatrix)} takes a signal of {@link #signalShape()} to a vector of
 * {@link #measurementCount()} measurements; {@link #adjoint(RealVector)} maps a measurement
 * vector back to a signal-shaped array. Implementations satisfy
 * {@code <forward(x), y> = <x, adjoint(y)>} to machine precision, which the gradient of every
 * solver relies on. Both methods reject inputs of the wrong shape with a
 * {@link com.github.trinity.recovery.exception.DimensionMismatchException}.
 * </p>
 *
 * @author Sean Phillips
 */
public interface LinearOperator {

    RealVector forward(RealMatrix signal);

    RealMatrix adjoint(RealVector measurements);

    int measurementCount();

    SignalShape signalShape();
}
