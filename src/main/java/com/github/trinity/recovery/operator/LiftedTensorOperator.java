package com.github.trinity.recovery.operator;

import com.github.trinity.recovery.exception.DimensionMismatchException;
import com.github.trinity.recovery.util.MatrixOps;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Fourth-order lift of a square sensing operator: every measurement matrix A_i becomes
 * A_i (x) A_i and the signal becomes a d^4 tensor, carried as its d^2 x d^2 matricization T.
 * <pre>
 *   forward(T)_i = vec(A_i)^T T vec(A_i)
 *   adjoint(z)   = sum_i z_i vec(A_i) vec(A_i)^T
 * </pre>
 * For T = X (x) X this gives {@code forward(T)_i = <A_i, X>^2}, which removes the sign ambiguity
 * of magnitude measurements at the price of a d^4 state. Only the m base rows are stored; the
 * lifted measurement tensors are never materialized.
 *
 * @author Sean Phillips
 */
public class LiftedTensorOperator implements LinearOperator {

    private final double[][] baseRows;
    private final int d;
    private final SignalShape shape;

    LiftedTensorOperator(double[][] baseRows, int d) {
        this.baseRows = baseRows;
        this.d = d;
        this.shape = SignalShape.matrix(d * d, d * d);
    }

    @Override
    public RealVector forward(RealMatrix tensor) {
        shape.check(tensor);
        double[][] t = MatrixOps.rowsOf(tensor);
        int n = d * d;
        double[] y = new double[baseRows.length];
        for (int i = 0; i < baseRows.length; i++) {
            double[] a = baseRows[i];
            double sum = 0.0;
            for (int p = 0; p < n; p++) {
                double ap = a[p];
                if (ap == 0.0) {
                    continue;
                }
                double[] row = t[p];
                double inner = 0.0;
                for (int q = 0; q < n; q++) {
                    inner += row[q] * a[q];
                }
                sum += ap * inner;
            }
            y[i] = sum;
        }
        return new ArrayRealVector(y, false);
    }

    @Override
    public RealMatrix adjoint(RealVector measurements) {
        if (measurements.getDimension() != baseRows.length) {
            throw DimensionMismatchException.measurements(baseRows.length, measurements.getDimension());
        }
        int n = d * d;
        double[][] out = new double[n][n];
        for (int i = 0; i < baseRows.length; i++) {
            double z = measurements.getEntry(i);
            if (z == 0.0) {
                continue;
            }
            double[] a = baseRows[i];
            for (int p = 0; p < n; p++) {
                double zp = z * a[p];
                if (zp == 0.0) {
                    continue;
                }
                double[] row = out[p];
                for (int q = 0; q < n; q++) {
                    row[q] += zp * a[q];
                }
            }
        }
        return new Array2DRowRealMatrix(out, false);
    }

    @Override
    public int measurementCount() {
        return baseRows.length;
    }

    @Override
    public SignalShape signalShape() {
        return shape;
    }

    /** Side length d of the lifted d x d x d x d tensor. */
    public int getSideLength() {
        return d;
    }
}
