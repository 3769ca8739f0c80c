package com.github.trinity.recovery.operator;

import com.github.trinity.recovery.exception.DimensionMismatchException;
import com.github.trinity.recovery.util.MatrixOps;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Operator backed by an explicit m x n sensing matrix whose i-th row is vec(A_i), with
 * n = d1 * d2 and row-major vectorization. Measurement i is {@code <A_i, X>}.
 *
 * @author Sean Phillips
 */
public class DenseLinearOperator implements LinearOperator {

    private final double[][] rows;
    private final SignalShape shape;

    /**
     * @param rows  sensing matrix, one flattened measurement matrix per row; owned by the operator
     * @param shape declared signal shape, rows[i].length must equal shape.size()
     */
    public DenseLinearOperator(double[][] rows, SignalShape shape) {
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != shape.size()) {
                throw new DimensionMismatchException(String.format(
                    "Sensing row %d has %d entries, signal shape %s needs %d", i, rows[i].length, shape, shape.size()));
            }
        }
        this.rows = rows;
        this.shape = shape;
    }

    @Override
    public RealVector forward(RealMatrix signal) {
        shape.check(signal);
        double[] x = MatrixOps.vectorize(signal);
        double[] y = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            double[] a = rows[i];
            double sum = 0.0;
            for (int j = 0; j < a.length; j++) {
                sum += a[j] * x[j];
            }
            y[i] = sum;
        }
        return new ArrayRealVector(y, false);
    }

    @Override
    public RealMatrix adjoint(RealVector measurements) {
        if (measurements.getDimension() != rows.length) {
            throw DimensionMismatchException.measurements(rows.length, measurements.getDimension());
        }
        double[] out = new double[shape.size()];
        for (int i = 0; i < rows.length; i++) {
            double c = measurements.getEntry(i);
            if (c == 0.0) {
                continue;
            }
            double[] a = rows[i];
            for (int j = 0; j < a.length; j++) {
                out[j] += c * a[j];
            }
        }
        return MatrixOps.reshape(out, shape.getRows(), shape.getCols());
    }

    @Override
    public int measurementCount() {
        return rows.length;
    }

    @Override
    public SignalShape signalShape() {
        return shape;
    }

    /**
     * Copy of the i-th measurement matrix in signal shape.
     */
    public RealMatrix measurementMatrix(int i) {
        return MatrixOps.reshape(rows[i].clone(), shape.getRows(), shape.getCols());
    }

    double[][] rowsRef() {
        return rows;
    }
}
