package com.github.trinity.recovery.operator;

import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Declared shape of a signal: a d1 x d2 matrix, or a length-d vector stored as d x 1.
 *
 * @author Sean Phillips
 */
public final class SignalShape {

    private final int rows;
    private final int cols;

    public SignalShape(int rows, int cols) {
        if (rows < 1 || cols < 1) {
            throw new ConfigurationException(String.format("Invalid signal shape %dx%d", rows, cols));
        }
        this.rows = rows;
        this.cols = cols;
    }

    public static SignalShape matrix(int rows, int cols) {
        return new SignalShape(rows, cols);
    }

    public static SignalShape vector(int length) {
        return new SignalShape(length, 1);
    }

    public static SignalShape of(RealMatrix x) {
        return new SignalShape(x.getRowDimension(), x.getColumnDimension());
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    /** Number of entries, the ambient dimension of the flattened signal. */
    public int size() {
        return rows * cols;
    }

    public boolean isVector() {
        return cols == 1;
    }

    public boolean isSquare() {
        return rows == cols;
    }

    public void check(RealMatrix x) {
        if (x.getRowDimension() != rows || x.getColumnDimension() != cols) {
            throw DimensionMismatchException.signal(rows, cols, x.getRowDimension(), x.getColumnDimension());
        }
    }

    public void requireSquare(String purpose) {
        if (!isSquare()) {
            throw new ConfigurationException(String.format(
                "%s requires d1 == d2, got %dx%d", purpose, rows, cols));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SignalShape)) {
            return false;
        }
        SignalShape other = (SignalShape) o;
        return rows == other.rows && cols == other.cols;
    }

    @Override
    public int hashCode() {
        return 31 * rows + cols;
    }

    @Override
    public String toString() {
        return rows + "x" + cols;
    }
}
