package com.github.trinity.recovery.exception;

/**
 * An operator received (or would produce) an array whose shape disagrees with its declared
 * signal shape or measurement count.
 *
 * @author Sean Phillips
 */
public class DimensionMismatchException extends RecoveryException {

    public DimensionMismatchException(String message) {
        super(message);
    }

    public static DimensionMismatchException signal(int expectedRows, int expectedCols, int rows, int cols) {
        return new DimensionMismatchException(String.format(
            "Signal shape %dx%d does not match operator shape %dx%d", rows, cols, expectedRows, expectedCols));
    }

    public static DimensionMismatchException measurements(int expected, int actual) {
        return new DimensionMismatchException(String.format(
            "Measurement vector of length %d does not match operator measurement count %d", actual, expected));
    }
}
