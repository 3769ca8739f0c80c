package com.github.trinity.recovery.exception;

/**
 * An iterate or intermediate quantity left the range where the algorithm is meaningful:
 * it became NaN/Inf, exceeded a stability bound or collapsed to zero.
 *
 * @author Sean Phillips
 */
public class NumericalDivergenceException extends RecoveryException {

    public NumericalDivergenceException(String message) {
        super(message);
    }

    public NumericalDivergenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
