package com.github.trinity.recovery.exception;

/**
 * Base type for every failure raised by the recovery engine. A trial that raises one of these
 * is recorded as failed; the surrounding batch keeps running.
 *
 * @author Sean Phillips
 */
public abstract class RecoveryException extends RuntimeException {

    protected RecoveryException(String message) {
        super(message);
    }

    protected RecoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
