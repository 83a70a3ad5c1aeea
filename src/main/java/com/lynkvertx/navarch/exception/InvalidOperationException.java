package com.lynkvertx.navarch.exception;

/**
 * Raised when the hull geometry cannot support the requested calculation,
 * e.g. no station is wetted at the requested draft.
 */
public class InvalidOperationException extends RuntimeException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
