package com.lynkvertx.navarch.exception;

import java.util.concurrent.CancellationException;

/**
 * Thrown when a sweep or solver loop observes its cancellation signal.
 * No partial result is returned alongside it.
 */
public class CalculationCancelledException extends CancellationException {

    public CalculationCancelledException(String message) {
        super(message);
    }
}
