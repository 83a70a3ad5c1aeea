package com.lynkvertx.navarch.service.hydrostatics;

import com.lynkvertx.navarch.exception.CalculationCancelledException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative cancellation checked between iterations of long sweeps.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancelled();

    default void throwIfCancelled(String stage) {
        if (isCancelled()) {
            throw new CalculationCancelledException("Calculation cancelled during " + stage);
        }
    }

    static CancellationSignal deadline(Duration timeout) {
        return deadline(timeout, Clock.systemUTC());
    }

    static CancellationSignal deadline(Duration timeout, Clock clock) {
        Instant expiry = clock.instant().plus(timeout);
        return () -> clock.instant().isAfter(expiry);
    }
}
