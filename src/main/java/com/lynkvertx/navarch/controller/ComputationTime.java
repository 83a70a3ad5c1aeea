package com.lynkvertx.navarch.controller;

import com.lynkvertx.navarch.dto.ApiResponse;
import org.springframework.http.ResponseEntity;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs a computation and reports its wall time in the X-Computation-Time-Ms header.
 */
final class ComputationTime {

    static final String HEADER = "X-Computation-Time-Ms";

    private ComputationTime() {
    }

    static <T> ResponseEntity<ApiResponse<T>> timed(String message, Supplier<T> computation) {
        long started = System.nanoTime();
        T result = computation.get();
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        return ResponseEntity.ok()
            .header(HEADER, String.valueOf(elapsed))
            .body(ApiResponse.success(message, result));
    }
}
