package com.lynkvertx.navarch.exception;

/**
 * An internal consistency check on integrated results failed.
 * This signals a geometry or quadrature defect, never a legitimate result.
 */
public class IntegrationDefectException extends RuntimeException {

    public IntegrationDefectException(String message) {
        super(message);
    }
}
