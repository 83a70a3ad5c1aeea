package com.lynkvertx.navarch.exception;

/**
 * Hull geometry is missing or too sparse to integrate:
 * fewer than two stations or waterlines, or a station without offsets.
 */
public class GeometryIncompleteException extends InvalidOperationException {

    public GeometryIncompleteException(String message) {
        super(message);
    }
}
