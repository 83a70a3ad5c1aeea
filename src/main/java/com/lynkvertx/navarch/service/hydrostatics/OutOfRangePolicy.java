package com.lynkvertx.navarch.service.hydrostatics;

/**
 * Behaviour for heights above the top defined waterline.
 */
public enum OutOfRangePolicy {

    /** Use the top offset; the hull is closed by a deck at the top waterline */
    CLAMP,

    /** Fail with WaterlineRangeException */
    REJECT
}
