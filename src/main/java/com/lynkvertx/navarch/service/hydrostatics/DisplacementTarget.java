package com.lynkvertx.navarch.service.hydrostatics;

/**
 * Quantity a trim solution must match: displaced weight in kg or displaced volume in m³.
 */
public enum DisplacementTarget {
    WEIGHT,
    VOLUME
}
