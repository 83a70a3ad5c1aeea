package com.lynkvertx.navarch.service.hydrostatics;

/**
 * Curves of form available from the curve generator, with the unit of their values.
 */
public enum CurveType {
    DISPLACEMENT("kg"),
    VOLUME("m³"),
    KB("m"),
    LCB("m"),
    AWP("m²"),
    GMT("m"),
    /** Sectional area against draft, one curve per station */
    BONJEAN("m²");

    private final String unit;

    CurveType(String unit) {
        this.unit = unit;
    }

    public String getUnit() {
        return unit;
    }
}
