package com.lynkvertx.navarch.service.hydrostatics;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Loadcase values read once per calculation.
 * KG, LCG and target displacement are optional.
 */
@Value
@Builder
public class LoadcaseSnapshot {

    Long id;
    String name;

    /** Water density, kg/m³ */
    BigDecimal rho;

    /** Vertical centre of gravity above the keel, m */
    BigDecimal kg;

    /** Longitudinal centre of gravity from the aft station, m */
    BigDecimal lcg;

    /** Target displacement, kg */
    BigDecimal targetDisplacement;

    public static LoadcaseSnapshot ofDensity(BigDecimal rho) {
        return LoadcaseSnapshot.builder().rho(rho).build();
    }

    public boolean hasKg() {
        return kg != null;
    }

    public boolean hasLcg() {
        return lcg != null;
    }
}
