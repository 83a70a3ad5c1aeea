package com.lynkvertx.navarch.service.hydrostatics;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Upright section below a waterline: full (port + starboard) area,
 * its first moment about the keel, and the half-breadth at the waterline.
 */
@Value
public class SectionProperties {

    public static final SectionProperties DRY =
        new SectionProperties(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal area;
    BigDecimal verticalMoment;
    BigDecimal waterlineHalfBreadth;
}
