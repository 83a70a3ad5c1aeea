package com.lynkvertx.navarch.service.hydrostatics;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Immersed volume below an inclined waterline and its centroid in the body frame.
 * Values are unrounded.
 */
@Value
public class ImmersedBody {

    BigDecimal volume;
    BigDecimal lcb;
    BigDecimal tcb;
    BigDecimal kb;
}
