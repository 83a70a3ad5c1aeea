package com.lynkvertx.navarch.service.hydrostatics;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Draft at midships with trim (deg, positive bow up) and heel (deg, positive to starboard).
 */
@Value
public class FloatingCondition {

    BigDecimal draft;
    BigDecimal trimAngle;
    BigDecimal heelAngle;

    public static FloatingCondition upright(BigDecimal draft) {
        return new FloatingCondition(draft, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public static FloatingCondition of(BigDecimal draft, BigDecimal trimAngle, BigDecimal heelAngle) {
        return new FloatingCondition(draft,
            trimAngle != null ? trimAngle : BigDecimal.ZERO,
            heelAngle != null ? heelAngle : BigDecimal.ZERO);
    }

    public boolean isHeeled() {
        return heelAngle.signum() != 0;
    }

    public boolean isTrimmed() {
        return trimAngle.signum() != 0;
    }
}
