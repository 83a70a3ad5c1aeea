package com.lynkvertx.navarch.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * A height above the top defined waterline was requested while the
 * out-of-range policy is REJECT.
 */
@Getter
public class WaterlineRangeException extends InvalidOperationException {

    private final BigDecimal height;
    private final BigDecimal topWaterline;

    public WaterlineRangeException(BigDecimal height, BigDecimal topWaterline) {
        super("Height " + height.toPlainString() + " m is above the top waterline "
            + topWaterline.toPlainString() + " m");
        this.height = height;
        this.topWaterline = topWaterline;
    }
}
