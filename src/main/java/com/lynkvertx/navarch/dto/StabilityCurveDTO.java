package com.lynkvertx.navarch.dto;

import com.lynkvertx.navarch.service.hydrostatics.StabilityMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;

/**
 * Righting-arm (GZ) curve of one loadcase, in increasing heel order.
 * Also accepted as input when criteria are checked against a supplied curve.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StabilityCurveDTO {

    private Long loadcaseId;

    private StabilityMethod method;

    /** Upright draft (m) */
    private BigDecimal draft;

    /** Displaced weight (kg) */
    private BigDecimal displacement;

    private BigDecimal dispVolume;

    private BigDecimal kg;

    /** Upright transverse metacentric height (m) */
    private BigDecimal gmt;

    @Valid
    @NotNull(message = "Curve points are required")
    private List<Point> points;

    private BigDecimal maxGz;

    /** Heel at the first maximum of GZ in scan order (deg) */
    private BigDecimal angleOfMaxGz;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Point {
        /** Heel angle (deg) */
        @NotNull(message = "Heel angle is required")
        private BigDecimal angle;
        /** Righting arm (m) */
        @NotNull(message = "GZ is required")
        private BigDecimal gz;
        /** Righting arm about the keel (m) */
        private BigDecimal kn;
    }
}
