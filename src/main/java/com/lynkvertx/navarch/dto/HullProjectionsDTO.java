package com.lynkvertx.navarch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Lines-plan views of a hull drawn from its offset table: waterlines in the
 * half-breadth plan and buttocks in the profile.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HullProjectionsDTO {

    private Long vesselId;

    @Builder.Default
    private List<WaterlineCurve> waterlines = new ArrayList<>();

    @Builder.Default
    private List<ButtockCurve> buttocks = new ArrayList<>();

    /** Half-breadth against x at one stored waterline; stations without an offset there are left out */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WaterlineCurve {
        private Integer waterlineIndex;
        private BigDecimal z;
        private List<PlanPoint> points;
    }

    /** Height against x where the hull crosses a plane at constant half-breadth y */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ButtockCurve {
        private Integer buttockIndex;
        private BigDecimal y;
        private List<ProfilePoint> points;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlanPoint {
        private BigDecimal x;
        private BigDecimal y;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProfilePoint {
        private BigDecimal x;
        private BigDecimal z;
    }
}
