package com.lynkvertx.navarch.dto;

import com.lynkvertx.navarch.service.hydrostatics.CurveType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * One curve of form: values against draft in increasing draft order
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurveDTO {

    private CurveType type;

    private String unit;

    private List<Point> points;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Point {
        private BigDecimal draft;
        private BigDecimal value;
    }
}
