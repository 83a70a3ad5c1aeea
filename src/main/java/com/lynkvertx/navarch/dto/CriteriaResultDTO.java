package com.lynkvertx.navarch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Verdict of an intact stability criteria check
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CriteriaResultDTO {

    /** Name of the rule set, e.g. IMO A.749(18) */
    private String standard;

    /** True only when every criterion passed */
    private boolean passed;

    private List<Criterion> criteria;

    private String summary;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Criterion {
        private String name;
        private BigDecimal required;
        /** Null when the curve does not cover the criterion */
        private BigDecimal actual;
        private String unit;
        private boolean passed;
        private String notes;
    }
}
