package com.lynkvertx.navarch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A reference hull that can be instantiated as a vessel
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateVesselDTO {

    /** Key used in the instantiate endpoint, e.g. WIGLEY */
    private String template;

    private String name;

    private String description;

    private BigDecimal lpp;

    private BigDecimal beam;

    private BigDecimal designDraft;

    private Integer stationCount;

    private Integer waterlineCount;
}
