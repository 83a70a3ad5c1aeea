package com.lynkvertx.navarch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result DTO of the curve generator
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurveSetDTO {

    /** Drafts sampled, endpoints exact */
    private List<BigDecimal> drafts;

    /** Requested scalar curves, in request order */
    private List<CurveDTO> curves;

    /** One curve per station when BONJEAN was requested, else empty */
    private List<BonjeanCurveDTO> bonjean;
}
