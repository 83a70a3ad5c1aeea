package com.lynkvertx.navarch.dto;

import com.lynkvertx.navarch.service.hydrostatics.CurveType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;

/**
 * Request DTO for curves of form over a draft range
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CurveRequestDTO {

    /** Loadcase supplying density and KG (KG is needed for GMT) */
    private Long loadcaseId;

    @NotEmpty(message = "At least one curve type is required")
    private List<CurveType> types;

    @NotNull(message = "Minimum draft is required")
    private BigDecimal minDraft;

    @NotNull(message = "Maximum draft is required")
    private BigDecimal maxDraft;

    /** Number of drafts, endpoints included */
    @NotNull(message = "Number of points is required")
    private Integer points;
}
