package com.lynkvertx.navarch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotEmpty;
import java.math.BigDecimal;
import java.util.List;

/**
 * Request DTO for a hydrostatic table over a list of drafts
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HydroTableRequestDTO {

    private Long loadcaseId;

    /** Drafts in m; results keep this order */
    @NotEmpty(message = "At least one draft is required")
    private List<BigDecimal> drafts;

    private BigDecimal trimAngle = BigDecimal.ZERO;

    private BigDecimal heelAngle = BigDecimal.ZERO;
}
