package com.lynkvertx.navarch.dto;

import com.lynkvertx.navarch.service.hydrostatics.DisplacementTarget;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import java.math.BigDecimal;

/**
 * Request DTO for the trim solver
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrimSolveRequestDTO {

    /** Loadcase supplying density, LCG and (when the request omits it) the target */
    private Long loadcaseId;

    /** Target displacement; kg for WEIGHT, m³ for VOLUME */
    @Positive(message = "Target displacement must be positive")
    private BigDecimal targetDisplacement;

    private DisplacementTarget targetType = DisplacementTarget.WEIGHT;

    @NotNull(message = "Initial forward draft is required")
    @Positive(message = "Initial forward draft must be positive")
    private BigDecimal initialForwardDraft;

    @NotNull(message = "Initial aft draft is required")
    @Positive(message = "Initial aft draft must be positive")
    private BigDecimal initialAftDraft;

    @Min(value = 1, message = "At least one iteration is required")
    @Max(value = 200, message = "Iteration limit must not exceed 200")
    private Integer maxIterations;

    @Positive(message = "Tolerance must be positive")
    private BigDecimal tolerance;
}
