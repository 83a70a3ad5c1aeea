package com.lynkvertx.navarch.dto;

import com.lynkvertx.navarch.service.hydrostatics.StabilityMethod;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import java.math.BigDecimal;

/**
 * Request DTO for a righting-arm curve
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StabilityRequestDTO {

    /** Loadcase supplying KG and density */
    @NotNull(message = "Loadcase is required")
    private Long loadcaseId;

    /** Upright draft (m); the vessel's design draft when absent */
    @Positive(message = "Draft must be positive")
    private BigDecimal draft;

    private BigDecimal minAngle = BigDecimal.ZERO;

    private BigDecimal maxAngle = BigDecimal.valueOf(90);

    @Positive(message = "Angle increment must be positive")
    private BigDecimal angleIncrement = BigDecimal.valueOf(5);

    private StabilityMethod method = StabilityMethod.FULL_IMMERSION;
}
