package com.lynkvertx.navarch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import java.math.BigDecimal;

/**
 * Request DTO for hydrostatics at a single condition
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HydroConditionRequestDTO {

    /** Loadcase supplying density and KG; default density without KG when absent */
    private Long loadcaseId;

    @NotNull(message = "Draft is required")
    @Positive(message = "Draft must be positive")
    private BigDecimal draft;

    /** Trim angle in degrees, positive bow up */
    @DecimalMin(value = "-90", inclusive = false, message = "Trim angle must be greater than -90")
    @DecimalMax(value = "90", inclusive = false, message = "Trim angle must be less than 90")
    private BigDecimal trimAngle = BigDecimal.ZERO;

    /** Heel angle in degrees, positive to starboard */
    @DecimalMin(value = "-90", inclusive = false, message = "Heel angle must be greater than -90")
    @DecimalMax(value = "90", inclusive = false, message = "Heel angle must be less than 90")
    private BigDecimal heelAngle = BigDecimal.ZERO;
}
