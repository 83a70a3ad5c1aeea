package com.lynkvertx.navarch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import javax.validation.constraints.PositiveOrZero;
import javax.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Loadcase Data Transfer Object
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadcaseDTO {

    private Long id;

    private Long vesselId;

    @NotBlank(message = "Loadcase name is required")
    @Size(max = 255, message = "Loadcase name must not exceed 255 characters")
    private String name;

    /** Water density (kg/m³), e.g. 1025 for sea water */
    @NotNull(message = "Density is required")
    @Positive(message = "Density must be positive")
    private BigDecimal rho;

    /** Vertical centre of gravity (m) */
    @PositiveOrZero(message = "KG must not be negative")
    private BigDecimal kg;

    /** Longitudinal centre of gravity from the aft station (m) */
    private BigDecimal lcg;

    /** Target displacement (kg) */
    @Positive(message = "Target displacement must be positive")
    private BigDecimal targetDisplacement;

    @Size(max = 1000, message = "Notes must not exceed 1000 characters")
    private String notes;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
