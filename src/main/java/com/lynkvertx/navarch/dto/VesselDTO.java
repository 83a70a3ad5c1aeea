package com.lynkvertx.navarch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Positive;
import javax.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Vessel Data Transfer Object
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VesselDTO {

    private Long id;

    @NotBlank(message = "Vessel name is required")
    @Size(max = 255, message = "Vessel name must not exceed 255 characters")
    private String name;

    @Size(max = 1000, message = "Description must not exceed 1000 characters")
    private String description;

    @Positive(message = "Length between perpendiculars must be positive")
    private BigDecimal lpp;

    @Positive(message = "Beam must be positive")
    private BigDecimal beam;

    @Positive(message = "Design draft must be positive")
    private BigDecimal designDraft;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
