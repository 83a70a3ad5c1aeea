package com.lynkvertx.navarch.dto;

import com.lynkvertx.navarch.service.hydrostatics.StabilityMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StabilityMethodDTO {

    private StabilityMethod method;

    private String description;

    /** Largest heel (deg) the method is meant for */
    private BigDecimal recommendedMaxAngle;

    private boolean defaultMethod;
}
