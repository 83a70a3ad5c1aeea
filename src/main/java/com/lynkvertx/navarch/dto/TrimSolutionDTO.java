package com.lynkvertx.navarch.dto;

import com.lynkvertx.navarch.service.hydrostatics.DisplacementTarget;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result DTO of the trim solver: the floating condition found, whether it meets
 * the tolerance, and the step-by-step trace of the iteration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrimSolutionDTO {

    private BigDecimal targetDisplacement;

    private DisplacementTarget targetType;

    /** False when the iteration limit was reached first; the estimate below is still the best one */
    private boolean converged;

    private int iterations;

    /** True when trim was also solved to bring LCB over LCG */
    private boolean longitudinalBalance;

    /** Draft at the aft station (m) */
    private BigDecimal aftDraft;

    /** Draft at the forward station (m) */
    private BigDecimal forwardDraft;

    private BigDecimal meanDraft;

    /** Aft draft minus forward draft (m), positive by the stern */
    private BigDecimal trim;

    /** Trim angle (deg, positive bow up) */
    private BigDecimal trimAngle;

    private BigDecimal lcf;

    /** Moment to change trim one centimetre (t·m/cm) */
    private BigDecimal mtc;

    /** Target minus achieved displacement, in the unit of the target */
    private BigDecimal residual;

    /** LCB minus LCG (m); null without LCG */
    private BigDecimal lcbResidual;

    private HydroResultDTO hydrostatics;

    private List<Iteration> trace;

    /**
     * One solver step: the state evaluated and the step taken from it.
     */
    @Value
    @Builder
    public static class Iteration {
        int iteration;
        BigDecimal meanDraft;
        BigDecimal trimAngle;
        BigDecimal displacement;
        BigDecimal residual;
        /** d(displacement)/d(draft) */
        BigDecimal derivative;
        BigDecimal lcbResidual;
        BigDecimal draftStep;
        BigDecimal trimStep;
    }
}
