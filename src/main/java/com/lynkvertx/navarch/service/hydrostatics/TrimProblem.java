package com.lynkvertx.navarch.service.hydrostatics;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Inputs of one trim solve. Drafts are at the aft and forward stations.
 */
@Value
@Builder
public class TrimProblem {

    BigDecimal targetDisplacement;

    @Builder.Default
    DisplacementTarget targetType = DisplacementTarget.WEIGHT;

    BigDecimal initialForwardDraft;
    BigDecimal initialAftDraft;

    /** Null falls back to the configured iteration limit */
    Integer maxIterations;

    /** Null falls back to the configured tolerance, in the unit of the target */
    BigDecimal tolerance;
}
