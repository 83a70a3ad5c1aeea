package com.lynkvertx.navarch.service.hydrostatics;

import java.math.BigDecimal;

/**
 * Ways of computing the righting-arm curve.
 */
public enum StabilityMethod {

    /** Direct integration of the heeled hull at constant displacement */
    FULL_IMMERSION("Heeled hull integrated at constant displacement; valid to large angles", new BigDecimal("180")),

    /** Wall-sided formula from upright GMt and BMt */
    WALL_SIDED("Wall-sided formula GZ = sin(φ)·(GMt + ½·BMt·tan²φ); deck edge must stay dry", new BigDecimal("25"));

    private final String description;
    private final BigDecimal recommendedMaxAngle;

    StabilityMethod(String description, BigDecimal recommendedMaxAngle) {
        this.description = description;
        this.recommendedMaxAngle = recommendedMaxAngle;
    }

    public String getDescription() {
        return description;
    }

    public BigDecimal getRecommendedMaxAngle() {
        return recommendedMaxAngle;
    }
}
