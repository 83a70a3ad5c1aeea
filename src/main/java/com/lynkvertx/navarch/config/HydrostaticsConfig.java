package com.lynkvertx.navarch.config;

import com.lynkvertx.navarch.service.hydrostatics.OutOfRangePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Configuration properties for the hydrostatics engine.
 * Numeric policy, solver tolerances and sweep limits are externalized here
 * so that results can be reproduced against a given application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "navarch.hydrostatics")
public class HydrostaticsConfig {

    /** Significant digits carried through intermediate arithmetic */
    private int mathPrecision = 20;

    /** Fractional digits of every reported value */
    private int resultScale = 6;

    /** Interval ratio above which a Simpson pair is integrated as two trapezoids */
    private BigDecimal simpsonRatioLimit = new BigDecimal("2.0");

    /** Behaviour for heights above the top waterline */
    private OutOfRangePolicy outOfRangePolicy = OutOfRangePolicy.CLAMP;

    /** Water density (kg/m³) used when no loadcase is supplied */
    private BigDecimal defaultDensity = new BigDecimal("1025");

    private int maxTableDrafts = 200;

    private int maxCurvePoints = 500;

    private int maxStabilityPoints = 721;

    /** Deadline for one request's sweep before it is cancelled */
    private Duration requestTimeout = Duration.ofSeconds(30);

    // Trim solver

    private int trimMaxIterations = 20;

    /** Displacement tolerance; kg for weight targets, m³ for volume targets */
    private BigDecimal trimTolerance = new BigDecimal("100");

    /** Finite-difference perturbation of mean draft (m) */
    private BigDecimal trimDraftPerturbation = new BigDecimal("0.01");

    /** Finite-difference perturbation of trim angle (deg) */
    private BigDecimal trimAnglePerturbation = new BigDecimal("0.01");

    /** Largest mean-draft change allowed in one Newton step (m) */
    private BigDecimal trimMaxDraftStep = new BigDecimal("0.5");

    /** Largest trim-angle change allowed in one Newton step (deg) */
    private BigDecimal trimMaxAngleStep = new BigDecimal("1.0");

    /** Allowed |LCB - LCG| at trim equilibrium (m) */
    private BigDecimal trimLcbTolerance = new BigDecimal("0.001");

    // Heeled waterline search

    /** Relative volume tolerance of the heeled waterline search */
    private BigDecimal heelRootTolerance = new BigDecimal("1E-10");

    private int heelRootMaxIterations = 100;

    // Lines plan

    /** Buttocks drawn when the request does not say how many */
    private int defaultButtocks = 5;

    private int maxButtocks = 50;
}
