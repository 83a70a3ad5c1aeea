package com.lynkvertx.navarch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Hydrostatic properties of the hull at one floating condition.
 * Lengths in m, areas in m², volumes in m³, weights in kg. Longitudinal
 * positions are measured forward from the aft station, vertical ones up from the keel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HydroResultDTO {

    /** Draft at midships (m) */
    private BigDecimal draft;

    /** Trim angle (deg, positive bow up) */
    private BigDecimal trimAngle;

    /** Heel angle (deg, positive to starboard) */
    private BigDecimal heelAngle;

    /** Water density used (kg/m³) */
    private BigDecimal rho;

    private BigDecimal dispVolume;

    /** Displaced weight = volume × rho (kg) */
    private BigDecimal dispWeight;

    private BigDecimal kb;
    private BigDecimal lcb;
    private BigDecimal tcb;

    private BigDecimal lcf;
    private BigDecimal awp;

    /** Longitudinal second moment of the waterplane about LCF (m⁴) */
    private BigDecimal iwp;

    /** Transverse second moment of the waterplane about its centroid (m⁴) */
    private BigDecimal iwpTransverse;

    private BigDecimal bmt;
    private BigDecimal bml;

    /** Null when the loadcase has no KG */
    private BigDecimal gmt;
    private BigDecimal gml;

    private BigDecimal cb;
    private BigDecimal cp;
    private BigDecimal cm;
    private BigDecimal cwp;

    /** Stations whose local draft was above the top waterline and clamped to it */
    private int clampedStations;
}
