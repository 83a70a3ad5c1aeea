package com.lynkvertx.navarch.service.hydrostatics;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Immersed part of a section cut by an inclined waterline.
 *
 * Moments are taken in the body frame (y to starboard, z up from the keel).
 * The chord is where the waterline crosses the section, given as distances along
 * the waterline from the centreline trace; both are null when the waterline misses
 * the section.
 */
@Value
public class HeeledSectionProperties {

    BigDecimal area;
    BigDecimal verticalMoment;
    BigDecimal transverseMoment;
    BigDecimal chordStart;
    BigDecimal chordEnd;

    public boolean hasChord() {
        return chordStart != null;
    }
}
