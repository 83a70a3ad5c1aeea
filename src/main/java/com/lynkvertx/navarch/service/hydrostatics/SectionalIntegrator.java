package com.lynkvertx.navarch.service.hydrostatics;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Integrates one station's section below a waterline.
 *
 * Upright sections use composite Simpson over the waterline ordinates with the
 * continuous partial-interval treatment of {@link SimpsonQuadrature#integrateTo}.
 * Heeled sections are integrated exactly: the section is a polygon, so the immersed
 * width is linear in z between breakpoints and Simpson's rule on each piece is exact.
 */
@Component
@RequiredArgsConstructor
public class SectionalIntegrator {

    private enum Regime { FULL, PARTIAL, DRY }

    private final NumericPolicy numeric;
    private final SimpsonQuadrature quadrature;

    /**
     * Area and vertical moment of the upright section below {@code draft}.
     * Drafts above the top waterline integrate the whole section.
     */
    public SectionProperties upright(SectionProfile profile, BigDecimal draft) {
        if (draft.signum() <= 0) {
            return SectionProperties.DRY;
        }
        MathContext mc = numeric.mc();
        BigDecimal level = draft.min(profile.top());
        BigDecimal[] z = profile.heights();
        BigDecimal[] y = profile.halfBreadths();
        BigDecimal[] zy = new BigDecimal[z.length];
        for (int i = 0; i < z.length; i++) {
            zy[i] = z[i].multiply(y[i], mc);
        }
        BigDecimal yAtLevel = profile.halfBreadthAt(level, mc);

        BigDecimal halfArea = quadrature.integrateTo(z, y, level, yAtLevel);
        BigDecimal halfMoment = quadrature.integrateTo(z, zy, level, level.multiply(yAtLevel, mc));
        return new SectionProperties(
            halfArea.multiply(NumericPolicy.TWO, mc),
            halfMoment.multiply(NumericPolicy.TWO, mc),
            yAtLevel);
    }

    /**
     * Immersed part of the section below the inclined waterline
     * {@code z*cos - y*sin = waterlineHeight}; positive heel immerses the starboard side.
     */
    public HeeledSectionProperties heeled(SectionProfile profile, BigDecimal waterlineHeight,
                                         BigDecimal sin, BigDecimal cos) {
        if (sin.signum() < 0) {
            HeeledSectionProperties mirrored = heeled(profile, waterlineHeight, sin.negate(), cos);
            return new HeeledSectionProperties(
                mirrored.getArea(),
                mirrored.getVerticalMoment(),
                mirrored.getTransverseMoment().negate(),
                mirrored.hasChord() ? mirrored.getChordEnd().negate() : null,
                mirrored.hasChord() ? mirrored.getChordStart().negate() : null);
        }
        MathContext mc = numeric.mc();
        boolean level = numeric.isNegligible(sin);

        BigDecimal area = BigDecimal.ZERO;
        BigDecimal verticalMoment = BigDecimal.ZERO;
        BigDecimal transverseMoment = BigDecimal.ZERO;

        for (int k = 0; k + 1 < profile.size(); k++) {
            Segment segment = new Segment(profile.z(k), profile.z(k + 1), profile.y(k), profile.y(k + 1), mc);
            List<BigDecimal> cuts = breakpoints(segment, waterlineHeight, sin, cos, level);
            for (int c = 0; c + 1 < cuts.size(); c++) {
                BigDecimal p = cuts.get(c);
                BigDecimal q = cuts.get(c + 1);
                BigDecimal width = q.subtract(p, mc);
                if (width.signum() <= 0) {
                    continue;
                }
                BigDecimal mid = p.add(q, mc).multiply(NumericPolicy.HALF, mc);
                Regime regime = regimeAt(segment, mid, waterlineHeight, sin, cos, level);
                if (regime == Regime.DRY) {
                    continue;
                }
                BigDecimal[] at = {p, mid, q};
                BigDecimal[] weight = {BigDecimal.ONE, BigDecimal.valueOf(4), BigDecimal.ONE};
                BigDecimal step = numeric.divide(width, NumericPolicy.SIX);
                for (int s = 0; s < 3; s++) {
                    BigDecimal zz = at[s];
                    BigDecimal halfBreadth = segment.halfBreadthAt(zz);
                    BigDecimal immersedWidth;
                    BigDecimal centre;
                    if (regime == Regime.FULL) {
                        immersedWidth = halfBreadth.multiply(NumericPolicy.TWO, mc);
                        centre = BigDecimal.ZERO;
                    } else {
                        BigDecimal edge = waterlineTrace(zz, waterlineHeight, sin, cos);
                        immersedWidth = halfBreadth.subtract(edge, mc);
                        centre = halfBreadth.add(edge, mc).multiply(NumericPolicy.HALF, mc);
                    }
                    BigDecimal dA = weight[s].multiply(step, mc).multiply(immersedWidth, mc);
                    area = area.add(dA, mc);
                    verticalMoment = verticalMoment.add(dA.multiply(zz, mc), mc);
                    transverseMoment = transverseMoment.add(dA.multiply(centre, mc), mc);
                }
            }
        }

        BigDecimal[] chord = chord(profile, waterlineHeight, sin, cos, level);
        return new HeeledSectionProperties(area, verticalMoment, transverseMoment,
            chord == null ? null : chord[0], chord == null ? null : chord[1]);
    }

    /** Segment ends plus the heights where the waterline meets either side */
    private List<BigDecimal> breakpoints(Segment segment, BigDecimal h, BigDecimal sin, BigDecimal cos,
                                         boolean level) {
        List<BigDecimal> cuts = new ArrayList<>(4);
        cuts.add(segment.z0);
        cuts.add(segment.z1);
        if (level) {
            if (cos.signum() != 0) {
                addIfInside(cuts, numeric.divide(h, cos), segment);
            }
        } else {
            for (int side = 1; side >= -1; side -= 2) {
                BigDecimal crossing = sideCrossing(segment, h, sin, cos, side);
                if (crossing != null) {
                    addIfInside(cuts, crossing, segment);
                }
            }
        }
        Collections.sort(cuts);
        return cuts;
    }

    private Regime regimeAt(Segment segment, BigDecimal z, BigDecimal h, BigDecimal sin, BigDecimal cos,
                            boolean level) {
        MathContext mc = numeric.mc();
        if (level) {
            return z.multiply(cos, mc).compareTo(h) <= 0 ? Regime.FULL : Regime.DRY;
        }
        BigDecimal halfBreadth = segment.halfBreadthAt(z);
        BigDecimal edge = waterlineTrace(z, h, sin, cos);
        if (edge.compareTo(halfBreadth.negate()) <= 0) {
            return Regime.FULL;
        }
        return edge.compareTo(halfBreadth) < 0 ? Regime.PARTIAL : Regime.DRY;
    }

    /** Transverse position where the waterline passes height z: (z*cos - h) / sin */
    private BigDecimal waterlineTrace(BigDecimal z, BigDecimal h, BigDecimal sin, BigDecimal cos) {
        MathContext mc = numeric.mc();
        return numeric.divide(z.multiply(cos, mc).subtract(h, mc), sin);
    }

    /**
     * Height where the waterline meets the side y = side * Y(z) of this segment,
     * or null when parallel. Solves z*cos - side*Y(z)*sin = h.
     */
    private BigDecimal sideCrossing(Segment segment, BigDecimal h, BigDecimal sin, BigDecimal cos, int side) {
        MathContext mc = numeric.mc();
        BigDecimal signedSin = side > 0 ? sin : sin.negate();
        BigDecimal denominator = cos.subtract(signedSin.multiply(segment.slope, mc), mc);
        if (numeric.isNegligible(denominator)) {
            return null;
        }
        BigDecimal intercept = segment.y0.subtract(segment.z0.multiply(segment.slope, mc), mc);
        return numeric.divide(h.add(signedSin.multiply(intercept, mc), mc), denominator);
    }

    /**
     * Ends of the waterline chord across the section, measured along the waterline
     * (u = y*cos + z*sin). The section is treated as cut in one contiguous chord.
     */
    private BigDecimal[] chord(SectionProfile profile, BigDecimal h, BigDecimal sin, BigDecimal cos,
                               boolean level) {
        MathContext mc = numeric.mc();
        List<BigDecimal> along = new ArrayList<>();
        for (int k = 0; k + 1 < profile.size(); k++) {
            Segment segment = new Segment(profile.z(k), profile.z(k + 1), profile.y(k), profile.y(k + 1), mc);
            for (int side = 1; side >= -1; side -= 2) {
                BigDecimal z;
                if (level) {
                    z = cos.signum() == 0 ? null : numeric.divide(h, cos);
                } else {
                    z = sideCrossing(segment, h, sin, cos, side);
                }
                if (z == null || z.compareTo(segment.z0) < 0 || z.compareTo(segment.z1) > 0) {
                    continue;
                }
                BigDecimal y = side > 0 ? segment.halfBreadthAt(z) : segment.halfBreadthAt(z).negate();
                along.add(y.multiply(cos, mc).add(z.multiply(sin, mc), mc));
            }
        }
        if (!level) {
            // deck at the top waterline and flat of bottom at the keel
            BigDecimal top = profile.top();
            BigDecimal deckY = waterlineTrace(top, h, sin, cos);
            if (deckY.abs().compareTo(profile.topHalfBreadth()) <= 0) {
                along.add(deckY.multiply(cos, mc).add(top.multiply(sin, mc), mc));
            }
            BigDecimal bottomY = numeric.divide(h.negate(), sin);
            if (profile.y(0).signum() > 0 && bottomY.abs().compareTo(profile.y(0)) <= 0) {
                along.add(bottomY.multiply(cos, mc));
            }
        }
        if (along.isEmpty()) {
            return null;
        }
        return new BigDecimal[]{Collections.min(along), Collections.max(along)};
    }

    private static void addIfInside(List<BigDecimal> cuts, BigDecimal z, Segment segment) {
        if (z.compareTo(segment.z0) > 0 && z.compareTo(segment.z1) < 0) {
            cuts.add(z);
        }
    }

    /** One straight piece of the half-breadth polyline */
    private static final class Segment {
        private final BigDecimal z0;
        private final BigDecimal z1;
        private final BigDecimal y0;
        private final BigDecimal slope;
        private final MathContext mc;

        private Segment(BigDecimal z0, BigDecimal z1, BigDecimal y0, BigDecimal y1, MathContext mc) {
            this.z0 = z0;
            this.z1 = z1;
            this.y0 = y0;
            this.slope = y1.subtract(y0, mc).divide(z1.subtract(z0, mc), mc);
            this.mc = mc;
        }

        private BigDecimal halfBreadthAt(BigDecimal z) {
            return y0.add(z.subtract(z0, mc).multiply(slope, mc), mc);
        }
    }
}
