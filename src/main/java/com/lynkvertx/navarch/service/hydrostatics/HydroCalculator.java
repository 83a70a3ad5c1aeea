package com.lynkvertx.navarch.service.hydrostatics;

import com.lynkvertx.navarch.config.HydrostaticsConfig;
import com.lynkvertx.navarch.dto.HydroResultDTO;
import com.lynkvertx.navarch.exception.InvalidOperationException;
import com.lynkvertx.navarch.exception.WaterlineRangeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Hydrostatic Calculator
 *
 * Integrates the sectional results of every station along the length to give the
 * displaced volume, centres of buoyancy and flotation, waterplane inertias,
 * metacentric radii and heights and form coefficients at one floating condition.
 *
 * The local draft at a station is {@code T + (xMid - x)·tan(trim)}, so positive trim
 * (bow up) deepens the aft stations. Upright conditions integrate each section with
 * Simpson's rule over the waterlines; heeled conditions cut each polygonal section
 * with the inclined waterline and take the waterplane from the chord.
 *
 * Pure function of its arguments: no state is kept between calls.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HydroCalculator {

    private static final BigDecimal RIGHT_ANGLE = BigDecimal.valueOf(90);

    private final HydrostaticsConfig config;
    private final NumericPolicy numeric;
    private final SimpsonQuadrature quadrature;
    private final SectionalIntegrator integrator;

    /**
     * Hydrostatics at a single condition.
     *
     * @throws IllegalArgumentException  for a non-positive draft or density, or trim/heel of 90° or more
     * @throws InvalidOperationException when no station has its local draft inside the waterline range
     * @throws WaterlineRangeException   when a local draft is above the top waterline under REJECT
     */
    public HydroResultDTO computeAt(HullGeometry geometry, LoadcaseSnapshot loadcase, FloatingCondition condition) {
        validate(loadcase, condition);
        MathContext mc = numeric.mc();

        // Step 1: Local drafts along the length
        int n = geometry.stationCount();
        BigDecimal[] x = geometry.stationPositions();
        BigDecimal[] localDraft = new BigDecimal[n];
        BigDecimal tanTrim = numeric.tanDeg(condition.getTrimAngle());
        BigDecimal midX = geometry.midX();
        BigDecimal top = geometry.topWaterline();
        int inRange = 0;
        int clamped = 0;
        for (int i = 0; i < n; i++) {
            BigDecimal d = condition.getDraft().add(midX.subtract(x[i], mc).multiply(tanTrim, mc), mc);
            if (d.compareTo(top) > 0) {
                if (config.getOutOfRangePolicy() == OutOfRangePolicy.REJECT) {
                    throw new WaterlineRangeException(d, top);
                }
                d = top;
                clamped++;
            } else if (d.signum() > 0) {
                inRange++;
            }
            localDraft[i] = d;
        }
        if (inRange == 0) {
            throw new InvalidOperationException("Draft " + condition.getDraft() + " m at trim "
                + condition.getTrimAngle() + "° is outside the waterline range 0.." + top + " m at every station");
        }

        // Step 2: Sectional integrals
        Sections sections = condition.isHeeled()
            ? heeledSections(geometry, localDraft, condition.getHeelAngle())
            : uprightSections(geometry, localDraft);

        // Step 3: Volume and centre of buoyancy
        BigDecimal volume = quadrature.integrate(x, sections.area);
        if (numeric.isNegligible(volume) || volume.signum() <= 0) {
            throw new InvalidOperationException("No immersed volume at draft " + condition.getDraft() + " m");
        }
        BigDecimal lcb = numeric.divide(quadrature.integrate(x, times(x, sections.area)), volume);
        BigDecimal kb = numeric.divide(quadrature.integrate(x, sections.verticalMoment), volume);
        BigDecimal tcb = numeric.divide(quadrature.integrate(x, sections.transverseMoment), volume);

        // Step 4: Waterplane
        BigDecimal awp = quadrature.integrate(x, sections.breadth);
        BigDecimal lcf = numeric.ratioOrNull(quadrature.integrate(x, times(x, sections.breadth)), awp);
        BigDecimal transverseInertia = null;
        BigDecimal longitudinalInertia = null;
        if (lcf != null) {
            BigDecimal centroid = numeric.divide(quadrature.integrate(x, sections.firstMoment), awp);
            transverseInertia = quadrature.integrate(x, sections.secondMoment)
                .subtract(awp.multiply(centroid, mc).multiply(centroid, mc), mc);
            longitudinalInertia = quadrature.integrate(x, times(x, times(x, sections.breadth)))
                .subtract(awp.multiply(lcf, mc).multiply(lcf, mc), mc);
        }
        BigDecimal bmt = numeric.ratioOrNull(transverseInertia, volume);
        BigDecimal bml = numeric.ratioOrNull(longitudinalInertia, volume);

        // Step 5: Metacentric heights
        BigDecimal gmt = null;
        BigDecimal gml = null;
        if (loadcase.hasKg()) {
            gmt = bmt == null ? null : kb.add(bmt, mc).subtract(loadcase.getKg(), mc);
            gml = bml == null ? null : kb.add(bml, mc).subtract(loadcase.getKg(), mc);
        }

        // Step 6: Form coefficients against declared particulars, else measured ones
        BigDecimal length = geometry.getLengthBetweenPerpendiculars() != null
            ? geometry.getLengthBetweenPerpendiculars() : geometry.span();
        BigDecimal beam = geometry.getBeam() != null ? geometry.getBeam() : max(sections.breadth);
        BigDecimal draft = condition.getDraft();
        BigDecimal midshipArea = interpolate(x, sections.area, midX);
        BigDecimal cb = numeric.ratioOrNull(volume, length.multiply(beam, mc).multiply(draft, mc));
        BigDecimal cm = numeric.ratioOrNull(midshipArea, beam.multiply(draft, mc));
        BigDecimal cp = numeric.ratioOrNull(volume, midshipArea.multiply(length, mc));
        BigDecimal cwp = numeric.ratioOrNull(awp, length.multiply(beam, mc));

        BigDecimal weight = volume.multiply(loadcase.getRho(), mc);
        log.debug("Hydrostatics at T={} trim={} heel={}: V={} LCB={} KB={} Awp={} ({} stations clamped)",
            draft, condition.getTrimAngle(), condition.getHeelAngle(), volume, lcb, kb, awp, clamped);

        return HydroResultDTO.builder()
            .draft(numeric.round(draft))
            .trimAngle(numeric.round(condition.getTrimAngle()))
            .heelAngle(numeric.round(condition.getHeelAngle()))
            .rho(loadcase.getRho())
            .dispVolume(numeric.round(volume))
            .dispWeight(numeric.round(weight))
            .kb(numeric.round(kb))
            .lcb(numeric.round(lcb))
            .tcb(numeric.round(tcb))
            .lcf(numeric.round(lcf))
            .awp(numeric.round(awp))
            .iwp(numeric.round(longitudinalInertia))
            .iwpTransverse(numeric.round(transverseInertia))
            .bmt(numeric.round(bmt))
            .bml(numeric.round(bml))
            .gmt(numeric.round(gmt))
            .gml(numeric.round(gml))
            .cb(numeric.round(cb))
            .cp(numeric.round(cp))
            .cm(numeric.round(cm))
            .cwp(numeric.round(cwp))
            .clampedStations(clamped)
            .build();
    }

    /**
     * Hydrostatics for each draft in order, at a common trim and heel.
     * Cancellation is checked before every draft.
     */
    public List<HydroResultDTO> computeTable(HullGeometry geometry, LoadcaseSnapshot loadcase, List<BigDecimal> drafts,
                                             BigDecimal trimAngle, BigDecimal heelAngle, CancellationSignal signal) {
        if (drafts == null || drafts.isEmpty()) {
            throw new IllegalArgumentException("At least one draft is required");
        }
        if (drafts.size() > config.getMaxTableDrafts()) {
            throw new IllegalArgumentException("At most " + config.getMaxTableDrafts()
                + " drafts per table, got " + drafts.size());
        }
        List<HydroResultDTO> rows = new ArrayList<>(drafts.size());
        for (BigDecimal draft : drafts) {
            signal.throwIfCancelled("hydrostatic table");
            rows.add(computeAt(geometry, loadcase, FloatingCondition.of(draft, trimAngle, heelAngle)));
        }
        log.debug("Computed hydrostatic table of {} drafts", rows.size());
        return rows;
    }

    /**
     * Volume and centre of buoyancy below the waterline {@code z·cos(heel) - y·sin(heel) = h}
     * at zero trim, unrounded. The centroid is null when nothing is immersed.
     */
    public ImmersedBody immersedAtWaterline(HullGeometry geometry, BigDecimal waterlineHeight, BigDecimal heelAngle) {
        BigDecimal sin = numeric.sinDeg(heelAngle);
        BigDecimal cos = numeric.cosDeg(heelAngle);
        int n = geometry.stationCount();
        BigDecimal[] x = geometry.stationPositions();
        BigDecimal[] area = new BigDecimal[n];
        BigDecimal[] verticalMoment = new BigDecimal[n];
        BigDecimal[] transverseMoment = new BigDecimal[n];
        for (int i = 0; i < n; i++) {
            HeeledSectionProperties section = integrator.heeled(geometry.profile(i), waterlineHeight, sin, cos);
            area[i] = section.getArea();
            verticalMoment[i] = section.getVerticalMoment();
            transverseMoment[i] = section.getTransverseMoment();
        }
        BigDecimal volume = quadrature.integrate(x, area);
        if (volume.signum() <= 0 || numeric.isNegligible(volume)) {
            return new ImmersedBody(BigDecimal.ZERO, null, null, null);
        }
        return new ImmersedBody(volume,
            numeric.divide(quadrature.integrate(x, times(x, area)), volume),
            numeric.divide(quadrature.integrate(x, transverseMoment), volume),
            numeric.divide(quadrature.integrate(x, verticalMoment), volume));
    }

    private void validate(LoadcaseSnapshot loadcase, FloatingCondition condition) {
        if (condition.getDraft() == null || condition.getDraft().signum() <= 0) {
            throw new IllegalArgumentException("Draft must be positive, got " + condition.getDraft());
        }
        if (loadcase.getRho() == null || loadcase.getRho().signum() <= 0) {
            throw new IllegalArgumentException("Density must be positive, got " + loadcase.getRho());
        }
        if (condition.getTrimAngle().abs().compareTo(RIGHT_ANGLE) >= 0) {
            throw new IllegalArgumentException("Trim angle must be within ±90°, got " + condition.getTrimAngle());
        }
        if (condition.getHeelAngle().abs().compareTo(RIGHT_ANGLE) >= 0) {
            throw new IllegalArgumentException("Heel angle must be within ±90°, got " + condition.getHeelAngle()
                + "; large angles belong to the stability curve");
        }
    }

    private Sections uprightSections(HullGeometry geometry, BigDecimal[] localDraft) {
        MathContext mc = numeric.mc();
        int n = localDraft.length;
        Sections sections = new Sections(n);
        for (int i = 0; i < n; i++) {
            SectionProperties section = integrator.upright(geometry.profile(i), localDraft[i]);
            BigDecimal y = localDraft[i].signum() > 0 ? section.getWaterlineHalfBreadth() : BigDecimal.ZERO;
            sections.area[i] = section.getArea();
            sections.verticalMoment[i] = section.getVerticalMoment();
            sections.transverseMoment[i] = BigDecimal.ZERO;
            sections.breadth[i] = y.multiply(NumericPolicy.TWO, mc);
            sections.firstMoment[i] = BigDecimal.ZERO;
            sections.secondMoment[i] = numeric.divide(
                NumericPolicy.TWO.multiply(y.pow(3, mc), mc), NumericPolicy.THREE);
        }
        return sections;
    }

    private Sections heeledSections(HullGeometry geometry, BigDecimal[] localDraft, BigDecimal heelAngle) {
        MathContext mc = numeric.mc();
        BigDecimal sin = numeric.sinDeg(heelAngle);
        BigDecimal cos = numeric.cosDeg(heelAngle);
        int n = localDraft.length;
        Sections sections = new Sections(n);
        for (int i = 0; i < n; i++) {
            BigDecimal h = localDraft[i].multiply(cos, mc);
            HeeledSectionProperties section = integrator.heeled(geometry.profile(i), h, sin, cos);
            sections.area[i] = section.getArea();
            sections.verticalMoment[i] = section.getVerticalMoment();
            sections.transverseMoment[i] = section.getTransverseMoment();
            if (section.hasChord()) {
                BigDecimal lo = section.getChordStart();
                BigDecimal hi = section.getChordEnd();
                sections.breadth[i] = hi.subtract(lo, mc);
                sections.firstMoment[i] = numeric.divide(hi.pow(2, mc).subtract(lo.pow(2, mc), mc), NumericPolicy.TWO);
                sections.secondMoment[i] = numeric.divide(hi.pow(3, mc).subtract(lo.pow(3, mc), mc), NumericPolicy.THREE);
            } else {
                sections.breadth[i] = BigDecimal.ZERO;
                sections.firstMoment[i] = BigDecimal.ZERO;
                sections.secondMoment[i] = BigDecimal.ZERO;
            }
        }
        return sections;
    }

    private BigDecimal[] times(BigDecimal[] a, BigDecimal[] b) {
        MathContext mc = numeric.mc();
        BigDecimal[] product = new BigDecimal[a.length];
        for (int i = 0; i < a.length; i++) {
            product[i] = a[i].multiply(b[i], mc);
        }
        return product;
    }

    private static BigDecimal max(BigDecimal[] values) {
        BigDecimal max = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            max = max.max(value);
        }
        return max;
    }

    /** Linear interpolation of f over strictly increasing x; at must lie within x */
    private BigDecimal interpolate(BigDecimal[] x, BigDecimal[] f, BigDecimal at) {
        MathContext mc = numeric.mc();
        for (int i = 0; i + 1 < x.length; i++) {
            if (at.compareTo(x[i + 1]) <= 0) {
                BigDecimal fraction = numeric.divide(at.subtract(x[i], mc), x[i + 1].subtract(x[i], mc));
                return f[i].add(f[i + 1].subtract(f[i], mc).multiply(fraction, mc), mc);
            }
        }
        return f[f.length - 1];
    }

    /** Per-station integrands, indexed by station position */
    private static final class Sections {
        private final BigDecimal[] area;
        private final BigDecimal[] verticalMoment;
        private final BigDecimal[] transverseMoment;
        /** Waterline chord length */
        private final BigDecimal[] breadth;
        /** First moment of the chord about the centreline trace */
        private final BigDecimal[] firstMoment;
        /** Second moment of the chord about the centreline trace */
        private final BigDecimal[] secondMoment;

        private Sections(int n) {
            this.area = new BigDecimal[n];
            this.verticalMoment = new BigDecimal[n];
            this.transverseMoment = new BigDecimal[n];
            this.breadth = new BigDecimal[n];
            this.firstMoment = new BigDecimal[n];
            this.secondMoment = new BigDecimal[n];
        }
    }
}
