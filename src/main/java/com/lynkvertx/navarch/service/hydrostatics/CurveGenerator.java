package com.lynkvertx.navarch.service.hydrostatics;

import com.lynkvertx.navarch.config.HydrostaticsConfig;
import com.lynkvertx.navarch.dto.BonjeanCurveDTO;
import com.lynkvertx.navarch.dto.CurveDTO;
import com.lynkvertx.navarch.dto.CurveSetDTO;
import com.lynkvertx.navarch.dto.HydroResultDTO;
import com.lynkvertx.navarch.exception.IntegrationDefectException;
import com.lynkvertx.navarch.exception.WaterlineRangeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Curve Generator
 *
 * Samples the upright hydrostatics at evenly spaced drafts and assembles curves of form.
 * Whenever hydrostatics are computed, displaced volume must not decrease with draft;
 * a decrease is an integration defect and aborts the request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CurveGenerator {

    private final HydrostaticsConfig config;
    private final NumericPolicy numeric;
    private final HydroCalculator calculator;
    private final SectionalIntegrator integrator;

    public CurveSetDTO generate(HullGeometry geometry, LoadcaseSnapshot loadcase, List<CurveType> types,
                                BigDecimal minDraft, BigDecimal maxDraft, int points, CancellationSignal signal) {
        Set<CurveType> requested = validate(loadcase, types, minDraft, maxDraft, points);
        List<BigDecimal> drafts = spacedDrafts(minDraft, maxDraft, points);

        List<CurveDTO> curves = new ArrayList<>();
        Set<CurveType> scalar = EnumSet.copyOf(requested);
        scalar.remove(CurveType.BONJEAN);
        if (!scalar.isEmpty()) {
            List<HydroResultDTO> table = new ArrayList<>(drafts.size());
            for (BigDecimal draft : drafts) {
                signal.throwIfCancelled("curve generation");
                table.add(calculator.computeAt(geometry, loadcase, FloatingCondition.upright(draft)));
            }
            checkMonotonic(table);
            for (CurveType type : requested) {
                if (type != CurveType.BONJEAN) {
                    curves.add(curve(type, table));
                }
            }
        }

        List<BonjeanCurveDTO> bonjean = requested.contains(CurveType.BONJEAN)
            ? bonjean(geometry, drafts, signal)
            : Collections.emptyList();

        log.info("Generated {} curves and {} Bonjean curves over {} drafts from {} to {} m",
            curves.size(), bonjean.size(), drafts.size(), minDraft, maxDraft);
        return CurveSetDTO.builder()
            .drafts(drafts)
            .curves(curves)
            .bonjean(bonjean)
            .build();
    }

    /**
     * {@code points} drafts from min to max inclusive. Interior drafts are rounded to
     * the result scale; the endpoints are exactly the given values.
     */
    List<BigDecimal> spacedDrafts(BigDecimal minDraft, BigDecimal maxDraft, int points) {
        MathContext mc = numeric.mc();
        BigDecimal step = numeric.divide(maxDraft.subtract(minDraft, mc), BigDecimal.valueOf(points - 1L));
        List<BigDecimal> drafts = new ArrayList<>(points);
        drafts.add(minDraft);
        for (int k = 1; k < points - 1; k++) {
            drafts.add(numeric.round(minDraft.add(step.multiply(BigDecimal.valueOf(k), mc), mc)));
        }
        drafts.add(maxDraft);
        return drafts;
    }

    private Set<CurveType> validate(LoadcaseSnapshot loadcase, List<CurveType> types,
                                    BigDecimal minDraft, BigDecimal maxDraft, int points) {
        if (types == null || types.isEmpty()) {
            throw new IllegalArgumentException("At least one curve type is required");
        }
        if (minDraft == null || maxDraft == null) {
            throw new IllegalArgumentException("Draft range is required");
        }
        if (minDraft.signum() <= 0) {
            throw new IllegalArgumentException("Minimum draft must be positive, got " + minDraft);
        }
        if (minDraft.compareTo(maxDraft) >= 0) {
            throw new IllegalArgumentException("Minimum draft " + minDraft + " must be below maximum draft " + maxDraft);
        }
        if (points < 2) {
            throw new IllegalArgumentException("At least two points are required, got " + points);
        }
        if (points > config.getMaxCurvePoints()) {
            throw new IllegalArgumentException("At most " + config.getMaxCurvePoints() + " points per curve, got " + points);
        }
        Set<CurveType> requested = new LinkedHashSet<>(types);
        if (requested.contains(CurveType.GMT) && !loadcase.hasKg()) {
            throw new IllegalArgumentException("GMT curve requires a loadcase with KG");
        }
        return requested;
    }

    private void checkMonotonic(List<HydroResultDTO> table) {
        for (int k = 1; k < table.size(); k++) {
            HydroResultDTO previous = table.get(k - 1);
            HydroResultDTO current = table.get(k);
            if (current.getDispVolume().compareTo(previous.getDispVolume()) < 0) {
                log.error("Displacement decreases from {} m³ at T={} to {} m³ at T={}",
                    previous.getDispVolume(), previous.getDraft(), current.getDispVolume(), current.getDraft());
                throw new IntegrationDefectException("Displacement curve is not monotonic between drafts "
                    + previous.getDraft() + " and " + current.getDraft() + " m");
            }
        }
    }

    private CurveDTO curve(CurveType type, List<HydroResultDTO> table) {
        List<CurveDTO.Point> points = new ArrayList<>(table.size());
        for (HydroResultDTO row : table) {
            points.add(new CurveDTO.Point(row.getDraft(), valueOf(type, row)));
        }
        return CurveDTO.builder()
            .type(type)
            .unit(type.getUnit())
            .points(points)
            .build();
    }

    private static BigDecimal valueOf(CurveType type, HydroResultDTO row) {
        switch (type) {
            case DISPLACEMENT:
                return row.getDispWeight();
            case VOLUME:
                return row.getDispVolume();
            case KB:
                return row.getKb();
            case LCB:
                return row.getLcb();
            case AWP:
                return row.getAwp();
            case GMT:
                return row.getGmt();
            default:
                throw new IllegalArgumentException("Not a scalar curve: " + type);
        }
    }

    private List<BonjeanCurveDTO> bonjean(HullGeometry geometry, List<BigDecimal> drafts, CancellationSignal signal) {
        BigDecimal top = geometry.topWaterline();
        if (config.getOutOfRangePolicy() == OutOfRangePolicy.REJECT) {
            BigDecimal deepest = drafts.get(drafts.size() - 1);
            if (deepest.compareTo(top) > 0) {
                throw new WaterlineRangeException(deepest, top);
            }
        }
        List<BonjeanCurveDTO> curves = new ArrayList<>(geometry.stationCount());
        for (int i = 0; i < geometry.stationCount(); i++) {
            signal.throwIfCancelled("Bonjean curves");
            SectionProfile profile = geometry.profile(i);
            List<CurveDTO.Point> points = new ArrayList<>(drafts.size());
            for (BigDecimal draft : drafts) {
                points.add(new CurveDTO.Point(draft, numeric.round(integrator.upright(profile, draft).getArea())));
            }
            curves.add(BonjeanCurveDTO.builder()
                .stationIndex(profile.getStationIndex())
                .x(profile.getX())
                .points(points)
                .build());
        }
        return curves;
    }
}
