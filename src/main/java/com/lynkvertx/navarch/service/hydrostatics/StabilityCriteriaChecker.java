package com.lynkvertx.navarch.service.hydrostatics;

import com.lynkvertx.navarch.config.StabilityCriteriaConfig;
import com.lynkvertx.navarch.dto.CriteriaResultDTO;
import com.lynkvertx.navarch.dto.StabilityCurveDTO;
import com.lynkvertx.navarch.exception.InvalidOperationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Evaluates a completed GZ curve against the intact stability criteria of
 * {@link StabilityCriteriaConfig}. Areas are trapezoids over the curve in
 * metre-radians, with GZ interpolated at the limits. A criterion the curve
 * does not reach fails with a note.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StabilityCriteriaChecker {

    private static final int MIN_POINTS = 3;
    private static final BigDecimal DEG_0 = BigDecimal.ZERO;
    private static final BigDecimal DEG_30 = BigDecimal.valueOf(30);
    private static final BigDecimal DEG_40 = BigDecimal.valueOf(40);

    private final StabilityCriteriaConfig criteria;
    private final NumericPolicy numeric;

    /**
     * @throws InvalidOperationException for a curve of fewer than three points
     * @throws IllegalArgumentException  when heel angles do not increase strictly
     */
    public CriteriaResultDTO check(StabilityCurveDTO curve) {
        List<StabilityCurveDTO.Point> points = curve == null ? null : curve.getPoints();
        if (points == null || points.size() < MIN_POINTS) {
            throw new InvalidOperationException("A GZ curve of at least " + MIN_POINTS + " points is required, got "
                + (points == null ? 0 : points.size()));
        }
        for (int k = 1; k < points.size(); k++) {
            if (points.get(k).getAngle().compareTo(points.get(k - 1).getAngle()) <= 0) {
                throw new IllegalArgumentException("Heel angles must increase strictly; "
                    + points.get(k).getAngle() + "° follows " + points.get(k - 1).getAngle() + "°");
            }
        }

        List<CriteriaResultDTO.Criterion> results = new ArrayList<>();
        results.add(minimum("Area under GZ 0° to 30°", criteria.getMinArea030(),
            area(points, DEG_0, DEG_30), "m·rad", "curve does not cover 0° to 30°"));
        results.add(minimum("Area under GZ 0° to 40°", criteria.getMinArea040(),
            area(points, DEG_0, DEG_40), "m·rad", "curve does not cover 0° to 40°"));
        results.add(minimum("Area under GZ 30° to 40°", criteria.getMinArea3040(),
            area(points, DEG_30, DEG_40), "m·rad", "curve does not cover 30° to 40°"));
        results.add(minimum("GZ at 30°", criteria.getMinGzAt30(),
            gzAt(points, DEG_30), "m", "curve does not reach 30°"));
        results.add(minimum("Angle of maximum GZ", criteria.getMinAngleOfMaxGz(),
            angleOfMaxGz(points), "deg", null));
        results.add(minimum("Initial GMt", criteria.getMinInitialGmt(),
            numeric.round(curve.getGmt()), "m", "initial GMt not available"));

        List<String> failed = results.stream()
            .filter(result -> !result.isPassed())
            .map(CriteriaResultDTO.Criterion::getName)
            .collect(Collectors.toList());
        boolean passed = failed.isEmpty();
        String summary = passed
            ? "All " + results.size() + " criteria passed"
            : failed.size() + " of " + results.size() + " criteria failed: " + String.join(", ", failed);
        log.info("Stability criteria ({}) for loadcase {}: {}", criteria.getStandard(), curve.getLoadcaseId(), summary);

        return CriteriaResultDTO.builder()
            .standard(criteria.getStandard())
            .passed(passed)
            .criteria(results)
            .summary(summary)
            .build();
    }

    private CriteriaResultDTO.Criterion minimum(String name, BigDecimal required, BigDecimal actual,
                                                String unit, String missingNote) {
        boolean passed = actual != null && actual.compareTo(required) >= 0;
        return CriteriaResultDTO.Criterion.builder()
            .name(name)
            .required(required)
            .actual(actual)
            .unit(unit)
            .passed(passed)
            .notes(actual == null ? missingNote : null)
            .build();
    }

    /** Area under GZ between two heels (deg), in m·rad; null when the curve does not span them */
    BigDecimal area(List<StabilityCurveDTO.Point> points, BigDecimal from, BigDecimal to) {
        if (!covers(points, from) || !covers(points, to)) {
            return null;
        }
        MathContext mc = numeric.mc();
        List<BigDecimal> angles = new ArrayList<>();
        List<BigDecimal> gz = new ArrayList<>();
        angles.add(from);
        gz.add(interpolate(points, from));
        for (StabilityCurveDTO.Point point : points) {
            if (point.getAngle().compareTo(from) > 0 && point.getAngle().compareTo(to) < 0) {
                angles.add(point.getAngle());
                gz.add(point.getGz());
            }
        }
        angles.add(to);
        gz.add(interpolate(points, to));

        BigDecimal sum = BigDecimal.ZERO;
        for (int k = 1; k < angles.size(); k++) {
            BigDecimal width = numeric.toRadians(angles.get(k).subtract(angles.get(k - 1), mc));
            sum = sum.add(width.multiply(gz.get(k).add(gz.get(k - 1), mc), mc).multiply(NumericPolicy.HALF, mc), mc);
        }
        return numeric.round(sum);
    }

    private BigDecimal gzAt(List<StabilityCurveDTO.Point> points, BigDecimal angle) {
        return covers(points, angle) ? numeric.round(interpolate(points, angle)) : null;
    }

    private static BigDecimal angleOfMaxGz(List<StabilityCurveDTO.Point> points) {
        StabilityCurveDTO.Point max = points.get(0);
        for (StabilityCurveDTO.Point point : points) {
            if (point.getGz().compareTo(max.getGz()) > 0) {
                max = point;
            }
        }
        return max.getAngle();
    }

    private static boolean covers(List<StabilityCurveDTO.Point> points, BigDecimal angle) {
        return points.get(0).getAngle().compareTo(angle) <= 0
            && points.get(points.size() - 1).getAngle().compareTo(angle) >= 0;
    }

    private BigDecimal interpolate(List<StabilityCurveDTO.Point> points, BigDecimal angle) {
        MathContext mc = numeric.mc();
        for (int k = 1; k < points.size(); k++) {
            StabilityCurveDTO.Point upper = points.get(k);
            if (angle.compareTo(upper.getAngle()) <= 0) {
                StabilityCurveDTO.Point lower = points.get(k - 1);
                BigDecimal fraction = numeric.divide(angle.subtract(lower.getAngle(), mc),
                    upper.getAngle().subtract(lower.getAngle(), mc));
                return lower.getGz().add(upper.getGz().subtract(lower.getGz(), mc).multiply(fraction, mc), mc);
            }
        }
        return points.get(points.size() - 1).getGz();
    }
}
