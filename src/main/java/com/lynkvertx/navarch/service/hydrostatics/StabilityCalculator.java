package com.lynkvertx.navarch.service.hydrostatics;

import com.lynkvertx.navarch.config.HydrostaticsConfig;
import com.lynkvertx.navarch.dto.HydroResultDTO;
import com.lynkvertx.navarch.dto.StabilityCurveDTO;
import com.lynkvertx.navarch.dto.StabilityMethodDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stability Calculator
 *
 * Builds the righting-arm curve of a loadcase over a heel sweep, in increasing
 * heel order. With {@link StabilityMethod#FULL_IMMERSION} the hull is heeled at
 * constant displacement: for every angle the inclined waterline holding the upright
 * volume is found, then {@code KN = yB·cos φ + zB·sin φ} and {@code GZ = KN - KG·sin φ}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StabilityCalculator {

    private static final BigDecimal HALF_TURN = BigDecimal.valueOf(180);
    private static final BigDecimal RIGHT_ANGLE = BigDecimal.valueOf(90);

    private final HydrostaticsConfig config;
    private final NumericPolicy numeric;
    private final HydroCalculator calculator;

    /**
     * Righting-arm curve at the given upright draft.
     *
     * @throws IllegalArgumentException for a loadcase without KG, a non-positive draft or an invalid angle range
     */
    public StabilityCurveDTO computeCurve(HullGeometry geometry, LoadcaseSnapshot loadcase, BigDecimal draft,
                                          BigDecimal minAngle, BigDecimal maxAngle, BigDecimal angleIncrement,
                                          StabilityMethod method, CancellationSignal signal) {
        StabilityMethod resolved = method != null ? method : StabilityMethod.FULL_IMMERSION;
        if (!loadcase.hasKg()) {
            throw new IllegalArgumentException("Loadcase " + loadcase.getName() + " has no KG");
        }
        if (draft == null || draft.signum() <= 0) {
            throw new IllegalArgumentException("Draft must be positive, got " + draft);
        }
        List<BigDecimal> angles = angles(minAngle, maxAngle, angleIncrement, resolved);

        HydroResultDTO upright = calculator.computeAt(geometry, loadcase, FloatingCondition.upright(draft));
        // Full immersion holds the polygon-section volume, not the Simpson volume of the upright hydrostatics
        BigDecimal heldVolume;
        List<StabilityCurveDTO.Point> points;
        if (resolved == StabilityMethod.WALL_SIDED) {
            heldVolume = upright.getDispVolume();
            points = wallSided(upright, loadcase.getKg(), angles, signal);
        } else {
            heldVolume = calculator.immersedAtWaterline(geometry, draft, BigDecimal.ZERO).getVolume();
            points = fullImmersion(geometry, draft, heldVolume, loadcase.getKg(), angles, signal);
        }

        StabilityCurveDTO.Point max = points.get(0);
        for (StabilityCurveDTO.Point point : points) {
            if (point.getGz().compareTo(max.getGz()) > 0) {
                max = point;
            }
        }
        log.info("GZ curve for loadcase {} by {}: {} points, max GZ {} m at {}°",
            loadcase.getId(), resolved, points.size(), max.getGz(), max.getAngle());

        return StabilityCurveDTO.builder()
            .loadcaseId(loadcase.getId())
            .method(resolved)
            .draft(upright.getDraft())
            .displacement(numeric.round(heldVolume.multiply(loadcase.getRho(), numeric.mc())))
            .dispVolume(numeric.round(heldVolume))
            .kg(loadcase.getKg())
            .gmt(upright.getGmt())
            .points(points)
            .maxGz(max.getGz())
            .angleOfMaxGz(max.getAngle())
            .build();
    }

    public List<StabilityMethodDTO> availableMethods() {
        return Arrays.stream(StabilityMethod.values())
            .map(method -> StabilityMethodDTO.builder()
                .method(method)
                .description(method.getDescription())
                .recommendedMaxAngle(method.getRecommendedMaxAngle())
                .defaultMethod(method == StabilityMethod.FULL_IMMERSION)
                .build())
            .collect(Collectors.toList());
    }

    private List<BigDecimal> angles(BigDecimal minAngle, BigDecimal maxAngle, BigDecimal increment,
                                    StabilityMethod method) {
        if (minAngle == null || maxAngle == null || increment == null) {
            throw new IllegalArgumentException("Angle range and increment are required");
        }
        if (increment.signum() <= 0) {
            throw new IllegalArgumentException("Angle increment must be positive, got " + increment);
        }
        if (minAngle.compareTo(maxAngle) >= 0) {
            throw new IllegalArgumentException("Minimum angle " + minAngle + " must be below maximum angle " + maxAngle);
        }
        if (minAngle.abs().compareTo(HALF_TURN) > 0 || maxAngle.abs().compareTo(HALF_TURN) > 0) {
            throw new IllegalArgumentException("Heel angles must lie within ±180°");
        }
        if (method == StabilityMethod.WALL_SIDED
            && (minAngle.abs().compareTo(RIGHT_ANGLE) >= 0 || maxAngle.abs().compareTo(RIGHT_ANGLE) >= 0)) {
            throw new IllegalArgumentException("Wall-sided formula is undefined at ±90° and beyond");
        }
        if (maxAngle.abs().max(minAngle.abs()).compareTo(method.getRecommendedMaxAngle()) > 0) {
            log.warn("{} is meant for heel up to {}°; curve requested to {}°",
                method, method.getRecommendedMaxAngle(), maxAngle.abs().max(minAngle.abs()));
        }
        long count = maxAngle.subtract(minAngle).divide(increment, 0, RoundingMode.FLOOR).longValue() + 1;
        if (count > config.getMaxStabilityPoints()) {
            throw new IllegalArgumentException("At most " + config.getMaxStabilityPoints()
                + " heel angles per curve, got " + count);
        }
        List<BigDecimal> angles = new ArrayList<>((int) count);
        for (long k = 0; k < count; k++) {
            angles.add(minAngle.add(increment.multiply(BigDecimal.valueOf(k))));
        }
        return angles;
    }

    private List<StabilityCurveDTO.Point> wallSided(HydroResultDTO upright, BigDecimal kg, List<BigDecimal> angles,
                                                    CancellationSignal signal) {
        MathContext mc = numeric.mc();
        List<StabilityCurveDTO.Point> points = new ArrayList<>(angles.size());
        for (BigDecimal angle : angles) {
            signal.throwIfCancelled("stability curve");
            BigDecimal sin = numeric.sinDeg(angle);
            BigDecimal tan = numeric.tanDeg(angle);
            BigDecimal gz = sin.multiply(upright.getGmt()
                .add(NumericPolicy.HALF.multiply(upright.getBmt(), mc).multiply(tan.pow(2, mc), mc), mc), mc);
            BigDecimal kn = gz.add(kg.multiply(sin, mc), mc);
            points.add(new StabilityCurveDTO.Point(numeric.round(angle), numeric.round(gz), numeric.round(kn)));
        }
        return points;
    }

    private List<StabilityCurveDTO.Point> fullImmersion(HullGeometry geometry, BigDecimal draft, BigDecimal uprightVolume,
                                                        BigDecimal kg, List<BigDecimal> angles, CancellationSignal signal) {
        MathContext mc = numeric.mc();
        List<StabilityCurveDTO.Point> points = new ArrayList<>(angles.size());
        for (BigDecimal angle : angles) {
            signal.throwIfCancelled("stability curve");
            BigDecimal sin = numeric.sinDeg(angle);
            BigDecimal cos = numeric.cosDeg(angle);
            BigDecimal height = angle.signum() == 0 ? draft : waterlineFor(geometry, uprightVolume, angle, sin, cos);
            ImmersedBody body = calculator.immersedAtWaterline(geometry, height, angle);
            BigDecimal kn = body.getTcb().multiply(cos, mc).add(body.getKb().multiply(sin, mc), mc);
            BigDecimal gz = kn.subtract(kg.multiply(sin, mc), mc);
            log.debug("Heel {}°: h={} V={} yB={} zB={} KN={} GZ={}",
                angle, height, body.getVolume(), body.getTcb(), body.getKb(), kn, gz);
            points.add(new StabilityCurveDTO.Point(numeric.round(angle), numeric.round(gz), numeric.round(kn)));
        }
        return points;
    }

    /**
     * Height of the inclined waterline enclosing {@code volume}, by Illinois false position
     * between the lowest and highest vertex of the hull measured normal to the waterline.
     */
    private BigDecimal waterlineFor(HullGeometry geometry, BigDecimal volume, BigDecimal angle,
                                    BigDecimal sin, BigDecimal cos) {
        MathContext mc = numeric.mc();
        BigDecimal lo = null;
        BigDecimal hi = null;
        for (int i = 0; i < geometry.stationCount(); i++) {
            SectionProfile profile = geometry.profile(i);
            for (int k = 0; k < profile.size(); k++) {
                BigDecimal level = profile.z(k).multiply(cos, mc);
                BigDecimal offset = profile.y(k).multiply(sin, mc);
                BigDecimal starboard = level.subtract(offset, mc);
                BigDecimal port = level.add(offset, mc);
                BigDecimal low = starboard.min(port);
                BigDecimal high = starboard.max(port);
                lo = lo == null ? low : lo.min(low);
                hi = hi == null ? high : hi.max(high);
            }
        }

        BigDecimal tolerance = volume.multiply(config.getHeelRootTolerance(), mc);
        BigDecimal fLo = volume.negate();
        BigDecimal fHi = calculator.immersedAtWaterline(geometry, hi, angle).getVolume().subtract(volume, mc);
        if (fHi.signum() <= 0) {
            return hi;
        }
        int side = 0;
        BigDecimal h = lo;
        for (int iteration = 0; iteration < config.getHeelRootMaxIterations(); iteration++) {
            h = numeric.divide(lo.multiply(fHi, mc).subtract(hi.multiply(fLo, mc), mc), fHi.subtract(fLo, mc));
            BigDecimal f = calculator.immersedAtWaterline(geometry, h, angle).getVolume().subtract(volume, mc);
            if (f.abs().compareTo(tolerance) <= 0) {
                return h;
            }
            if (f.signum() > 0) {
                hi = h;
                fHi = f;
                if (side == 1) {
                    fLo = fLo.multiply(NumericPolicy.HALF, mc);
                }
                side = 1;
            } else {
                lo = h;
                fLo = f;
                if (side == -1) {
                    fHi = fHi.multiply(NumericPolicy.HALF, mc);
                }
                side = -1;
            }
        }
        log.warn("Waterline search at {}° stopped after {} iterations; using h={}",
            angle, config.getHeelRootMaxIterations(), h);
        return h;
    }
}
