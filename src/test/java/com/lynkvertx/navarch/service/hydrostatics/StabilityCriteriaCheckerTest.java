package com.lynkvertx.navarch.service.hydrostatics;

import com.lynkvertx.navarch.dto.CriteriaResultDTO;
import com.lynkvertx.navarch.dto.StabilityCurveDTO;
import com.lynkvertx.navarch.exception.InvalidOperationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.lynkvertx.navarch.service.hydrostatics.TestHulls.bd;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StabilityCriteriaCheckerTest {

    private final StabilityCriteriaChecker checker = TestHulls.criteriaChecker();

    @Test
    void linearCurveAreasInMetreRadians() {
        CriteriaResultDTO result = checker.check(linearCurve(60, "0.5"));

        assertEquals("IMO A.749(18)", result.getStandard());
        assertTrue(result.isPassed());
        assertEquals(6, result.getCriteria().size());
        assertEquals("All 6 criteria passed", result.getSummary());
        assertActual(result, "Area under GZ 0° to 30°", "0.078540");
        assertActual(result, "Area under GZ 0° to 40°", "0.139626");
        assertActual(result, "Area under GZ 30° to 40°", "0.061087");
        assertActual(result, "GZ at 30°", "0.300000");
        assertActual(result, "Angle of maximum GZ", "60");
        assertActual(result, "Initial GMt", "0.500000");
    }

    @Test
    void areaBetweenTabulatedAnglesIsInterpolated() {
        BigDecimal area = checker.area(linearCurve(60, "0.5").getPoints(), bd("5"), bd("15"));

        assertEquals(0.01 * (15 * 15 - 5 * 5) / 2.0 * Math.PI / 180.0, area.doubleValue(), 1e-6);
    }

    @Test
    void lowInitialGmtFailsOnlyThatCriterion() {
        CriteriaResultDTO result = checker.check(linearCurve(60, "0.10"));

        assertFalse(result.isPassed());
        assertEquals("1 of 6 criteria failed: Initial GMt", result.getSummary());
        assertFalse(criterion(result, "Initial GMt").isPassed());
        assertTrue(criterion(result, "GZ at 30°").isPassed());
    }

    @Test
    void criteriaBeyondTheCurveFailWithNote() {
        CriteriaResultDTO result = checker.check(linearCurve(20, null));

        assertFalse(result.isPassed());
        CriteriaResultDTO.Criterion area = criterion(result, "Area under GZ 0° to 30°");
        assertNull(area.getActual());
        assertFalse(area.isPassed());
        assertEquals("curve does not cover 0° to 30°", area.getNotes());
        assertEquals("initial GMt not available", criterion(result, "Initial GMt").getNotes());
        assertNotNull(criterion(result, "Angle of maximum GZ").getActual());
    }

    @Test
    void wigleyCurvePassesIntactCriteria() {
        double[] gz = {0.0, 0.0676, 0.1346, 0.2006, 0.2652, 0.3267, 0.3722, 0.4000, 0.4142, 0.4172,
            0.4117, 0.3999, 0.3834, 0.3630, 0.3400, 0.3162, 0.2933, 0.2731, 0.2538};
        List<StabilityCurveDTO.Point> points = new ArrayList<>();
        for (int k = 0; k < gz.length; k++) {
            points.add(new StabilityCurveDTO.Point(BigDecimal.valueOf(5L * k), BigDecimal.valueOf(gz[k]), null));
        }
        StabilityCurveDTO curve = StabilityCurveDTO.builder().gmt(bd("0.76924")).points(points).build();

        CriteriaResultDTO result = checker.check(curve);

        assertTrue(result.isPassed());
        assertEquals(0, criterion(result, "Angle of maximum GZ").getActual().compareTo(bd("45")));
    }

    @Test
    void repeatedChecksAgree() {
        StabilityCurveDTO curve = linearCurve(60, "0.5");

        assertEquals(checker.check(curve), checker.check(curve));
    }

    @Test
    void rejectsShortCurves() {
        StabilityCurveDTO curve = StabilityCurveDTO.builder()
            .points(Arrays.asList(point(0, "0"), point(10, "0.1")))
            .build();

        assertThrows(InvalidOperationException.class, () -> checker.check(curve));
    }

    @Test
    void rejectsUnorderedAngles() {
        StabilityCurveDTO curve = StabilityCurveDTO.builder()
            .points(Arrays.asList(point(0, "0"), point(20, "0.2"), point(10, "0.1")))
            .build();

        assertThrows(IllegalArgumentException.class, () -> checker.check(curve));
    }

    private static StabilityCurveDTO linearCurve(int maxAngle, String gmt) {
        List<StabilityCurveDTO.Point> points = new ArrayList<>();
        for (int angle = 0; angle <= maxAngle; angle += 10) {
            points.add(point(angle, BigDecimal.valueOf(angle).movePointLeft(2).toPlainString()));
        }
        return StabilityCurveDTO.builder()
            .loadcaseId(1L)
            .gmt(gmt == null ? null : bd(gmt))
            .points(points)
            .build();
    }

    private static StabilityCurveDTO.Point point(int angle, String gz) {
        return new StabilityCurveDTO.Point(BigDecimal.valueOf(angle), bd(gz), null);
    }

    private static CriteriaResultDTO.Criterion criterion(CriteriaResultDTO result, String name) {
        return result.getCriteria().stream()
            .filter(c -> c.getName().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("missing criterion " + name));
    }

    private static void assertActual(CriteriaResultDTO result, String name, String expected) {
        assertEquals(0, criterion(result, name).getActual().compareTo(bd(expected)), name);
    }
}
