package com.lynkvertx.navarch.service.hydrostatics;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.lynkvertx.navarch.service.hydrostatics.TestHulls.bd;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SimpsonQuadratureTest {

    private static final double EPS = 1e-12;

    private final SimpsonQuadrature quadrature = TestHulls.quadrature();

    @Test
    void integratesCubicExactlyOnEvenSpacing() {
        BigDecimal[] x = values("0", "1", "2", "3", "4");
        BigDecimal[] f = new BigDecimal[x.length];
        for (int i = 0; i < x.length; i++) {
            f[i] = x[i].pow(3);
        }
        // x^4 / 4 from 0 to 4
        assertEquals(64.0, quadrature.integrate(x, f).doubleValue(), EPS);
    }

    @Test
    void integratesQuadraticExactlyOnUnevenSpacing() {
        BigDecimal[] x = values("0", "1", "2.5", "3", "4");
        BigDecimal[] f = new BigDecimal[x.length];
        for (int i = 0; i < x.length; i++) {
            f[i] = x[i].multiply(x[i]);
        }
        assertEquals(64.0 / 3.0, quadrature.integrate(x, f).doubleValue(), EPS);
    }

    @Test
    void oddIntervalCountEndsWithTrapezoid() {
        BigDecimal[] x = values("0", "1", "2", "3");
        BigDecimal[] f = values("0", "1", "4", "9");
        // Simpson over [0, 2] gives 8/3, trapezoid over [2, 3] gives 6.5
        assertEquals(8.0 / 3.0 + 6.5, quadrature.integrate(x, f).doubleValue(), EPS);
    }

    @Test
    void pairBeyondRatioLimitFallsBackToTrapezoids() {
        BigDecimal[] x = values("0", "1", "4");
        BigDecimal[] f = values("0", "1", "16");
        assertEquals(0.5 + 25.5, quadrature.integrate(x, f).doubleValue(), EPS);
    }

    @Test
    void partialIntegralMatchesCompositeRuleAtEveryOrdinate() {
        BigDecimal[] x = values("0", "0.5", "1.5", "2.0", "4.0", "5.0");
        BigDecimal[] f = values("0", "2.0", "3.5", "3.8", "4.5", "4.6");
        for (int k = 1; k < x.length; k++) {
            BigDecimal expected = quadrature.integrate(x, f, k);
            BigDecimal actual = quadrature.integrateTo(x, f, x[k], f[k]);
            assertEquals(expected.doubleValue(), actual.doubleValue(), EPS, "at ordinate " + k);
        }
    }

    @Test
    void partialIntegralIsContinuousAcrossOrdinates() {
        BigDecimal[] x = values("0", "1", "2", "3", "4");
        BigDecimal[] f = values("1", "3", "2", "5", "4");
        BigDecimal below = quadrature.integrateTo(x, f, bd("2.999999"), interpolate(bd("2.999999")));
        BigDecimal above = quadrature.integrateTo(x, f, bd("3.000001"), interpolate(bd("3.000001")));
        assertTrue(above.subtract(below).abs().doubleValue() < 1e-4);
    }

    @Test
    void limitsOutsideTheRangeClamp() {
        BigDecimal[] x = values("0", "1", "2");
        BigDecimal[] f = values("2", "2", "2");
        assertEquals(0, quadrature.integrateTo(x, f, bd("-1"), bd("2")).signum());
        assertEquals(4.0, quadrature.integrateTo(x, f, bd("7"), bd("2")).doubleValue(), EPS);
    }

    @Test
    void rejectsMismatchedLengths() {
        assertThrows(IllegalArgumentException.class,
            () -> quadrature.integrate(values("0", "1"), values("0")));
    }

    private static BigDecimal interpolate(BigDecimal at) {
        // f between x = 2 and x = 4 in partialIntegralIsContinuousAcrossOrdinates
        double v = at.doubleValue();
        double y = v <= 3 ? 2 + 3 * (v - 2) : 5 - (v - 3);
        return new BigDecimal(Double.toString(y));
    }

    private static BigDecimal[] values(String... values) {
        BigDecimal[] result = new BigDecimal[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = bd(values[i]);
        }
        return result;
    }
}
