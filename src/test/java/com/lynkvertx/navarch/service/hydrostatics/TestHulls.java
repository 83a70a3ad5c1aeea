package com.lynkvertx.navarch.service.hydrostatics;

import com.lynkvertx.navarch.config.HydrostaticsConfig;
import com.lynkvertx.navarch.config.StabilityCriteriaConfig;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Hull fixtures and engine wiring for tests, built without a Spring context.
 */
final class TestHulls {

    static final BigDecimal SEA_WATER = new BigDecimal("1025");

    private static final MathContext MC = new MathContext(20, RoundingMode.HALF_EVEN);

    private TestHulls() {
    }

    static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    /**
     * Box barge L = 100, B = 20, depth 10: 21 stations 5 m apart, waterlines every metre.
     */
    static HullGeometry boxBarge() {
        HullGeometry.Builder builder = HullGeometry.builder();
        for (int i = 0; i <= 20; i++) {
            builder.station(i, BigDecimal.valueOf(5L * i));
        }
        for (int j = 0; j <= 10; j++) {
            builder.waterline(j, BigDecimal.valueOf(j));
        }
        for (int i = 0; i <= 20; i++) {
            for (int j = 0; j <= 10; j++) {
                builder.offset(i, j, BigDecimal.TEN);
            }
        }
        return builder.build();
    }

    /**
     * Box barge L = 100, B = 20, depth 10 tabulated only at its end stations.
     */
    static HullGeometry endStationBarge() {
        HullGeometry.Builder builder = HullGeometry.builder()
            .station(0, BigDecimal.ZERO)
            .station(1, bd("100"));
        for (int j = 0; j <= 2; j++) {
            builder.waterline(j, BigDecimal.valueOf(5L * j));
            builder.offset(0, j, BigDecimal.TEN);
            builder.offset(1, j, BigDecimal.TEN);
        }
        return builder.build();
    }

    /**
     * Wigley hull y = B/2·(1 - ξ²)(1 - ζ²) with L = 100, B = 10, T = 6.25, tabulated on
     * 21 stations and 13 waterlines from the keel to a depth of 8.125.
     */
    static HullGeometry wigley() {
        BigDecimal length = bd("100");
        BigDecimal halfBeam = bd("5");
        BigDecimal draft = bd("6.25");
        BigDecimal depth = bd("8.125");
        HullGeometry.Builder builder = HullGeometry.builder();
        BigDecimal[] x = new BigDecimal[21];
        for (int i = 0; i <= 20; i++) {
            x[i] = BigDecimal.valueOf(5L * i);
            builder.station(i, x[i]);
        }
        BigDecimal[] z = new BigDecimal[13];
        for (int j = 0; j <= 12; j++) {
            z[j] = depth.multiply(BigDecimal.valueOf(j)).divide(BigDecimal.valueOf(12), MC);
            builder.waterline(j, z[j]);
        }
        BigDecimal halfLength = length.divide(BigDecimal.valueOf(2), MC);
        for (int i = 0; i <= 20; i++) {
            BigDecimal xi = x[i].subtract(halfLength).divide(halfLength, MC);
            BigDecimal lengthwise = BigDecimal.ONE.subtract(xi.multiply(xi, MC));
            for (int j = 0; j <= 12; j++) {
                BigDecimal zeta = draft.subtract(z[j]).divide(draft, MC);
                BigDecimal depthwise = BigDecimal.ONE.subtract(zeta.multiply(zeta, MC));
                BigDecimal y = halfBeam.multiply(lengthwise, MC).multiply(depthwise, MC).max(BigDecimal.ZERO);
                builder.offset(i, j, y);
            }
        }
        return builder.build();
    }

    /**
     * Single station with unevenly spaced waterlines, flaring out from a sharp keel.
     */
    static SectionProfile irregularSection() {
        BigDecimal[] z = {bd("0"), bd("0.5"), bd("1.5"), bd("2.0"), bd("4.0"), bd("5.0")};
        BigDecimal[] y = {bd("0"), bd("2.0"), bd("3.5"), bd("3.8"), bd("4.5"), bd("4.6")};
        return SectionProfile.fromColumn(0, BigDecimal.ZERO, z, y, MC);
    }

    /** Vertical-sided rectangle of half-breadth 10 and height 10 */
    static SectionProfile boxSection() {
        BigDecimal[] z = {bd("0"), bd("5"), bd("10")};
        BigDecimal[] y = {BigDecimal.TEN, BigDecimal.TEN, BigDecimal.TEN};
        return SectionProfile.fromColumn(0, BigDecimal.ZERO, z, y, MC);
    }

    static HydrostaticsConfig config() {
        return new HydrostaticsConfig();
    }

    static NumericPolicy numeric() {
        return new NumericPolicy(config());
    }

    static SimpsonQuadrature quadrature() {
        return new SimpsonQuadrature(numeric());
    }

    static SectionalIntegrator integrator() {
        NumericPolicy numeric = numeric();
        return new SectionalIntegrator(numeric, new SimpsonQuadrature(numeric));
    }

    static HydroCalculator calculator(HydrostaticsConfig config) {
        NumericPolicy numeric = new NumericPolicy(config);
        SimpsonQuadrature quadrature = new SimpsonQuadrature(numeric);
        return new HydroCalculator(config, numeric, quadrature, new SectionalIntegrator(numeric, quadrature));
    }

    static HydroCalculator calculator() {
        return calculator(config());
    }

    static StabilityCriteriaChecker criteriaChecker() {
        return new StabilityCriteriaChecker(new StabilityCriteriaConfig(), numeric());
    }

    static LoadcaseSnapshot seaWater() {
        return LoadcaseSnapshot.ofDensity(SEA_WATER);
    }

    static LoadcaseSnapshot seaWaterWithKg(String kg) {
        return LoadcaseSnapshot.builder().id(1L).name("test").rho(SEA_WATER).kg(bd(kg)).build();
    }
}
