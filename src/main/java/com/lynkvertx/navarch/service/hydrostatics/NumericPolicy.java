package com.lynkvertx.navarch.service.hydrostatics;

import com.lynkvertx.navarch.config.HydrostaticsConfig;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Decimal arithmetic policy shared by every engine component.
 *
 * Intermediate values carry {@code mathPrecision} significant digits (HALF_EVEN);
 * reported values are rounded to {@code resultScale} fractional digits (HALF_UP).
 * Trigonometric functions are evaluated in double precision and converted back.
 */
@Component
public class NumericPolicy {

    static final BigDecimal TWO = BigDecimal.valueOf(2);
    static final BigDecimal THREE = BigDecimal.valueOf(3);
    static final BigDecimal SIX = BigDecimal.valueOf(6);
    static final BigDecimal HALF = new BigDecimal("0.5");

    private static final BigDecimal PI = new BigDecimal("3.14159265358979323846264338327950288");
    private static final BigDecimal DEGREES_PER_HALF_TURN = BigDecimal.valueOf(180);
    private static final BigDecimal NEGLIGIBLE = new BigDecimal("1E-12");

    private final MathContext mathContext;
    private final int resultScale;
    private final BigDecimal simpsonRatioLimit;

    public NumericPolicy(HydrostaticsConfig config) {
        int mathPrecision = config.getMathPrecision();
        BigDecimal simpsonRatioLimit = config.getSimpsonRatioLimit();
        if (mathPrecision < 10) {
            throw new IllegalArgumentException("Math precision must be at least 10 digits");
        }
        if (simpsonRatioLimit.compareTo(BigDecimal.ONE) < 0) {
            throw new IllegalArgumentException("Simpson ratio limit must be >= 1");
        }
        this.mathContext = new MathContext(mathPrecision, RoundingMode.HALF_EVEN);
        this.resultScale = config.getResultScale();
        this.simpsonRatioLimit = simpsonRatioLimit;
    }

    public MathContext mc() {
        return mathContext;
    }

    public int getResultScale() {
        return resultScale;
    }

    public BigDecimal getSimpsonRatioLimit() {
        return simpsonRatioLimit;
    }

    /** Round a reported value; null stays null */
    public BigDecimal round(BigDecimal value) {
        return value == null ? null : value.setScale(resultScale, RoundingMode.HALF_UP);
    }

    public BigDecimal divide(BigDecimal numerator, BigDecimal denominator) {
        return numerator.divide(denominator, mathContext);
    }

    /** Quotient, or null when the denominator is zero */
    public BigDecimal ratioOrNull(BigDecimal numerator, BigDecimal denominator) {
        if (numerator == null || denominator == null || denominator.signum() == 0) {
            return null;
        }
        return numerator.divide(denominator, mathContext);
    }

    public BigDecimal toRadians(BigDecimal degrees) {
        return degrees.multiply(PI, mathContext).divide(DEGREES_PER_HALF_TURN, mathContext);
    }

    public BigDecimal toDegrees(BigDecimal radians) {
        return radians.multiply(DEGREES_PER_HALF_TURN, mathContext).divide(PI, mathContext);
    }

    public BigDecimal sinDeg(BigDecimal degrees) {
        if (degrees.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return fromDouble(Math.sin(Math.toRadians(degrees.doubleValue())));
    }

    public BigDecimal cosDeg(BigDecimal degrees) {
        if (degrees.signum() == 0) {
            return BigDecimal.ONE;
        }
        return fromDouble(Math.cos(Math.toRadians(degrees.doubleValue())));
    }

    public BigDecimal tanDeg(BigDecimal degrees) {
        if (degrees.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return fromDouble(Math.tan(Math.toRadians(degrees.doubleValue())));
    }

    /** Angle in degrees whose tangent is the given ratio */
    public BigDecimal atanDeg(BigDecimal ratio) {
        if (ratio.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return fromDouble(Math.toDegrees(Math.atan(ratio.doubleValue())));
    }

    public boolean isNegligible(BigDecimal value) {
        return value.abs().compareTo(NEGLIGIBLE) < 0;
    }

    private BigDecimal fromDouble(double value) {
        return new BigDecimal(value, mathContext);
    }
}
