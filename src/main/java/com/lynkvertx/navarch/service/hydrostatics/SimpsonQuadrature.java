package com.lynkvertx.navarch.service.hydrostatics;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Composite Simpson quadrature over tabulated, possibly unequally spaced ordinates.
 *
 * Intervals are paired from the first ordinate. Each pair uses the three-point
 * Simpson formula for unequal spacing; a pair whose interval ratio exceeds the
 * configured limit, and a trailing unpaired interval, are integrated as trapezoids.
 */
@Component
@RequiredArgsConstructor
public class SimpsonQuadrature {

    private final NumericPolicy numeric;

    /**
     * Integral over all ordinates.
     */
    public BigDecimal integrate(BigDecimal[] x, BigDecimal[] f) {
        checkLengths(x, f);
        return integrate(x, f, x.length - 1);
    }

    /**
     * Integral from x[0] to x[last] using ordinates 0..last only.
     */
    public BigDecimal integrate(BigDecimal[] x, BigDecimal[] f, int last) {
        checkLengths(x, f);
        if (last <= 0) {
            return BigDecimal.ZERO;
        }
        MathContext mc = numeric.mc();
        BigDecimal sum = BigDecimal.ZERO;
        int i = 0;
        while (i + 2 <= last) {
            sum = sum.add(pair(x[i], x[i + 1], x[i + 2], f[i], f[i + 1], f[i + 2]), mc);
            i += 2;
        }
        if (i < last) {
            sum = sum.add(trapezoid(x[i], x[i + 1], f[i], f[i + 1]), mc);
        }
        return sum;
    }

    /**
     * Integral from x[0] to an upper limit that may fall between ordinates.
     *
     * The last interval is a trapezoid to the limit, with {@code fUpper} the integrand
     * value there. When the ordinate below the limit closes an unpaired interval, the
     * Simpson correction of the pair it forms with the next interval is added in
     * proportion to the submerged fraction of that next interval, so the result is
     * continuous in the upper limit and equals the composite rule at every ordinate.
     */
    public BigDecimal integrateTo(BigDecimal[] x, BigDecimal[] f, BigDecimal upper, BigDecimal fUpper) {
        checkLengths(x, f);
        int n = x.length - 1;
        if (upper.compareTo(x[n]) >= 0) {
            return integrate(x, f, n);
        }
        if (upper.compareTo(x[0]) <= 0) {
            return BigDecimal.ZERO;
        }
        MathContext mc = numeric.mc();
        int k = lastOrdinateAtOrBelow(x, upper);
        BigDecimal partial = trapezoid(x[k], upper, f[k], fUpper);
        if (k % 2 == 0) {
            return integrate(x, f, k).add(partial, mc);
        }

        BigDecimal base = integrate(x, f, k - 1);
        BigDecimal closed = trapezoid(x[k - 1], x[k], f[k - 1], f[k]);
        BigDecimal next = trapezoid(x[k], x[k + 1], f[k], f[k + 1]);
        BigDecimal correction = pair(x[k - 1], x[k], x[k + 1], f[k - 1], f[k], f[k + 1])
            .subtract(closed, mc)
            .subtract(next, mc);
        BigDecimal fraction = numeric.divide(upper.subtract(x[k], mc), x[k + 1].subtract(x[k], mc));

        return base.add(closed, mc)
            .add(partial, mc)
            .add(fraction.multiply(correction, mc), mc);
    }

    public BigDecimal trapezoid(BigDecimal x0, BigDecimal x1, BigDecimal f0, BigDecimal f1) {
        MathContext mc = numeric.mc();
        return x1.subtract(x0, mc).multiply(f0.add(f1, mc), mc).multiply(NumericPolicy.HALF, mc);
    }

    /**
     * Three-point Simpson rule for intervals h1 = x1 - x0 and h2 = x2 - x1:
     * (h1+h2)/6 * [(2 - h2/h1) f0 + (h1+h2)^2/(h1 h2) f1 + (2 - h1/h2) f2].
     */
    BigDecimal pair(BigDecimal x0, BigDecimal x1, BigDecimal x2,
                    BigDecimal f0, BigDecimal f1, BigDecimal f2) {
        MathContext mc = numeric.mc();
        BigDecimal h1 = x1.subtract(x0, mc);
        BigDecimal h2 = x2.subtract(x1, mc);
        BigDecimal limit = numeric.getSimpsonRatioLimit();
        BigDecimal ratio = numeric.divide(h2, h1);
        if (ratio.compareTo(limit) > 0 || ratio.multiply(limit, mc).compareTo(BigDecimal.ONE) < 0) {
            return trapezoid(x0, x1, f0, f1).add(trapezoid(x1, x2, f1, f2), mc);
        }
        BigDecimal span = h1.add(h2, mc);
        BigDecimal w0 = NumericPolicy.TWO.subtract(ratio, mc);
        BigDecimal w1 = numeric.divide(span.multiply(span, mc), h1.multiply(h2, mc));
        BigDecimal w2 = NumericPolicy.TWO.subtract(numeric.divide(h1, h2), mc);
        BigDecimal weighted = w0.multiply(f0, mc)
            .add(w1.multiply(f1, mc), mc)
            .add(w2.multiply(f2, mc), mc);
        return numeric.divide(span, NumericPolicy.SIX).multiply(weighted, mc);
    }

    private static int lastOrdinateAtOrBelow(BigDecimal[] x, BigDecimal value) {
        int k = 0;
        for (int i = 1; i < x.length; i++) {
            if (x[i].compareTo(value) <= 0) {
                k = i;
            } else {
                break;
            }
        }
        return k;
    }

    private static void checkLengths(BigDecimal[] x, BigDecimal[] f) {
        if (x.length != f.length) {
            throw new IllegalArgumentException("Abscissae and ordinates differ in length: "
                + x.length + " vs " + f.length);
        }
    }
}
