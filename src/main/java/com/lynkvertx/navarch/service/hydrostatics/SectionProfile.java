package com.lynkvertx.navarch.service.hydrostatics;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Arrays;

/**
 * Half-breadth profile of one station: a polyline of (z, y) vertices from the keel
 * (z = 0) up to the top waterline, with every missing offset already filled in.
 * Immutable.
 */
public final class SectionProfile {

    private final int stationIndex;
    private final BigDecimal x;
    private final BigDecimal[] z;
    private final BigDecimal[] y;

    SectionProfile(int stationIndex, BigDecimal x, BigDecimal[] z, BigDecimal[] y) {
        this.stationIndex = stationIndex;
        this.x = x;
        this.z = z;
        this.y = y;
    }

    /**
     * Build a profile from one grid column. {@code column[j]} is the offset at
     * {@code waterlineZ[j]} or null when missing; at least one must be present.
     * Gaps are interpolated between present neighbours, heights below the lowest
     * present offset taper linearly to the keel, heights above the highest hold its value.
     */
    static SectionProfile fromColumn(int stationIndex, BigDecimal x, BigDecimal[] waterlineZ,
                                     BigDecimal[] column, MathContext mc) {
        int n = waterlineZ.length;
        int first = -1;
        int last = -1;
        for (int j = 0; j < n; j++) {
            if (column[j] != null) {
                if (first < 0) {
                    first = j;
                }
                last = j;
            }
        }
        if (first < 0) {
            throw new IllegalStateException("Station " + stationIndex + " has no offsets");
        }

        BigDecimal[] filled = new BigDecimal[n];
        int previous = -1;
        for (int j = 0; j < n; j++) {
            if (column[j] != null) {
                filled[j] = column[j];
                previous = j;
            } else if (j < first) {
                // taper to the keel point (0, 0)
                filled[j] = column[first].multiply(waterlineZ[j], mc).divide(waterlineZ[first], mc);
            } else if (j > last) {
                filled[j] = column[last];
            } else {
                int next = j + 1;
                while (column[next] == null) {
                    next++;
                }
                filled[j] = interpolate(waterlineZ[previous], column[previous],
                    waterlineZ[next], column[next], waterlineZ[j], mc);
            }
        }

        if (waterlineZ[0].signum() > 0) {
            BigDecimal[] zz = new BigDecimal[n + 1];
            BigDecimal[] yy = new BigDecimal[n + 1];
            zz[0] = BigDecimal.ZERO;
            yy[0] = BigDecimal.ZERO;
            System.arraycopy(waterlineZ, 0, zz, 1, n);
            System.arraycopy(filled, 0, yy, 1, n);
            return new SectionProfile(stationIndex, x, zz, yy);
        }
        return new SectionProfile(stationIndex, x, waterlineZ.clone(), filled);
    }

    public int getStationIndex() {
        return stationIndex;
    }

    public BigDecimal getX() {
        return x;
    }

    public int size() {
        return z.length;
    }

    public BigDecimal z(int i) {
        return z[i];
    }

    public BigDecimal y(int i) {
        return y[i];
    }

    public BigDecimal top() {
        return z[z.length - 1];
    }

    public BigDecimal topHalfBreadth() {
        return y[y.length - 1];
    }

    BigDecimal[] heights() {
        return z;
    }

    BigDecimal[] halfBreadths() {
        return y;
    }

    /**
     * Half-breadth at height h, linear between vertices. Heights above the top return
     * the top offset, heights at or below the keel return the keel offset.
     */
    public BigDecimal halfBreadthAt(BigDecimal h, MathContext mc) {
        if (h.compareTo(z[0]) <= 0) {
            return y[0];
        }
        int last = z.length - 1;
        if (h.compareTo(z[last]) >= 0) {
            return y[last];
        }
        for (int i = 0; i < last; i++) {
            if (h.compareTo(z[i + 1]) <= 0) {
                return interpolate(z[i], y[i], z[i + 1], y[i + 1], h, mc);
            }
        }
        return y[last];
    }

    private static BigDecimal interpolate(BigDecimal z0, BigDecimal y0, BigDecimal z1, BigDecimal y1,
                                          BigDecimal at, MathContext mc) {
        BigDecimal fraction = at.subtract(z0, mc).divide(z1.subtract(z0, mc), mc);
        return y0.add(y1.subtract(y0, mc).multiply(fraction, mc), mc);
    }

    @Override
    public String toString() {
        return "SectionProfile{station=" + stationIndex + ", x=" + x
            + ", z=" + Arrays.toString(z) + ", y=" + Arrays.toString(y) + "}";
    }
}
