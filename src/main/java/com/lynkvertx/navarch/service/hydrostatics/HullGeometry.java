package com.lynkvertx.navarch.service.hydrostatics;

import com.lynkvertx.navarch.exception.GeometryIncompleteException;
import com.lynkvertx.navarch.exception.WaterlineRangeException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Discretized hull shape: stations along the length, waterlines up from the keel,
 * and half-breadth offsets on the station x waterline grid.
 *
 * Offsets are held in a dense array indexed by position in the sorted station and
 * waterline sequences, with null marking a missing offset. Station and waterline
 * indexes must be contiguous. X is measured forward from the aft end, Z up from the
 * baseline. Immutable; built through {@link #builder()}.
 */
public final class HullGeometry {

    private static final MathContext BUILD_MC = new MathContext(20, RoundingMode.HALF_EVEN);

    private final int firstStationIndex;
    private final int firstWaterlineIndex;
    private final BigDecimal[] stationX;
    private final BigDecimal[] waterlineZ;
    private final BigDecimal[][] offsets;
    private final SectionProfile[] profiles;
    private final BigDecimal lengthBetweenPerpendiculars;
    private final BigDecimal beam;

    private HullGeometry(Builder builder) {
        if (builder.stations.size() < 2) {
            throw new GeometryIncompleteException("At least two stations are required, found " + builder.stations.size());
        }
        if (builder.waterlines.size() < 2) {
            throw new GeometryIncompleteException("At least two waterlines are required, found " + builder.waterlines.size());
        }
        this.firstStationIndex = builder.stations.firstKey();
        this.firstWaterlineIndex = builder.waterlines.firstKey();
        checkContiguous(builder.stations, "Station");
        checkContiguous(builder.waterlines, "Waterline");

        this.stationX = builder.stations.values().toArray(new BigDecimal[0]);
        this.waterlineZ = builder.waterlines.values().toArray(new BigDecimal[0]);
        for (int i = 1; i < stationX.length; i++) {
            if (stationX[i].compareTo(stationX[i - 1]) <= 0) {
                throw new IllegalArgumentException("Station X must increase strictly with index: station "
                    + (firstStationIndex + i) + " at " + stationX[i] + " follows " + stationX[i - 1]);
            }
        }
        if (waterlineZ[0].signum() < 0) {
            throw new IllegalArgumentException("Waterline Z must be measured up from the baseline, found " + waterlineZ[0]);
        }
        for (int j = 1; j < waterlineZ.length; j++) {
            if (waterlineZ[j].compareTo(waterlineZ[j - 1]) <= 0) {
                throw new IllegalArgumentException("Waterline Z must increase strictly with index: waterline "
                    + (firstWaterlineIndex + j) + " at " + waterlineZ[j] + " follows " + waterlineZ[j - 1]);
            }
        }

        this.offsets = new BigDecimal[stationX.length][waterlineZ.length];
        for (OffsetEntry entry : builder.offsets) {
            int i = entry.getStationIndex() - firstStationIndex;
            int j = entry.getWaterlineIndex() - firstWaterlineIndex;
            if (i < 0 || i >= stationX.length || j < 0 || j >= waterlineZ.length) {
                throw new IllegalArgumentException("Offset references unknown station " + entry.getStationIndex()
                    + " / waterline " + entry.getWaterlineIndex());
            }
            if (entry.getHalfBreadth().signum() < 0) {
                throw new IllegalArgumentException("Half-breadth must be non-negative at station "
                    + entry.getStationIndex() + ", waterline " + entry.getWaterlineIndex());
            }
            offsets[i][j] = entry.getHalfBreadth();
        }

        this.profiles = new SectionProfile[stationX.length];
        for (int i = 0; i < stationX.length; i++) {
            if (isEmpty(offsets[i])) {
                throw new GeometryIncompleteException("Station " + (firstStationIndex + i) + " has no offsets");
            }
            profiles[i] = SectionProfile.fromColumn(firstStationIndex + i, stationX[i], waterlineZ, offsets[i], BUILD_MC);
        }
        this.lengthBetweenPerpendiculars = builder.lengthBetweenPerpendiculars;
        this.beam = builder.beam;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int stationCount() {
        return stationX.length;
    }

    public int waterlineCount() {
        return waterlineZ.length;
    }

    public int stationIndex(int position) {
        return firstStationIndex + position;
    }

    public BigDecimal stationX(int position) {
        return stationX[position];
    }

    public BigDecimal[] stationPositions() {
        return stationX.clone();
    }

    public BigDecimal waterlineZ(int position) {
        return waterlineZ[position];
    }

    public SectionProfile profile(int position) {
        return profiles[position];
    }

    /** Offset as defined on the grid, or null when missing */
    public BigDecimal definedOffset(int stationPosition, int waterlinePosition) {
        return offsets[stationPosition][waterlinePosition];
    }

    public BigDecimal aftX() {
        return stationX[0];
    }

    public BigDecimal foreX() {
        return stationX[stationX.length - 1];
    }

    public BigDecimal span() {
        return foreX().subtract(aftX());
    }

    public BigDecimal midX() {
        return aftX().add(foreX()).divide(NumericPolicy.TWO, BUILD_MC);
    }

    public BigDecimal topWaterline() {
        return waterlineZ[waterlineZ.length - 1];
    }

    /** Declared length between perpendiculars, or null */
    public BigDecimal getLengthBetweenPerpendiculars() {
        return lengthBetweenPerpendiculars;
    }

    /** Declared moulded beam, or null */
    public BigDecimal getBeam() {
        return beam;
    }

    /**
     * Half-breadth at a station position and height. Between waterlines the offsets are
     * interpolated linearly; below the lowest waterline they taper to zero at the keel.
     */
    public BigDecimal halfBreadthAt(int stationPosition, BigDecimal z, OutOfRangePolicy policy) {
        if (z.signum() < 0) {
            throw new IllegalArgumentException("Height must be non-negative, got " + z);
        }
        if (z.compareTo(topWaterline()) > 0 && policy == OutOfRangePolicy.REJECT) {
            throw new WaterlineRangeException(z, topWaterline());
        }
        return profiles[stationPosition].halfBreadthAt(z, BUILD_MC);
    }

    private static boolean isEmpty(BigDecimal[] column) {
        for (BigDecimal value : column) {
            if (value != null) {
                return false;
            }
        }
        return true;
    }

    private static void checkContiguous(TreeMap<Integer, BigDecimal> byIndex, String what) {
        int expected = byIndex.firstKey();
        for (Integer index : byIndex.keySet()) {
            if (index != expected) {
                throw new GeometryIncompleteException(what + " indexes are not contiguous: missing " + expected);
            }
            expected++;
        }
    }

    @Value
    private static class OffsetEntry {
        int stationIndex;
        int waterlineIndex;
        BigDecimal halfBreadth;
    }

    public static final class Builder {

        private final TreeMap<Integer, BigDecimal> stations = new TreeMap<>();
        private final TreeMap<Integer, BigDecimal> waterlines = new TreeMap<>();
        private final List<OffsetEntry> offsets = new ArrayList<>();
        private BigDecimal lengthBetweenPerpendiculars;
        private BigDecimal beam;

        private Builder() {
        }

        public Builder station(int index, BigDecimal x) {
            putUnique(stations, index, x, "station");
            return this;
        }

        public Builder waterline(int index, BigDecimal z) {
            putUnique(waterlines, index, z, "waterline");
            return this;
        }

        public Builder offset(int stationIndex, int waterlineIndex, BigDecimal halfBreadth) {
            if (halfBreadth == null) {
                throw new IllegalArgumentException("Half-breadth is required at station " + stationIndex
                    + ", waterline " + waterlineIndex);
            }
            offsets.add(new OffsetEntry(stationIndex, waterlineIndex, halfBreadth));
            return this;
        }

        public Builder particulars(BigDecimal lengthBetweenPerpendiculars, BigDecimal beam) {
            this.lengthBetweenPerpendiculars = positiveOrNull(lengthBetweenPerpendiculars);
            this.beam = positiveOrNull(beam);
            return this;
        }

        public HullGeometry build() {
            return new HullGeometry(this);
        }

        private static void putUnique(Map<Integer, BigDecimal> target, int index, BigDecimal value, String what) {
            if (value == null) {
                throw new IllegalArgumentException("Coordinate is required for " + what + " " + index);
            }
            if (target.putIfAbsent(index, value) != null) {
                throw new IllegalArgumentException("Duplicate " + what + " index " + index);
            }
        }

        private static BigDecimal positiveOrNull(BigDecimal value) {
            return value != null && value.signum() > 0 ? value : null;
        }
    }
}
