package com.lynkvertx.navarch.service.hydrostatics;

import com.lynkvertx.navarch.exception.GeometryIncompleteException;
import com.lynkvertx.navarch.exception.WaterlineRangeException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.lynkvertx.navarch.service.hydrostatics.TestHulls.bd;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HullGeometryTest {

    @Test
    void exposesGridExtents() {
        HullGeometry barge = TestHulls.boxBarge();

        assertEquals(21, barge.stationCount());
        assertEquals(11, barge.waterlineCount());
        assertEquals(0, barge.aftX().compareTo(BigDecimal.ZERO));
        assertEquals(0, barge.foreX().compareTo(bd("100")));
        assertEquals(0, barge.midX().compareTo(bd("50")));
        assertEquals(0, barge.topWaterline().compareTo(BigDecimal.TEN));
        assertNull(barge.getLengthBetweenPerpendiculars());
    }

    @Test
    void missingOffsetsAreInterpolatedBetweenWaterlines() {
        HullGeometry geometry = twoStations()
            .offset(0, 0, bd("2")).offset(0, 2, bd("6"))
            .offset(1, 0, bd("2")).offset(1, 1, bd("4")).offset(1, 2, bd("6"))
            .build();

        assertNull(geometry.definedOffset(0, 1));
        assertEquals(0, geometry.profile(0).y(1).compareTo(bd("4")));
        assertEquals(0, geometry.halfBreadthAt(0, bd("0.5"), OutOfRangePolicy.CLAMP).compareTo(bd("3")));
    }

    @Test
    void offsetsBelowTheLowestDefinedOneTaperToTheKeel() {
        HullGeometry geometry = twoStations()
            .offset(0, 2, bd("6"))
            .offset(1, 2, bd("6"))
            .build();

        assertEquals(0, geometry.profile(0).y(0).signum());
        assertEquals(0, geometry.profile(0).y(1).compareTo(bd("3")));
    }

    @Test
    void lowestWaterlineAboveBaselineGainsAKeelPoint() {
        HullGeometry geometry = HullGeometry.builder()
            .station(0, bd("0")).station(1, bd("10"))
            .waterline(0, bd("1")).waterline(1, bd("2"))
            .offset(0, 0, bd("4")).offset(0, 1, bd("4"))
            .offset(1, 0, bd("4")).offset(1, 1, bd("4"))
            .build();

        SectionProfile profile = geometry.profile(0);
        assertEquals(3, profile.size());
        assertEquals(0, profile.z(0).signum());
        assertEquals(0, profile.y(0).signum());
    }

    @Test
    void heightsAboveTheTopWaterlineFollowThePolicy() {
        HullGeometry barge = TestHulls.boxBarge();

        assertEquals(0, barge.halfBreadthAt(3, bd("12"), OutOfRangePolicy.CLAMP).compareTo(BigDecimal.TEN));
        WaterlineRangeException error = assertThrows(WaterlineRangeException.class,
            () -> barge.halfBreadthAt(3, bd("12"), OutOfRangePolicy.REJECT));
        assertEquals(0, error.getTopWaterline().compareTo(BigDecimal.TEN));
        assertThrows(IllegalArgumentException.class,
            () -> barge.halfBreadthAt(3, bd("-0.1"), OutOfRangePolicy.CLAMP));
    }

    @Test
    void declaredParticularsIgnoreNonPositiveValues() {
        HullGeometry geometry = twoStationsFull().particulars(bd("95"), BigDecimal.ZERO).build();

        assertEquals(0, geometry.getLengthBetweenPerpendiculars().compareTo(bd("95")));
        assertNull(geometry.getBeam());
    }

    @Test
    void singleStationIsIncomplete() {
        HullGeometry.Builder builder = HullGeometry.builder()
            .station(0, bd("0"))
            .waterline(0, bd("0")).waterline(1, bd("1"))
            .offset(0, 0, bd("1"));
        assertThrows(GeometryIncompleteException.class, builder::build);
    }

    @Test
    void stationWithoutOffsetsIsIncomplete() {
        HullGeometry.Builder builder = twoStations().offset(0, 0, bd("1"));
        assertThrows(GeometryIncompleteException.class, builder::build);
    }

    @Test
    void gapInStationIndexesIsIncomplete() {
        HullGeometry.Builder builder = HullGeometry.builder()
            .station(0, bd("0")).station(2, bd("10"))
            .waterline(0, bd("0")).waterline(1, bd("1"))
            .offset(0, 0, bd("1")).offset(2, 0, bd("1"));
        assertThrows(GeometryIncompleteException.class, builder::build);
    }

    @Test
    void stationsMustIncreaseAlongTheLength() {
        HullGeometry.Builder builder = HullGeometry.builder()
            .station(0, bd("10")).station(1, bd("10"))
            .waterline(0, bd("0")).waterline(1, bd("1"))
            .offset(0, 0, bd("1")).offset(1, 0, bd("1"));
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void rejectsNegativeHalfBreadth() {
        HullGeometry.Builder builder = twoStationsFull().offset(0, 1, bd("-0.5"));
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void rejectsDuplicateStationIndex() {
        HullGeometry.Builder builder = HullGeometry.builder().station(0, bd("0"));
        assertThrows(IllegalArgumentException.class, () -> builder.station(0, bd("5")));
    }

    @Test
    void rejectsOffsetOnUnknownWaterline() {
        HullGeometry.Builder builder = twoStationsFull().offset(0, 7, bd("1"));
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    private static HullGeometry.Builder twoStations() {
        return HullGeometry.builder()
            .station(0, bd("0")).station(1, bd("10"))
            .waterline(0, bd("0")).waterline(1, bd("1")).waterline(2, bd("2"));
    }

    private static HullGeometry.Builder twoStationsFull() {
        HullGeometry.Builder builder = twoStations();
        for (int i = 0; i <= 1; i++) {
            for (int j = 0; j <= 2; j++) {
                builder.offset(i, j, bd("2"));
            }
        }
        return builder;
    }
}
