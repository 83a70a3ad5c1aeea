package com.lynkvertx.navarch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Hull geometry of a vessel: stations, waterlines and the sparse offset grid.
 * Replaced wholesale on every save.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HullGeometryDTO {

    private Long vesselId;

    @Valid
    @NotNull(message = "Stations are required")
    @Builder.Default
    private List<StationEntry> stations = new ArrayList<>();

    @Valid
    @NotNull(message = "Waterlines are required")
    @Builder.Default
    private List<WaterlineEntry> waterlines = new ArrayList<>();

    @Valid
    @NotNull(message = "Offsets are required")
    @Builder.Default
    private List<OffsetEntry> offsets = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StationEntry {
        @NotNull(message = "Station index is required")
        private Integer index;
        /** Position from the aft end (m) */
        @NotNull(message = "Station x is required")
        private BigDecimal x;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WaterlineEntry {
        @NotNull(message = "Waterline index is required")
        private Integer index;
        /** Height above the keel (m) */
        @NotNull(message = "Waterline z is required")
        @PositiveOrZero(message = "Waterline z must not be negative")
        private BigDecimal z;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OffsetEntry {
        @NotNull(message = "Station index is required")
        private Integer stationIndex;
        @NotNull(message = "Waterline index is required")
        private Integer waterlineIndex;
        @NotNull(message = "Half-breadth is required")
        @PositiveOrZero(message = "Half-breadth must not be negative")
        private BigDecimal halfBreadth;
    }
}
