package com.lynkvertx.navarch.service;

import com.lynkvertx.navarch.dto.HullGeometryDTO;
import com.lynkvertx.navarch.dto.HullGeometryDTO.OffsetEntry;
import com.lynkvertx.navarch.dto.HullGeometryDTO.StationEntry;
import com.lynkvertx.navarch.dto.HullGeometryDTO.WaterlineEntry;
import com.lynkvertx.navarch.dto.LoadcaseDTO;
import com.lynkvertx.navarch.dto.TemplateVesselDTO;
import com.lynkvertx.navarch.dto.VesselDTO;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Reference hulls that can be instantiated as ready-to-compute vessels, each with
 * a full offset table and a design loadcase (sea water, KG at half the design draft,
 * LCG at midships).
 */
public enum TemplateVessel {

    /**
     * Wigley hull y = B/2·(1 - ξ²)(1 - ζ²), ξ = (x - L/2)/(L/2), ζ = (T - z)/T,
     * tabulated above the design waterline up to 1.3·T.
     */
    WIGLEY("Wigley hull",
        "Parabolic Wigley hull for benchmarking; analytical block coefficient 4/9 at the design draft",
        "100", "10", "6.25", "8.125", 21, 13, null) {
        @Override
        BigDecimal halfBreadth(BigDecimal x, BigDecimal z) {
            BigDecimal halfLength = lpp.divide(TWO, MC);
            BigDecimal xi = x.subtract(halfLength).divide(halfLength, MC);
            BigDecimal zeta = designDraft.subtract(z).divide(designDraft, MC);
            BigDecimal lengthwise = BigDecimal.ONE.subtract(xi.multiply(xi, MC));
            BigDecimal depthwise = BigDecimal.ONE.subtract(zeta.multiply(zeta, MC));
            return beam.divide(TWO, MC).multiply(lengthwise, MC).multiply(depthwise, MC).max(BigDecimal.ZERO);
        }
    },

    /**
     * Rectangular barge whose hydrostatics are known in closed form.
     */
    BOX_BARGE("Box barge",
        "Rectangular barge for analytical checks: volume L·B·T, KB = T/2, BMt = B²/(12·T)",
        "100", "20", "5", "10", 21, 11, "10250000") {
        @Override
        BigDecimal halfBreadth(BigDecimal x, BigDecimal z) {
            return beam.divide(TWO, MC);
        }
    };

    private static final MathContext MC = new MathContext(20, RoundingMode.HALF_EVEN);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final int SCALE = 6;
    private static final BigDecimal SEA_WATER = new BigDecimal("1025");

    private final String vesselName;
    private final String description;
    final BigDecimal lpp;
    final BigDecimal beam;
    final BigDecimal designDraft;
    private final BigDecimal depth;
    private final int stationCount;
    private final int waterlineCount;
    private final BigDecimal targetDisplacement;

    TemplateVessel(String vesselName, String description, String lpp, String beam, String designDraft,
                   String depth, int stationCount, int waterlineCount, String targetDisplacement) {
        this.vesselName = vesselName;
        this.description = description;
        this.lpp = new BigDecimal(lpp);
        this.beam = new BigDecimal(beam);
        this.designDraft = new BigDecimal(designDraft);
        this.depth = new BigDecimal(depth);
        this.stationCount = stationCount;
        this.waterlineCount = waterlineCount;
        this.targetDisplacement = targetDisplacement == null ? null : new BigDecimal(targetDisplacement);
    }

    /** Half-breadth of the hull form at a station position and height above the keel */
    abstract BigDecimal halfBreadth(BigDecimal x, BigDecimal z);

    public String getVesselName() {
        return vesselName;
    }

    public VesselDTO vessel() {
        return VesselDTO.builder()
            .name(vesselName)
            .description(description)
            .lpp(lpp)
            .beam(beam)
            .designDraft(designDraft)
            .build();
    }

    /**
     * Stations equally spaced from 0 to L, waterlines equally spaced from the keel to
     * the depth, and an offset at every intersection, all rounded to 6 decimals.
     */
    public HullGeometryDTO geometry() {
        List<StationEntry> stations = new ArrayList<>(stationCount);
        for (int i = 0; i < stationCount; i++) {
            stations.add(new StationEntry(i, spaced(lpp, i, stationCount)));
        }
        List<WaterlineEntry> waterlines = new ArrayList<>(waterlineCount);
        for (int j = 0; j < waterlineCount; j++) {
            waterlines.add(new WaterlineEntry(j, spaced(depth, j, waterlineCount)));
        }
        List<OffsetEntry> offsets = new ArrayList<>(stationCount * waterlineCount);
        for (StationEntry station : stations) {
            for (WaterlineEntry waterline : waterlines) {
                BigDecimal y = halfBreadth(station.getX(), waterline.getZ()).setScale(SCALE, RoundingMode.HALF_UP);
                offsets.add(new OffsetEntry(station.getIndex(), waterline.getIndex(), y));
            }
        }
        return HullGeometryDTO.builder()
            .stations(stations)
            .waterlines(waterlines)
            .offsets(offsets)
            .build();
    }

    public LoadcaseDTO designLoadcase() {
        return LoadcaseDTO.builder()
            .name("Design condition")
            .rho(SEA_WATER)
            .kg(designDraft.divide(TWO, MC))
            .lcg(lpp.divide(TWO, MC))
            .targetDisplacement(targetDisplacement)
            .notes("Design condition of the " + vesselName + " template")
            .build();
    }

    public TemplateVesselDTO describe() {
        return TemplateVesselDTO.builder()
            .template(name())
            .name(vesselName)
            .description(description)
            .lpp(lpp)
            .beam(beam)
            .designDraft(designDraft)
            .stationCount(stationCount)
            .waterlineCount(waterlineCount)
            .build();
    }

    private static BigDecimal spaced(BigDecimal extent, int position, int count) {
        return extent.multiply(BigDecimal.valueOf(position))
            .divide(BigDecimal.valueOf(count - 1L), MC)
            .setScale(SCALE, RoundingMode.HALF_UP);
    }
}
