package com.lynkvertx.navarch.service;

import com.lynkvertx.navarch.config.HydrostaticsConfig;
import com.lynkvertx.navarch.dto.HullGeometryDTO;
import com.lynkvertx.navarch.dto.HullGeometryDTO.OffsetEntry;
import com.lynkvertx.navarch.dto.HullGeometryDTO.StationEntry;
import com.lynkvertx.navarch.dto.HullGeometryDTO.WaterlineEntry;
import com.lynkvertx.navarch.dto.HullProjectionsDTO;
import com.lynkvertx.navarch.dto.HullProjectionsDTO.ButtockCurve;
import com.lynkvertx.navarch.dto.HullProjectionsDTO.PlanPoint;
import com.lynkvertx.navarch.dto.HullProjectionsDTO.ProfilePoint;
import com.lynkvertx.navarch.dto.HullProjectionsDTO.WaterlineCurve;
import com.lynkvertx.navarch.dto.ValidationResultDTO;
import com.lynkvertx.navarch.entity.HullOffset;
import com.lynkvertx.navarch.entity.Loadcase;
import com.lynkvertx.navarch.entity.Station;
import com.lynkvertx.navarch.entity.Vessel;
import com.lynkvertx.navarch.entity.Waterline;
import com.lynkvertx.navarch.exception.GeometryIncompleteException;
import com.lynkvertx.navarch.repository.HullOffsetRepository;
import com.lynkvertx.navarch.repository.LoadcaseRepository;
import com.lynkvertx.navarch.repository.StationRepository;
import com.lynkvertx.navarch.repository.VesselRepository;
import com.lynkvertx.navarch.repository.WaterlineRepository;
import com.lynkvertx.navarch.service.hydrostatics.HullGeometry;
import com.lynkvertx.navarch.service.hydrostatics.LoadcaseSnapshot;
import com.lynkvertx.navarch.service.hydrostatics.NumericPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityNotFoundException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Hull Geometry Service
 *
 * Stores a vessel's stations, waterlines and offsets (replaced wholesale, delete then
 * insert) and resolves them, with the vessel's loadcases, into the immutable inputs
 * of the hydrostatics engine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HullGeometryService {

    private static final BigDecimal FLAT_HALF_BREADTH = new BigDecimal("0.0001");

    private final VesselRepository vesselRepository;
    private final StationRepository stationRepository;
    private final WaterlineRepository waterlineRepository;
    private final HullOffsetRepository offsetRepository;
    private final LoadcaseRepository loadcaseRepository;
    private final HydrostaticsConfig config;
    private final ValidationService validationService;
    private final NumericPolicy numeric;

    public HullGeometryDTO getGeometry(Long vesselId) {
        requireVessel(vesselId);
        return HullGeometryDTO.builder()
            .vesselId(vesselId)
            .stations(stationRepository.findByVesselIdOrderByStationIndexAsc(vesselId).stream()
                .map(s -> new StationEntry(s.getStationIndex(), s.getX()))
                .collect(Collectors.toList()))
            .waterlines(waterlineRepository.findByVesselIdOrderByWaterlineIndexAsc(vesselId).stream()
                .map(w -> new WaterlineEntry(w.getWaterlineIndex(), w.getZ()))
                .collect(Collectors.toList()))
            .offsets(offsetRepository.findByVesselIdOrderByStationIndexAscWaterlineIndexAsc(vesselId).stream()
                .map(o -> new OffsetEntry(o.getStationIndex(), o.getWaterlineIndex(), o.getHalfBreadth()))
                .collect(Collectors.toList()))
            .build();
    }

    /**
     * Replace the whole geometry of a vessel in one transaction
     */
    @Transactional
    public HullGeometryDTO replaceGeometry(Long vesselId, HullGeometryDTO dto) {
        requireVessel(vesselId);
        validationService.requireValid(validationService.validateGeometry(dto), "Hull geometry of vessel " + vesselId);

        offsetRepository.deleteByVesselId(vesselId);
        stationRepository.deleteByVesselId(vesselId);
        waterlineRepository.deleteByVesselId(vesselId);

        stationRepository.saveAll(dto.getStations().stream()
            .map(s -> Station.builder().vesselId(vesselId).stationIndex(s.getIndex()).x(s.getX()).build())
            .collect(Collectors.toList()));
        waterlineRepository.saveAll(dto.getWaterlines().stream()
            .map(w -> Waterline.builder().vesselId(vesselId).waterlineIndex(w.getIndex()).z(w.getZ()).build())
            .collect(Collectors.toList()));
        offsetRepository.saveAll(dto.getOffsets().stream()
            .map(o -> HullOffset.builder()
                .vesselId(vesselId)
                .stationIndex(o.getStationIndex())
                .waterlineIndex(o.getWaterlineIndex())
                .halfBreadth(o.getHalfBreadth())
                .build())
            .collect(Collectors.toList()));

        log.info("Replaced geometry of vessel {}: {} stations, {} waterlines, {} offsets",
            vesselId, dto.getStations().size(), dto.getWaterlines().size(), dto.getOffsets().size());
        dto.setVesselId(vesselId);
        return dto;
    }

    /**
     * Check an offset table against a vessel without storing it
     */
    public ValidationResultDTO validateGeometry(Long vesselId, HullGeometryDTO dto) {
        requireVessel(vesselId);
        ValidationResultDTO result = validationService.validateGeometry(dto);
        log.info("Validated geometry for vessel {}: {} error(s), {} warning(s)",
            vesselId, result.getErrors().size(), result.getWarnings().size());
        return result;
    }

    /**
     * Waterline and buttock views of the stored offset table. Buttocks sit at
     * {@code count} half-breadths spaced evenly between the centreline and the
     * largest offset, exclusive of both.
     *
     * @throws GeometryIncompleteException when the vessel has no geometry
     */
    @Transactional(readOnly = true)
    public HullProjectionsDTO getProjections(Long vesselId, Integer buttockCount) {
        requireVessel(vesselId);
        int count = buttockCount != null ? buttockCount : config.getDefaultButtocks();
        if (count < 1 || count > config.getMaxButtocks()) {
            throw new IllegalArgumentException("Buttock count must be between 1 and " + config.getMaxButtocks()
                + ", got " + count);
        }
        List<Station> stations = stationRepository.findByVesselIdOrderByStationIndexAsc(vesselId);
        List<Waterline> waterlines = waterlineRepository.findByVesselIdOrderByWaterlineIndexAsc(vesselId);
        if (stations.isEmpty() || waterlines.isEmpty()) {
            throw new GeometryIncompleteException("Vessel " + vesselId + " has no hull geometry");
        }

        Map<Integer, BigDecimal> heights = new HashMap<>();
        waterlines.forEach(w -> heights.put(w.getWaterlineIndex(), w.getZ()));
        Map<Integer, Map<Integer, BigDecimal>> grid = new HashMap<>();
        BigDecimal maxHalfBreadth = BigDecimal.ZERO;
        for (HullOffset offset : offsetRepository.findByVesselIdOrderByStationIndexAscWaterlineIndexAsc(vesselId)) {
            grid.computeIfAbsent(offset.getStationIndex(), k -> new TreeMap<>())
                .put(offset.getWaterlineIndex(), offset.getHalfBreadth());
            maxHalfBreadth = maxHalfBreadth.max(offset.getHalfBreadth());
        }

        List<WaterlineCurve> waterlineCurves = new ArrayList<>(waterlines.size());
        for (Waterline waterline : waterlines) {
            List<PlanPoint> points = new ArrayList<>();
            for (Station station : stations) {
                BigDecimal y = grid.getOrDefault(station.getStationIndex(), Collections.emptyMap())
                    .get(waterline.getWaterlineIndex());
                if (y != null) {
                    points.add(new PlanPoint(numeric.round(station.getX()), numeric.round(y)));
                }
            }
            waterlineCurves.add(new WaterlineCurve(waterline.getWaterlineIndex(), numeric.round(waterline.getZ()), points));
        }

        List<ButtockCurve> buttocks = new ArrayList<>(count);
        if (maxHalfBreadth.signum() == 0) {
            log.warn("Vessel {} has no positive half-breadth; no buttocks drawn", vesselId);
        } else {
            for (int k = 0; k < count; k++) {
                BigDecimal y = numeric.divide(maxHalfBreadth.multiply(BigDecimal.valueOf(k + 1L)),
                    BigDecimal.valueOf(count + 1L));
                List<ProfilePoint> points = new ArrayList<>();
                for (Station station : stations) {
                    List<BigDecimal[]> column = new ArrayList<>();
                    grid.getOrDefault(station.getStationIndex(), Collections.emptyMap()).forEach((index, halfBreadth) -> {
                        if (heights.containsKey(index)) {
                            column.add(new BigDecimal[] {heights.get(index), halfBreadth});
                        }
                    });
                    BigDecimal z = crossingHeight(column, y);
                    if (z != null) {
                        points.add(new ProfilePoint(numeric.round(station.getX()), numeric.round(z)));
                    }
                }
                log.debug("Buttock {} at y={} crosses {} stations", k, y, points.size());
                buttocks.add(new ButtockCurve(k, numeric.round(y), points));
            }
        }

        log.info("Projected vessel {}: {} waterlines, {} buttocks", vesselId, waterlineCurves.size(), buttocks.size());
        return HullProjectionsDTO.builder()
            .vesselId(vesselId)
            .waterlines(waterlineCurves)
            .buttocks(buttocks)
            .build();
    }

    /**
     * Resolve the stored geometry of a vessel into the engine model, read as of now.
     *
     * @throws EntityNotFoundException     when the vessel does not exist
     * @throws GeometryIncompleteException when it has no geometry or the geometry cannot be integrated
     */
    @Transactional(readOnly = true)
    public HullGeometry loadHullGeometry(Long vesselId) {
        Vessel vessel = requireVessel(vesselId);
        List<Station> stations = stationRepository.findByVesselIdOrderByStationIndexAsc(vesselId);
        List<Waterline> waterlines = waterlineRepository.findByVesselIdOrderByWaterlineIndexAsc(vesselId);
        if (stations.isEmpty() || waterlines.isEmpty()) {
            throw new GeometryIncompleteException("Vessel " + vesselId + " has no hull geometry");
        }

        HullGeometry.Builder builder = HullGeometry.builder()
            .particulars(vessel.getLpp(), vessel.getBeam());
        stations.forEach(s -> builder.station(s.getStationIndex(), s.getX()));
        waterlines.forEach(w -> builder.waterline(w.getWaterlineIndex(), w.getZ()));
        offsetRepository.findByVesselIdOrderByStationIndexAscWaterlineIndexAsc(vesselId)
            .forEach(o -> builder.offset(o.getStationIndex(), o.getWaterlineIndex(), o.getHalfBreadth()));
        return builder.build();
    }

    /**
     * Loadcase snapshot for a calculation. Without a loadcase id the configured
     * default density is used and KG is absent.
     *
     * @throws EntityNotFoundException when the loadcase does not exist or belongs to another vessel
     */
    public LoadcaseSnapshot loadLoadcase(Long vesselId, Long loadcaseId) {
        if (loadcaseId == null) {
            return LoadcaseSnapshot.ofDensity(config.getDefaultDensity());
        }
        Loadcase loadcase = loadcaseRepository.findByIdAndVesselId(loadcaseId, vesselId)
            .orElseThrow(() -> new EntityNotFoundException(
                "Loadcase not found with id: " + loadcaseId + " for vessel: " + vesselId));
        return LoadcaseSnapshot.builder()
            .id(loadcase.getId())
            .name(loadcase.getName())
            .rho(loadcase.getRho())
            .kg(loadcase.getKg())
            .lcg(loadcase.getLcg())
            .targetDisplacement(loadcase.getTargetDisplacement())
            .build();
    }

    public Vessel requireVessel(Long vesselId) {
        return vesselRepository.findById(vesselId)
            .orElseThrow(() -> new EntityNotFoundException("Vessel not found with id: " + vesselId));
    }

    /**
     * Height where a station column, given as (z, y) pairs in waterline order, first
     * reaches the half-breadth {@code target}; null when the column never does.
     */
    private BigDecimal crossingHeight(List<BigDecimal[]> column, BigDecimal target) {
        for (int k = 0; k + 1 < column.size(); k++) {
            BigDecimal[] lower = column.get(k);
            BigDecimal[] upper = column.get(k + 1);
            if (target.compareTo(lower[1].min(upper[1])) < 0 || target.compareTo(lower[1].max(upper[1])) > 0) {
                continue;
            }
            BigDecimal rise = upper[1].subtract(lower[1]);
            if (rise.abs().compareTo(FLAT_HALF_BREADTH) < 0) {
                return numeric.divide(lower[0].add(upper[0]), BigDecimal.valueOf(2));
            }
            BigDecimal fraction = numeric.divide(target.subtract(lower[1]), rise);
            return lower[0].add(fraction.multiply(upper[0].subtract(lower[0]), numeric.mc()));
        }
        for (BigDecimal[] point : column) {
            if (point[1].subtract(target).abs().compareTo(FLAT_HALF_BREADTH) < 0) {
                return point[0];
            }
        }
        return null;
    }
}
