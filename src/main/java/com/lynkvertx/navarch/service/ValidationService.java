package com.lynkvertx.navarch.service;

import com.lynkvertx.navarch.dto.HullGeometryDTO;
import com.lynkvertx.navarch.dto.HullGeometryDTO.OffsetEntry;
import com.lynkvertx.navarch.dto.HullGeometryDTO.StationEntry;
import com.lynkvertx.navarch.dto.HullGeometryDTO.WaterlineEntry;
import com.lynkvertx.navarch.dto.ValidationResultDTO;
import com.lynkvertx.navarch.dto.ValidationResultDTO.ValidationError;
import com.lynkvertx.navarch.dto.VesselDTO;
import com.lynkvertx.navarch.exception.ValidationFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Validation Service
 *
 * Checks vessel particulars and offset tables before they are stored and reports
 * every finding with the row (and, for offsets, the column) it belongs to.
 * The rules are the ones the geometry model enforces when it integrates, so a table
 * that passes here always resolves into an engine model.
 */
@Slf4j
@Service
public class ValidationService {

    private static final String STATIONS = "stations";
    private static final String WATERLINES = "waterlines";
    private static final String OFFSETS = "offsets";

    public ValidationResultDTO validateGeometry(HullGeometryDTO dto) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationError> warnings = new ArrayList<>();

        Set<Integer> stationIndexes = validateStations(dto.getStations(), errors);
        Set<Integer> waterlineIndexes = validateWaterlines(dto.getWaterlines(), errors);
        validateOffsets(dto.getOffsets(), stationIndexes, waterlineIndexes, errors, warnings);

        return result(errors, warnings);
    }

    public ValidationResultDTO validateVessel(VesselDTO dto) {
        List<ValidationError> errors = new ArrayList<>();

        if (dto.getName() == null || dto.getName().trim().isEmpty()) {
            errors.add(new ValidationError("name", "Vessel name is required"));
        }
        requirePositive(dto.getLpp(), "lpp", "Length between perpendiculars must be positive", errors);
        requirePositive(dto.getBeam(), "beam", "Beam must be positive", errors);
        requirePositive(dto.getDesignDraft(), "designDraft", "Design draft must be positive", errors);

        if (isPositive(dto.getBeam()) && isPositive(dto.getLpp()) && dto.getBeam().compareTo(dto.getLpp()) > 0) {
            errors.add(new ValidationError("beam", "Beam should not exceed length between perpendiculars"));
        }
        if (isPositive(dto.getDesignDraft()) && isPositive(dto.getBeam())
            && dto.getDesignDraft().compareTo(dto.getBeam()) > 0) {
            errors.add(new ValidationError("designDraft", "Design draft should not exceed beam"));
        }
        return result(errors, new ArrayList<>());
    }

    /**
     * @throws ValidationFailedException when the result holds any error
     */
    public void requireValid(ValidationResultDTO result, String subject) {
        if (!result.isValid()) {
            throw new ValidationFailedException(subject + " failed validation", result);
        }
        result.getWarnings().forEach(warning -> log.debug("{}: {}", subject, warning.getMessage()));
    }

    private Set<Integer> validateStations(List<StationEntry> stations, List<ValidationError> errors) {
        Map<Integer, BigDecimal> positions = new TreeMap<>();
        Map<Integer, Integer> rows = new TreeMap<>();
        if (stations == null || stations.size() < 2) {
            errors.add(new ValidationError(STATIONS,
                "At least two stations are required, found " + (stations == null ? 0 : stations.size())));
        }
        if (stations == null) {
            return positions.keySet();
        }
        for (int row = 0; row < stations.size(); row++) {
            StationEntry station = stations.get(row);
            if (station == null || station.getIndex() == null || station.getX() == null) {
                errors.add(new ValidationError(STATIONS, "Station index and x are required", row, null));
                continue;
            }
            if (positions.containsKey(station.getIndex())) {
                errors.add(new ValidationError(STATIONS, "Duplicate station index " + station.getIndex(), row, null));
                continue;
            }
            positions.put(station.getIndex(), station.getX());
            rows.put(station.getIndex(), row);
        }
        checkOrdering(positions, rows, STATIONS, "Station x", errors);
        return positions.keySet();
    }

    private Set<Integer> validateWaterlines(List<WaterlineEntry> waterlines, List<ValidationError> errors) {
        Map<Integer, BigDecimal> heights = new TreeMap<>();
        Map<Integer, Integer> rows = new TreeMap<>();
        if (waterlines == null || waterlines.size() < 2) {
            errors.add(new ValidationError(WATERLINES,
                "At least two waterlines are required, found " + (waterlines == null ? 0 : waterlines.size())));
        }
        if (waterlines == null) {
            return heights.keySet();
        }
        for (int row = 0; row < waterlines.size(); row++) {
            WaterlineEntry waterline = waterlines.get(row);
            if (waterline == null || waterline.getIndex() == null || waterline.getZ() == null) {
                errors.add(new ValidationError(WATERLINES, "Waterline index and z are required", row, null));
                continue;
            }
            if (waterline.getZ().signum() < 0) {
                errors.add(new ValidationError(WATERLINES, "Waterline z must be measured up from the keel, found "
                    + waterline.getZ(), row, null));
            }
            if (heights.containsKey(waterline.getIndex())) {
                errors.add(new ValidationError(WATERLINES, "Duplicate waterline index " + waterline.getIndex(), row, null));
                continue;
            }
            heights.put(waterline.getIndex(), waterline.getZ());
            rows.put(waterline.getIndex(), row);
        }
        checkOrdering(heights, rows, WATERLINES, "Waterline z", errors);
        return heights.keySet();
    }

    /**
     * Coordinates must increase strictly with index and the indexes must have no gaps.
     */
    private void checkOrdering(Map<Integer, BigDecimal> byIndex, Map<Integer, Integer> rows, String field,
                               String coordinate, List<ValidationError> errors) {
        Integer previousIndex = null;
        BigDecimal previous = null;
        for (Map.Entry<Integer, BigDecimal> entry : byIndex.entrySet()) {
            int index = entry.getKey();
            if (previousIndex != null) {
                if (index != previousIndex + 1) {
                    errors.add(new ValidationError(field, "Indexes are not contiguous: missing "
                        + (previousIndex + 1), rows.get(index), null));
                }
                if (entry.getValue().compareTo(previous) <= 0) {
                    errors.add(new ValidationError(field, coordinate + " must increase with index: "
                        + previous + " at index " + previousIndex + ", " + entry.getValue() + " at index " + index,
                        rows.get(index), null));
                }
            }
            previousIndex = index;
            previous = entry.getValue();
        }
    }

    private void validateOffsets(List<OffsetEntry> offsets, Set<Integer> stationIndexes, Set<Integer> waterlineIndexes,
                                 List<ValidationError> errors, List<ValidationError> warnings) {
        if (offsets == null || offsets.isEmpty()) {
            errors.add(new ValidationError(OFFSETS, "At least one offset is required"));
            return;
        }
        Set<String> cells = new HashSet<>();
        Set<Integer> stationsWithOffsets = new HashSet<>();
        for (OffsetEntry offset : offsets) {
            if (offset == null || offset.getStationIndex() == null || offset.getWaterlineIndex() == null
                || offset.getHalfBreadth() == null) {
                errors.add(new ValidationError(OFFSETS, "Station index, waterline index and half-breadth are required"));
                continue;
            }
            int station = offset.getStationIndex();
            int waterline = offset.getWaterlineIndex();
            if (!stationIndexes.contains(station)) {
                errors.add(new ValidationError(OFFSETS, "Offset references unknown station " + station,
                    station, waterline));
            }
            if (!waterlineIndexes.contains(waterline)) {
                errors.add(new ValidationError(OFFSETS, "Offset references unknown waterline " + waterline,
                    station, waterline));
            }
            if (offset.getHalfBreadth().signum() < 0) {
                errors.add(new ValidationError(OFFSETS, "Half-breadth must be non-negative at station " + station
                    + ", waterline " + waterline + ", found " + offset.getHalfBreadth(), station, waterline));
            }
            if (!cells.add(station + ":" + waterline)) {
                errors.add(new ValidationError(OFFSETS, "Duplicate offset at station " + station
                    + ", waterline " + waterline, station, waterline));
            }
            stationsWithOffsets.add(station);
        }

        List<Integer> bareStations = stationIndexes.stream()
            .filter(station -> !stationsWithOffsets.contains(station))
            .sorted()
            .collect(Collectors.toList());
        bareStations.forEach(station -> errors.add(new ValidationError(OFFSETS,
            "Station " + station + " has no offsets", station, null)));

        List<int[]> missing = new ArrayList<>();
        for (Integer station : sorted(stationIndexes)) {
            if (bareStations.contains(station)) {
                continue;
            }
            for (Integer waterline : sorted(waterlineIndexes)) {
                if (!cells.contains(station + ":" + waterline)) {
                    missing.add(new int[] {station, waterline});
                }
            }
        }
        if (!missing.isEmpty()) {
            warnings.add(new ValidationError(OFFSETS, "Missing offsets for " + missing.size()
                + " station/waterline combinations are interpolated. First missing: station "
                + missing.get(0)[0] + ", waterline " + missing.get(0)[1], missing.get(0)[0], missing.get(0)[1]));
        }
    }

    private static List<Integer> sorted(Set<Integer> indexes) {
        return indexes.stream().sorted(Comparator.naturalOrder()).collect(Collectors.toList());
    }

    private static void requirePositive(BigDecimal value, String field, String message, List<ValidationError> errors) {
        if (value != null && value.signum() <= 0) {
            errors.add(new ValidationError(field, message));
        }
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    private static ValidationResultDTO result(List<ValidationError> errors, List<ValidationError> warnings) {
        return ValidationResultDTO.builder()
            .valid(errors.isEmpty())
            .errors(errors)
            .warnings(warnings)
            .build();
    }
}
