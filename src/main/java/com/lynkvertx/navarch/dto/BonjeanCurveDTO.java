package com.lynkvertx.navarch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Bonjean curve of one station: upright sectional area (m²) against draft
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BonjeanCurveDTO {

    private int stationIndex;

    /** Station position from the aft station (m) */
    private BigDecimal x;

    private List<CurveDTO.Point> points;
}
