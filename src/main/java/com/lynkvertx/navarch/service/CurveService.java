package com.lynkvertx.navarch.service;

import com.lynkvertx.navarch.config.HydrostaticsConfig;
import com.lynkvertx.navarch.dto.CurveRequestDTO;
import com.lynkvertx.navarch.dto.CurveSetDTO;
import com.lynkvertx.navarch.service.hydrostatics.CancellationSignal;
import com.lynkvertx.navarch.service.hydrostatics.CurveGenerator;
import com.lynkvertx.navarch.service.hydrostatics.HullGeometry;
import com.lynkvertx.navarch.service.hydrostatics.LoadcaseSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Curve Service
 * Curves of form and Bonjean curves for a stored vessel
 */
@Service
@RequiredArgsConstructor
public class CurveService {

    private final HullGeometryService geometryService;
    private final CurveGenerator curveGenerator;
    private final HydrostaticsConfig config;

    public CurveSetDTO generateCurves(Long vesselId, CurveRequestDTO request) {
        HullGeometry geometry = geometryService.loadHullGeometry(vesselId);
        LoadcaseSnapshot loadcase = geometryService.loadLoadcase(vesselId, request.getLoadcaseId());
        return curveGenerator.generate(geometry, loadcase, request.getTypes(),
            request.getMinDraft(), request.getMaxDraft(), request.getPoints(),
            CancellationSignal.deadline(config.getRequestTimeout()));
    }
}
