package com.lynkvertx.navarch.service;

import com.lynkvertx.navarch.config.HydrostaticsConfig;
import com.lynkvertx.navarch.dto.CriteriaResultDTO;
import com.lynkvertx.navarch.dto.StabilityCurveDTO;
import com.lynkvertx.navarch.dto.StabilityMethodDTO;
import com.lynkvertx.navarch.dto.StabilityRequestDTO;
import com.lynkvertx.navarch.entity.Vessel;
import com.lynkvertx.navarch.service.hydrostatics.CancellationSignal;
import com.lynkvertx.navarch.service.hydrostatics.HullGeometry;
import com.lynkvertx.navarch.service.hydrostatics.LoadcaseSnapshot;
import com.lynkvertx.navarch.service.hydrostatics.StabilityCalculator;
import com.lynkvertx.navarch.service.hydrostatics.StabilityCriteriaChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Stability Service
 * Righting-arm curves of stored loadcases and their check against intact stability criteria
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StabilityService {

    private final HullGeometryService geometryService;
    private final StabilityCalculator stabilityCalculator;
    private final StabilityCriteriaChecker criteriaChecker;
    private final HydrostaticsConfig config;

    /**
     * GZ curve at the requested draft, or at the vessel's design draft when none is given
     */
    public StabilityCurveDTO computeCurve(Long vesselId, StabilityRequestDTO request) {
        Vessel vessel = geometryService.requireVessel(vesselId);
        HullGeometry geometry = geometryService.loadHullGeometry(vesselId);
        LoadcaseSnapshot loadcase = geometryService.loadLoadcase(vesselId, request.getLoadcaseId());

        BigDecimal draft = request.getDraft() != null ? request.getDraft() : vessel.getDesignDraft();
        if (draft == null) {
            throw new IllegalArgumentException("Draft is required when vessel " + vesselId + " has no design draft");
        }
        return stabilityCalculator.computeCurve(geometry, loadcase, draft,
            request.getMinAngle(), request.getMaxAngle(), request.getAngleIncrement(), request.getMethod(),
            CancellationSignal.deadline(config.getRequestTimeout()));
    }

    public CriteriaResultDTO checkCriteria(Long vesselId, StabilityRequestDTO request) {
        return criteriaChecker.check(computeCurve(vesselId, request));
    }

    public CriteriaResultDTO evaluateCurve(StabilityCurveDTO curve) {
        log.debug("Evaluating supplied GZ curve of {} points",
            curve.getPoints() == null ? 0 : curve.getPoints().size());
        return criteriaChecker.check(curve);
    }

    public List<StabilityMethodDTO> getMethods() {
        return stabilityCalculator.availableMethods();
    }
}
