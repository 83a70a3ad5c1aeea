package com.lynkvertx.navarch.service;

import com.lynkvertx.navarch.config.HydrostaticsConfig;
import com.lynkvertx.navarch.dto.HydroConditionRequestDTO;
import com.lynkvertx.navarch.dto.HydroResultDTO;
import com.lynkvertx.navarch.dto.HydroTableRequestDTO;
import com.lynkvertx.navarch.dto.TrimSolutionDTO;
import com.lynkvertx.navarch.dto.TrimSolveRequestDTO;
import com.lynkvertx.navarch.service.hydrostatics.CancellationSignal;
import com.lynkvertx.navarch.service.hydrostatics.DisplacementTarget;
import com.lynkvertx.navarch.service.hydrostatics.FloatingCondition;
import com.lynkvertx.navarch.service.hydrostatics.HullGeometry;
import com.lynkvertx.navarch.service.hydrostatics.HydroCalculator;
import com.lynkvertx.navarch.service.hydrostatics.LoadcaseSnapshot;
import com.lynkvertx.navarch.service.hydrostatics.TrimProblem;
import com.lynkvertx.navarch.service.hydrostatics.TrimSolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Hydrostatics Service
 * Resolves vessel geometry and loadcase, then runs the hydrostatic calculator or trim solver
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HydrostaticsService {

    private final HullGeometryService geometryService;
    private final HydroCalculator calculator;
    private final TrimSolver trimSolver;
    private final HydrostaticsConfig config;

    public HydroResultDTO compute(Long vesselId, HydroConditionRequestDTO request) {
        HullGeometry geometry = geometryService.loadHullGeometry(vesselId);
        LoadcaseSnapshot loadcase = geometryService.loadLoadcase(vesselId, request.getLoadcaseId());
        return calculator.computeAt(geometry, loadcase,
            FloatingCondition.of(request.getDraft(), request.getTrimAngle(), request.getHeelAngle()));
    }

    public List<HydroResultDTO> computeTable(Long vesselId, HydroTableRequestDTO request) {
        HullGeometry geometry = geometryService.loadHullGeometry(vesselId);
        LoadcaseSnapshot loadcase = geometryService.loadLoadcase(vesselId, request.getLoadcaseId());
        List<HydroResultDTO> table = calculator.computeTable(geometry, loadcase, request.getDrafts(),
            request.getTrimAngle(), request.getHeelAngle(), deadline());
        log.info("Computed hydrostatic table of {} drafts for vessel {}", table.size(), vesselId);
        return table;
    }

    /**
     * Solve trim for the requested target, or for the loadcase's target weight when the request has none
     */
    public TrimSolutionDTO solveTrim(Long vesselId, TrimSolveRequestDTO request) {
        HullGeometry geometry = geometryService.loadHullGeometry(vesselId);
        LoadcaseSnapshot loadcase = geometryService.loadLoadcase(vesselId, request.getLoadcaseId());

        BigDecimal target = request.getTargetDisplacement();
        DisplacementTarget targetType = request.getTargetType() != null ? request.getTargetType() : DisplacementTarget.WEIGHT;
        if (target == null) {
            target = loadcase.getTargetDisplacement();
            targetType = DisplacementTarget.WEIGHT;
        }
        if (target == null) {
            throw new IllegalArgumentException("Target displacement is required when the loadcase has none");
        }

        TrimProblem problem = TrimProblem.builder()
            .targetDisplacement(target)
            .targetType(targetType)
            .initialForwardDraft(request.getInitialForwardDraft())
            .initialAftDraft(request.getInitialAftDraft())
            .maxIterations(request.getMaxIterations())
            .tolerance(request.getTolerance())
            .build();
        return trimSolver.solve(geometry, loadcase, problem, deadline());
    }

    public boolean isDisplacementAchievable(Long vesselId, Long loadcaseId, BigDecimal target,
                                            DisplacementTarget targetType) {
        HullGeometry geometry = geometryService.loadHullGeometry(vesselId);
        LoadcaseSnapshot loadcase = geometryService.loadLoadcase(vesselId, loadcaseId);
        return trimSolver.isDisplacementAchievable(geometry, loadcase, target,
            targetType != null ? targetType : DisplacementTarget.WEIGHT);
    }

    private CancellationSignal deadline() {
        return CancellationSignal.deadline(config.getRequestTimeout());
    }
}
