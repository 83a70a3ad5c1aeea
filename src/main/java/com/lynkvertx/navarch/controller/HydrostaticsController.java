package com.lynkvertx.navarch.controller;

import com.lynkvertx.navarch.dto.ApiResponse;
import com.lynkvertx.navarch.dto.HydroConditionRequestDTO;
import com.lynkvertx.navarch.dto.HydroResultDTO;
import com.lynkvertx.navarch.dto.HydroTableRequestDTO;
import com.lynkvertx.navarch.dto.TrimSolutionDTO;
import com.lynkvertx.navarch.dto.TrimSolveRequestDTO;
import com.lynkvertx.navarch.service.HydrostaticsService;
import com.lynkvertx.navarch.service.hydrostatics.DisplacementTarget;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.math.BigDecimal;
import java.util.List;

/**
 * Hydrostatics REST Controller
 */
@RestController
@RequestMapping("/api/vessels/{vesselId}/hydrostatics")
@RequiredArgsConstructor
@Tag(name = "Hydrostatics", description = "Upright, trimmed and heeled hydrostatics")
public class HydrostaticsController {

    private final HydrostaticsService hydrostaticsService;

    @PostMapping("/compute")
    @Operation(summary = "Compute hydrostatics", description = "Hydrostatics at one draft, trim and heel")
    public ResponseEntity<ApiResponse<HydroResultDTO>> compute(
            @PathVariable Long vesselId,
            @Valid @RequestBody HydroConditionRequestDTO request) {
        HydroResultDTO result = hydrostaticsService.compute(vesselId, request);
        return ResponseEntity.ok(ApiResponse.success("Hydrostatics computed", result));
    }

    @PostMapping("/table")
    @Operation(summary = "Hydrostatic table", description = "Hydrostatics for a list of drafts, in request order")
    public ResponseEntity<ApiResponse<List<HydroResultDTO>>> computeTable(
            @PathVariable Long vesselId,
            @Valid @RequestBody HydroTableRequestDTO request) {
        return ComputationTime.timed("Hydrostatic table computed",
            () -> hydrostaticsService.computeTable(vesselId, request));
    }

    @PostMapping("/trim")
    @Operation(summary = "Solve trim", description = "Find drafts that float the vessel at a target displacement")
    public ResponseEntity<ApiResponse<TrimSolutionDTO>> solveTrim(
            @PathVariable Long vesselId,
            @Valid @RequestBody TrimSolveRequestDTO request) {
        return ComputationTime.timed("Trim solved",
            () -> hydrostaticsService.solveTrim(vesselId, request));
    }

    @GetMapping("/trim/achievable")
    @Operation(summary = "Check target displacement",
        description = "Whether a target displacement fits below the top waterline")
    public ResponseEntity<ApiResponse<Boolean>> isDisplacementAchievable(
            @PathVariable Long vesselId,
            @RequestParam BigDecimal targetDisplacement,
            @RequestParam(required = false) Long loadcaseId,
            @RequestParam(defaultValue = "WEIGHT") DisplacementTarget targetType) {
        boolean achievable = hydrostaticsService.isDisplacementAchievable(
            vesselId, loadcaseId, targetDisplacement, targetType);
        return ResponseEntity.ok(ApiResponse.success(achievable));
    }
}
