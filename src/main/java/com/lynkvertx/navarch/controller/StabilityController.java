package com.lynkvertx.navarch.controller;

import com.lynkvertx.navarch.dto.ApiResponse;
import com.lynkvertx.navarch.dto.CriteriaResultDTO;
import com.lynkvertx.navarch.dto.StabilityCurveDTO;
import com.lynkvertx.navarch.dto.StabilityMethodDTO;
import com.lynkvertx.navarch.dto.StabilityRequestDTO;
import com.lynkvertx.navarch.service.StabilityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.List;

/**
 * Intact Stability REST Controller
 */
@RestController
@RequestMapping("/api/vessels/{vesselId}/stability")
@RequiredArgsConstructor
@Tag(name = "Stability", description = "Righting arm curves and criteria")
public class StabilityController {

    private final StabilityService stabilityService;

    @PostMapping("/curve")
    @Operation(summary = "Compute GZ curve", description = "Righting arm curve of a loadcase over a heel sweep")
    public ResponseEntity<ApiResponse<StabilityCurveDTO>> computeCurve(
            @PathVariable Long vesselId,
            @Valid @RequestBody StabilityRequestDTO request) {
        return ComputationTime.timed("GZ curve computed",
            () -> stabilityService.computeCurve(vesselId, request));
    }

    @PostMapping("/criteria")
    @Operation(summary = "Check criteria", description = "Compute the GZ curve of a loadcase and check it against the criteria")
    public ResponseEntity<ApiResponse<CriteriaResultDTO>> checkCriteria(
            @PathVariable Long vesselId,
            @Valid @RequestBody StabilityRequestDTO request) {
        return ComputationTime.timed("Stability criteria checked",
            () -> stabilityService.checkCriteria(vesselId, request));
    }

    @PostMapping("/criteria/evaluate")
    @Operation(summary = "Evaluate a GZ curve", description = "Check a supplied GZ curve against the criteria")
    public ResponseEntity<ApiResponse<CriteriaResultDTO>> evaluateCurve(
            @PathVariable Long vesselId,
            @Valid @RequestBody StabilityCurveDTO curve) {
        return ResponseEntity.ok(ApiResponse.success(stabilityService.evaluateCurve(curve)));
    }

    @GetMapping("/methods")
    @Operation(summary = "List stability methods")
    public ResponseEntity<ApiResponse<List<StabilityMethodDTO>>> getMethods(@PathVariable Long vesselId) {
        return ResponseEntity.ok(ApiResponse.success(stabilityService.getMethods()));
    }
}
