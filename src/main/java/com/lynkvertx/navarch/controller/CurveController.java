package com.lynkvertx.navarch.controller;

import com.lynkvertx.navarch.dto.ApiResponse;
import com.lynkvertx.navarch.dto.CurveRequestDTO;
import com.lynkvertx.navarch.dto.CurveSetDTO;
import com.lynkvertx.navarch.service.CurveService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;

/**
 * Curves of Form REST Controller
 */
@RestController
@RequestMapping("/api/vessels/{vesselId}/curves")
@RequiredArgsConstructor
@Tag(name = "Curves", description = "Curves of form and Bonjean curves")
public class CurveController {

    private final CurveService curveService;

    @PostMapping
    @Operation(summary = "Generate curves", description = "Curves of form over an evenly spaced draft range")
    public ResponseEntity<ApiResponse<CurveSetDTO>> generateCurves(
            @PathVariable Long vesselId,
            @Valid @RequestBody CurveRequestDTO request) {
        return ComputationTime.timed("Curves generated",
            () -> curveService.generateCurves(vesselId, request));
    }
}
