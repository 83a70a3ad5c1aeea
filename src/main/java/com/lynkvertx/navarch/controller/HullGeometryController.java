package com.lynkvertx.navarch.controller;

import com.lynkvertx.navarch.dto.ApiResponse;
import com.lynkvertx.navarch.dto.HullGeometryDTO;
import com.lynkvertx.navarch.dto.HullProjectionsDTO;
import com.lynkvertx.navarch.dto.ValidationResultDTO;
import com.lynkvertx.navarch.service.HullGeometryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;

/**
 * Hull Geometry REST Controller
 */
@RestController
@RequestMapping("/api/vessels/{vesselId}/geometry")
@RequiredArgsConstructor
@Tag(name = "Hull Geometry", description = "Stations, waterlines and half-breadth offsets")
public class HullGeometryController {

    private final HullGeometryService geometryService;

    @GetMapping
    @Operation(summary = "Get hull geometry", description = "Get the stored offset table of a vessel")
    public ResponseEntity<ApiResponse<HullGeometryDTO>> getGeometry(@PathVariable Long vesselId) {
        return ResponseEntity.ok(ApiResponse.success(geometryService.getGeometry(vesselId)));
    }

    @PutMapping
    @Operation(summary = "Replace hull geometry", description = "Replace the whole offset table of a vessel")
    public ResponseEntity<ApiResponse<HullGeometryDTO>> replaceGeometry(
            @PathVariable Long vesselId,
            @Valid @RequestBody HullGeometryDTO dto) {
        HullGeometryDTO saved = geometryService.replaceGeometry(vesselId, dto);
        return ResponseEntity.ok(ApiResponse.success("Hull geometry saved successfully", saved));
    }

    @PostMapping("/validate")
    @Operation(summary = "Validate hull geometry",
        description = "Check an offset table without saving it; errors and warnings carry their row and column")
    public ResponseEntity<ApiResponse<ValidationResultDTO>> validateGeometry(
            @PathVariable Long vesselId,
            @RequestBody HullGeometryDTO dto) {
        ValidationResultDTO result = geometryService.validateGeometry(vesselId, dto);
        return ResponseEntity.ok(ApiResponse.success(
            result.isValid() ? "Hull geometry is valid" : "Hull geometry has errors", result));
    }

    @GetMapping("/projections")
    @Operation(summary = "Get lines-plan projections",
        description = "Waterlines (half-breadth plan) and buttocks (profile) drawn from the stored offsets;"
            + " buttocks are spaced evenly out to the largest half-breadth")
    public ResponseEntity<ApiResponse<HullProjectionsDTO>> getProjections(
            @PathVariable Long vesselId,
            @RequestParam(required = false) Integer buttocks) {
        return ResponseEntity.ok(ApiResponse.success(geometryService.getProjections(vesselId, buttocks)));
    }
}
