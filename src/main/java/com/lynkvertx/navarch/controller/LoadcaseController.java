package com.lynkvertx.navarch.controller;

import com.lynkvertx.navarch.dto.ApiResponse;
import com.lynkvertx.navarch.dto.LoadcaseDTO;
import com.lynkvertx.navarch.service.LoadcaseService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.List;

/**
 * Loadcase REST Controller
 */
@RestController
@RequestMapping("/api/vessels/{vesselId}/loadcases")
@RequiredArgsConstructor
@Tag(name = "Loadcases", description = "Per-vessel loading conditions")
public class LoadcaseController {

    private final LoadcaseService loadcaseService;

    @GetMapping
    @Operation(summary = "Get loadcases of a vessel")
    public ResponseEntity<ApiResponse<List<LoadcaseDTO>>> getLoadcases(@PathVariable Long vesselId) {
        return ResponseEntity.ok(ApiResponse.success(loadcaseService.getLoadcases(vesselId)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get loadcase by ID")
    public ResponseEntity<ApiResponse<LoadcaseDTO>> getLoadcase(@PathVariable Long vesselId, @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(loadcaseService.getLoadcase(vesselId, id)));
    }

    @PostMapping
    @Operation(summary = "Create a loadcase")
    public ResponseEntity<ApiResponse<LoadcaseDTO>> createLoadcase(
            @PathVariable Long vesselId,
            @Valid @RequestBody LoadcaseDTO dto) {
        LoadcaseDTO created = loadcaseService.createLoadcase(vesselId, dto);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(ApiResponse.success("Loadcase created successfully", created));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a loadcase")
    public ResponseEntity<ApiResponse<LoadcaseDTO>> updateLoadcase(
            @PathVariable Long vesselId,
            @PathVariable Long id,
            @Valid @RequestBody LoadcaseDTO dto) {
        LoadcaseDTO updated = loadcaseService.updateLoadcase(vesselId, id, dto);
        return ResponseEntity.ok(ApiResponse.success("Loadcase updated successfully", updated));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a loadcase")
    public ResponseEntity<ApiResponse<Void>> deleteLoadcase(@PathVariable Long vesselId, @PathVariable Long id) {
        loadcaseService.deleteLoadcase(vesselId, id);
        return ResponseEntity.ok(ApiResponse.success("Loadcase deleted successfully", null));
    }
}
