package com.lynkvertx.navarch.controller;

import com.lynkvertx.navarch.dto.ApiResponse;
import com.lynkvertx.navarch.dto.VesselDTO;
import com.lynkvertx.navarch.service.VesselService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.List;

/**
 * Vessel REST Controller
 */
@RestController
@RequestMapping("/api/vessels")
@RequiredArgsConstructor
@Tag(name = "Vessels", description = "Vessel management APIs")
public class VesselController {

    private final VesselService vesselService;

    @GetMapping
    @Operation(summary = "Get all vessels", description = "Retrieves all vessels, newest first")
    public ResponseEntity<ApiResponse<List<VesselDTO>>> getAllVessels() {
        return ResponseEntity.ok(ApiResponse.success(vesselService.getAllVessels()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get vessel by ID")
    public ResponseEntity<ApiResponse<VesselDTO>> getVesselById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(vesselService.getVesselById(id)));
    }

    @PostMapping
    @Operation(summary = "Create a vessel", description = "Creates a vessel with its principal particulars")
    public ResponseEntity<ApiResponse<VesselDTO>> createVessel(@Valid @RequestBody VesselDTO dto) {
        VesselDTO created = vesselService.createVessel(dto);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(ApiResponse.success("Vessel created successfully", created));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a vessel")
    public ResponseEntity<ApiResponse<VesselDTO>> updateVessel(
            @PathVariable Long id,
            @Valid @RequestBody VesselDTO dto) {
        VesselDTO updated = vesselService.updateVessel(id, dto);
        return ResponseEntity.ok(ApiResponse.success("Vessel updated successfully", updated));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a vessel", description = "Deletes a vessel with its hull geometry and loadcases")
    public ResponseEntity<ApiResponse<Void>> deleteVessel(@PathVariable Long id) {
        vesselService.deleteVessel(id);
        return ResponseEntity.ok(ApiResponse.success("Vessel deleted successfully", null));
    }
}
