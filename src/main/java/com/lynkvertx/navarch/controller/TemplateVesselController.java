package com.lynkvertx.navarch.controller;

import com.lynkvertx.navarch.dto.ApiResponse;
import com.lynkvertx.navarch.dto.TemplateVesselDTO;
import com.lynkvertx.navarch.dto.VesselDTO;
import com.lynkvertx.navarch.service.TemplateVessel;
import com.lynkvertx.navarch.service.TemplateVesselService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Template Vessel REST Controller
 */
@RestController
@RequestMapping("/api/templates")
@RequiredArgsConstructor
@Tag(name = "Templates", description = "Reference hulls that can be instantiated as vessels")
public class TemplateVesselController {

    private final TemplateVesselService templateService;

    @GetMapping
    @Operation(summary = "List templates")
    public ResponseEntity<ApiResponse<List<TemplateVesselDTO>>> getTemplates() {
        return ResponseEntity.ok(ApiResponse.success(templateService.getTemplates()));
    }

    @PostMapping("/{template}/vessels")
    @Operation(summary = "Create a vessel from a template",
        description = "Creates a vessel with the template's particulars, offset table and design loadcase")
    public ResponseEntity<ApiResponse<VesselDTO>> createFromTemplate(@PathVariable TemplateVessel template) {
        VesselDTO created = templateService.createFromTemplate(template);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(ApiResponse.success("Vessel created from template", created));
    }
}
