package com.lynkvertx.navarch.service;

import com.lynkvertx.navarch.dto.HullGeometryDTO;
import com.lynkvertx.navarch.dto.TemplateVesselDTO;
import com.lynkvertx.navarch.dto.VesselDTO;
import com.lynkvertx.navarch.repository.VesselRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Template Vessel Service
 * Creates vessels from the reference hulls, with their geometry and design loadcase,
 * through the same services (and checks) as user-entered vessels
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateVesselService {

    private final VesselRepository vesselRepository;
    private final VesselService vesselService;
    private final HullGeometryService geometryService;
    private final LoadcaseService loadcaseService;

    public List<TemplateVesselDTO> getTemplates() {
        return Arrays.stream(TemplateVessel.values())
            .map(TemplateVessel::describe)
            .collect(Collectors.toList());
    }

    /**
     * Create a new vessel from a template; every call makes an independent copy
     */
    @Transactional
    public VesselDTO createFromTemplate(TemplateVessel template) {
        VesselDTO vessel = vesselService.createVessel(template.vessel());
        HullGeometryDTO geometry = geometryService.replaceGeometry(vessel.getId(), template.geometry());
        loadcaseService.createLoadcase(vessel.getId(), template.designLoadcase());
        log.info("Created vessel {} from template {}: {} stations, {} waterlines, {} offsets",
            vessel.getId(), template, geometry.getStations().size(), geometry.getWaterlines().size(),
            geometry.getOffsets().size());
        return vessel;
    }

    /**
     * Create every template whose vessel name is not taken yet
     *
     * @return the vessels created by this call
     */
    @Transactional
    public List<VesselDTO> seedMissingTemplates() {
        List<VesselDTO> created = new ArrayList<>();
        for (TemplateVessel template : TemplateVessel.values()) {
            if (vesselRepository.existsByName(template.getVesselName())) {
                log.info("Template vessel '{}' already exists, skipping seed", template.getVesselName());
                continue;
            }
            created.add(createFromTemplate(template));
        }
        return created;
    }
}
