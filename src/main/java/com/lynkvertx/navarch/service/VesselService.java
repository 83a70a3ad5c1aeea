package com.lynkvertx.navarch.service;

import com.lynkvertx.navarch.dto.VesselDTO;
import com.lynkvertx.navarch.entity.Vessel;
import com.lynkvertx.navarch.repository.HullOffsetRepository;
import com.lynkvertx.navarch.repository.LoadcaseRepository;
import com.lynkvertx.navarch.repository.StationRepository;
import com.lynkvertx.navarch.repository.VesselRepository;
import com.lynkvertx.navarch.repository.WaterlineRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityNotFoundException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Vessel Service
 * CRUD for vessels; particulars are checked before every save,
 * and deleting a vessel removes its geometry and loadcases
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VesselService {

    private final VesselRepository vesselRepository;
    private final StationRepository stationRepository;
    private final WaterlineRepository waterlineRepository;
    private final HullOffsetRepository offsetRepository;
    private final LoadcaseRepository loadcaseRepository;
    private final ValidationService validationService;

    public List<VesselDTO> getAllVessels() {
        return vesselRepository.findAllByOrderByCreatedAtDesc()
            .stream()
            .map(this::toDTO)
            .collect(Collectors.toList());
    }

    public VesselDTO getVesselById(Long id) {
        return toDTO(findVessel(id));
    }

    @Transactional
    public VesselDTO createVessel(VesselDTO dto) {
        validationService.requireValid(validationService.validateVessel(dto), "Vessel " + dto.getName());
        Vessel saved = vesselRepository.save(toEntity(dto));
        log.info("Created new vessel with id: {}", saved.getId());
        return toDTO(saved);
    }

    @Transactional
    public VesselDTO updateVessel(Long id, VesselDTO dto) {
        Vessel existing = findVessel(id);
        validationService.requireValid(validationService.validateVessel(dto), "Vessel " + id);

        existing.setName(dto.getName());
        existing.setDescription(dto.getDescription());
        existing.setLpp(dto.getLpp());
        existing.setBeam(dto.getBeam());
        existing.setDesignDraft(dto.getDesignDraft());

        Vessel saved = vesselRepository.save(existing);
        log.info("Updated vessel with id: {}", saved.getId());
        return toDTO(saved);
    }

    @Transactional
    public void deleteVessel(Long id) {
        if (!vesselRepository.existsById(id)) {
            throw new EntityNotFoundException("Vessel not found with id: " + id);
        }
        offsetRepository.deleteByVesselId(id);
        stationRepository.deleteByVesselId(id);
        waterlineRepository.deleteByVesselId(id);
        loadcaseRepository.deleteByVesselId(id);
        vesselRepository.deleteById(id);
        log.info("Deleted vessel with id: {} together with its geometry and loadcases", id);
    }

    private Vessel findVessel(Long id) {
        return vesselRepository.findById(id)
            .orElseThrow(() -> new EntityNotFoundException("Vessel not found with id: " + id));
    }

    private VesselDTO toDTO(Vessel entity) {
        return VesselDTO.builder()
            .id(entity.getId())
            .name(entity.getName())
            .description(entity.getDescription())
            .lpp(entity.getLpp())
            .beam(entity.getBeam())
            .designDraft(entity.getDesignDraft())
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .build();
    }

    private Vessel toEntity(VesselDTO dto) {
        return Vessel.builder()
            .name(dto.getName())
            .description(dto.getDescription())
            .lpp(dto.getLpp())
            .beam(dto.getBeam())
            .designDraft(dto.getDesignDraft())
            .build();
    }
}
