package com.lynkvertx.navarch.service;

import com.lynkvertx.navarch.dto.LoadcaseDTO;
import com.lynkvertx.navarch.entity.Loadcase;
import com.lynkvertx.navarch.repository.LoadcaseRepository;
import com.lynkvertx.navarch.repository.VesselRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityNotFoundException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loadcase Service
 * CRUD for loadcases, always scoped to their vessel
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoadcaseService {

    private final LoadcaseRepository loadcaseRepository;
    private final VesselRepository vesselRepository;

    public List<LoadcaseDTO> getLoadcases(Long vesselId) {
        requireVessel(vesselId);
        return loadcaseRepository.findByVesselIdOrderByIdAsc(vesselId)
            .stream()
            .map(this::toDTO)
            .collect(Collectors.toList());
    }

    public LoadcaseDTO getLoadcase(Long vesselId, Long id) {
        return toDTO(findLoadcase(vesselId, id));
    }

    @Transactional
    public LoadcaseDTO createLoadcase(Long vesselId, LoadcaseDTO dto) {
        requireVessel(vesselId);
        validate(dto);
        Loadcase loadcase = toEntity(dto);
        loadcase.setVesselId(vesselId);
        Loadcase saved = loadcaseRepository.save(loadcase);
        log.info("Created loadcase {} for vessel: {}", saved.getId(), vesselId);
        return toDTO(saved);
    }

    @Transactional
    public LoadcaseDTO updateLoadcase(Long vesselId, Long id, LoadcaseDTO dto) {
        validate(dto);
        Loadcase existing = findLoadcase(vesselId, id);

        existing.setName(dto.getName());
        existing.setRho(dto.getRho());
        existing.setKg(dto.getKg());
        existing.setLcg(dto.getLcg());
        existing.setTargetDisplacement(dto.getTargetDisplacement());
        existing.setNotes(dto.getNotes());

        Loadcase saved = loadcaseRepository.save(existing);
        log.info("Updated loadcase {} for vessel: {}", saved.getId(), vesselId);
        return toDTO(saved);
    }

    @Transactional
    public void deleteLoadcase(Long vesselId, Long id) {
        Loadcase existing = findLoadcase(vesselId, id);
        loadcaseRepository.delete(existing);
        log.info("Deleted loadcase {} of vessel: {}", id, vesselId);
    }

    private void validate(LoadcaseDTO dto) {
        if (dto.getRho() == null || dto.getRho().signum() <= 0) {
            throw new IllegalArgumentException("Density must be positive");
        }
        if (dto.getKg() != null && dto.getKg().signum() < 0) {
            throw new IllegalArgumentException("KG must not be negative");
        }
    }

    private void requireVessel(Long vesselId) {
        if (!vesselRepository.existsById(vesselId)) {
            throw new EntityNotFoundException("Vessel not found with id: " + vesselId);
        }
    }

    private Loadcase findLoadcase(Long vesselId, Long id) {
        requireVessel(vesselId);
        return loadcaseRepository.findByIdAndVesselId(id, vesselId)
            .orElseThrow(() -> new EntityNotFoundException(
                "Loadcase not found with id: " + id + " for vessel: " + vesselId));
    }

    private LoadcaseDTO toDTO(Loadcase entity) {
        return LoadcaseDTO.builder()
            .id(entity.getId())
            .vesselId(entity.getVesselId())
            .name(entity.getName())
            .rho(entity.getRho())
            .kg(entity.getKg())
            .lcg(entity.getLcg())
            .targetDisplacement(entity.getTargetDisplacement())
            .notes(entity.getNotes())
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .build();
    }

    private Loadcase toEntity(LoadcaseDTO dto) {
        return Loadcase.builder()
            .name(dto.getName())
            .rho(dto.getRho())
            .kg(dto.getKg())
            .lcg(dto.getLcg())
            .targetDisplacement(dto.getTargetDisplacement())
            .notes(dto.getNotes())
            .build();
    }
}
