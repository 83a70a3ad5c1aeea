package com.lynkvertx.navarch.service;

import com.lynkvertx.navarch.dto.LoadcaseDTO;
import com.lynkvertx.navarch.entity.Loadcase;
import com.lynkvertx.navarch.repository.LoadcaseRepository;
import com.lynkvertx.navarch.repository.VesselRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.persistence.EntityNotFoundException;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LoadcaseServiceTest {

    @Mock
    private LoadcaseRepository loadcaseRepository;
    @Mock
    private VesselRepository vesselRepository;

    @InjectMocks
    private LoadcaseService loadcaseService;

    @Test
    void createAttachesLoadcaseToVessel() {
        when(vesselRepository.existsById(1L)).thenReturn(true);
        when(loadcaseRepository.save(any(Loadcase.class))).thenAnswer(invocation -> {
            Loadcase loadcase = invocation.getArgument(0);
            loadcase.setId(11L);
            return loadcase;
        });

        LoadcaseDTO created = loadcaseService.createLoadcase(1L, LoadcaseDTO.builder()
            .name("Full load")
            .rho(new BigDecimal("1025"))
            .kg(new BigDecimal("4.5"))
            .build());

        ArgumentCaptor<Loadcase> captor = ArgumentCaptor.forClass(Loadcase.class);
        verify(loadcaseRepository).save(captor.capture());
        assertEquals(1L, captor.getValue().getVesselId());
        assertEquals(11L, created.getId());
        assertEquals(new BigDecimal("4.5"), created.getKg());
    }

    @Test
    void rejectsNonPositiveDensity() {
        when(vesselRepository.existsById(1L)).thenReturn(true);

        assertThrows(IllegalArgumentException.class, () -> loadcaseService.createLoadcase(1L,
            LoadcaseDTO.builder().name("Fresh").rho(BigDecimal.ZERO).build()));
        verify(loadcaseRepository, never()).save(any());
    }

    @Test
    void rejectsNegativeKg() {
        assertThrows(IllegalArgumentException.class, () -> loadcaseService.updateLoadcase(1L, 2L,
            LoadcaseDTO.builder().name("Bad").rho(new BigDecimal("1000")).kg(new BigDecimal("-1")).build()));
    }

    @Test
    void loadcaseOfAnotherVesselIsNotFound() {
        when(vesselRepository.existsById(1L)).thenReturn(true);
        when(loadcaseRepository.findByIdAndVesselId(5L, 1L)).thenReturn(Optional.empty());

        assertThrows(EntityNotFoundException.class, () -> loadcaseService.getLoadcase(1L, 5L));
    }

    @Test
    void listingRequiresVessel() {
        when(vesselRepository.existsById(8L)).thenReturn(false);

        assertThrows(EntityNotFoundException.class, () -> loadcaseService.getLoadcases(8L));
    }

    @Test
    void listsLoadcasesOfVessel() {
        when(vesselRepository.existsById(1L)).thenReturn(true);
        when(loadcaseRepository.findByVesselIdOrderByIdAsc(1L)).thenReturn(Collections.singletonList(
            Loadcase.builder().id(3L).vesselId(1L).name("Ballast").rho(new BigDecimal("1025")).build()));

        assertEquals("Ballast", loadcaseService.getLoadcases(1L).get(0).getName());
    }

    @Test
    void deleteRemovesTheStoredLoadcase() {
        Loadcase stored = Loadcase.builder().id(3L).vesselId(1L).name("Ballast").build();
        when(vesselRepository.existsById(1L)).thenReturn(true);
        when(loadcaseRepository.findByIdAndVesselId(3L, 1L)).thenReturn(Optional.of(stored));

        loadcaseService.deleteLoadcase(1L, 3L);

        verify(loadcaseRepository).delete(stored);
    }
}
