package com.lynkvertx.navarch.service;

import com.lynkvertx.navarch.dto.VesselDTO;
import com.lynkvertx.navarch.entity.Vessel;
import com.lynkvertx.navarch.exception.ValidationFailedException;
import com.lynkvertx.navarch.repository.HullOffsetRepository;
import com.lynkvertx.navarch.repository.LoadcaseRepository;
import com.lynkvertx.navarch.repository.StationRepository;
import com.lynkvertx.navarch.repository.VesselRepository;
import com.lynkvertx.navarch.repository.WaterlineRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.persistence.EntityNotFoundException;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VesselServiceTest {

    @Mock
    private VesselRepository vesselRepository;
    @Mock
    private StationRepository stationRepository;
    @Mock
    private WaterlineRepository waterlineRepository;
    @Mock
    private HullOffsetRepository offsetRepository;
    @Mock
    private LoadcaseRepository loadcaseRepository;
    @Spy
    private ValidationService validationService = new ValidationService();

    @InjectMocks
    private VesselService vesselService;

    @Test
    void listsVesselsNewestFirst() {
        when(vesselRepository.findAllByOrderByCreatedAtDesc()).thenReturn(Arrays.asList(
            Vessel.builder().id(2L).name("Wigley").build(),
            Vessel.builder().id(1L).name("Barge").build()));

        List<VesselDTO> vessels = vesselService.getAllVessels();

        assertEquals(2, vessels.size());
        assertEquals("Wigley", vessels.get(0).getName());
    }

    @Test
    void createsVesselWithParticulars() {
        VesselDTO request = VesselDTO.builder()
            .name("Barge")
            .lpp(new BigDecimal("100"))
            .beam(new BigDecimal("20"))
            .designDraft(new BigDecimal("5"))
            .build();
        when(vesselRepository.save(any(Vessel.class))).thenAnswer(invocation -> {
            Vessel vessel = invocation.getArgument(0);
            vessel.setId(7L);
            return vessel;
        });

        VesselDTO created = vesselService.createVessel(request);

        ArgumentCaptor<Vessel> captor = ArgumentCaptor.forClass(Vessel.class);
        verify(vesselRepository).save(captor.capture());
        assertEquals(new BigDecimal("100"), captor.getValue().getLpp());
        assertEquals(7L, created.getId());
        assertEquals(new BigDecimal("5"), created.getDesignDraft());
    }

    @Test
    void createRejectsInconsistentParticularsBeforeSaving() {
        VesselDTO request = VesselDTO.builder()
            .name("Raft")
            .lpp(new BigDecimal("10"))
            .beam(new BigDecimal("12"))
            .designDraft(new BigDecimal("15"))
            .build();

        ValidationFailedException error = assertThrows(ValidationFailedException.class,
            () -> vesselService.createVessel(request));

        assertEquals(2, error.getResult().getErrors().size());
        assertEquals("beam", error.getResult().getErrors().get(0).getField());
        assertEquals("Design draft should not exceed beam", error.getResult().getErrors().get(1).getMessage());
        verify(vesselRepository, never()).save(any());
    }

    @Test
    void updateCopiesEditableFields() {
        Vessel existing = Vessel.builder().id(3L).name("Old").beam(new BigDecimal("10")).build();
        when(vesselRepository.findById(3L)).thenReturn(Optional.of(existing));
        when(vesselRepository.save(existing)).thenReturn(existing);

        VesselDTO updated = vesselService.updateVessel(3L,
            VesselDTO.builder().name("New").beam(new BigDecimal("12")).build());

        assertEquals("New", updated.getName());
        assertEquals(new BigDecimal("12"), updated.getBeam());
    }

    @Test
    void missingVesselIsNotFound() {
        when(vesselRepository.findById(9L)).thenReturn(Optional.empty());

        EntityNotFoundException error = assertThrows(EntityNotFoundException.class,
            () -> vesselService.getVesselById(9L));
        assertEquals("Vessel not found with id: 9", error.getMessage());
    }

    @Test
    void deleteRemovesGeometryAndLoadcasesFirst() {
        when(vesselRepository.existsById(4L)).thenReturn(true);

        vesselService.deleteVessel(4L);

        InOrder order = inOrder(offsetRepository, stationRepository, waterlineRepository,
            loadcaseRepository, vesselRepository);
        order.verify(offsetRepository).deleteByVesselId(4L);
        order.verify(stationRepository).deleteByVesselId(4L);
        order.verify(waterlineRepository).deleteByVesselId(4L);
        order.verify(loadcaseRepository).deleteByVesselId(4L);
        order.verify(vesselRepository).deleteById(4L);
    }

    @Test
    void deleteOfMissingVesselTouchesNothing() {
        when(vesselRepository.existsById(4L)).thenReturn(false);

        assertThrows(EntityNotFoundException.class, () -> vesselService.deleteVessel(4L));
        verify(offsetRepository, never()).deleteByVesselId(any());
        verify(vesselRepository, never()).deleteById(any());
    }
}
