package com.lynkvertx.navarch.service;

import com.lynkvertx.navarch.config.HydrostaticsConfig;
import com.lynkvertx.navarch.dto.HydroConditionRequestDTO;
import com.lynkvertx.navarch.dto.HydroResultDTO;
import com.lynkvertx.navarch.dto.TrimSolutionDTO;
import com.lynkvertx.navarch.dto.TrimSolveRequestDTO;
import com.lynkvertx.navarch.service.hydrostatics.DisplacementTarget;
import com.lynkvertx.navarch.service.hydrostatics.FloatingCondition;
import com.lynkvertx.navarch.service.hydrostatics.HullGeometry;
import com.lynkvertx.navarch.service.hydrostatics.HydroCalculator;
import com.lynkvertx.navarch.service.hydrostatics.LoadcaseSnapshot;
import com.lynkvertx.navarch.service.hydrostatics.TrimProblem;
import com.lynkvertx.navarch.service.hydrostatics.TrimSolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HydrostaticsServiceTest {

    private static final Long VESSEL_ID = 1L;

    @Mock
    private HullGeometryService geometryService;
    @Mock
    private HydroCalculator calculator;
    @Mock
    private TrimSolver trimSolver;

    private final HullGeometry geometry = HullGeometry.builder()
        .station(0, BigDecimal.ZERO).station(1, BigDecimal.TEN)
        .waterline(0, BigDecimal.ZERO).waterline(1, BigDecimal.ONE)
        .offset(0, 0, BigDecimal.ONE).offset(1, 0, BigDecimal.ONE)
        .build();
    private HydrostaticsService hydrostaticsService;

    @BeforeEach
    void setUp() {
        hydrostaticsService = new HydrostaticsService(geometryService, calculator, trimSolver, new HydrostaticsConfig());
        when(geometryService.loadHullGeometry(VESSEL_ID)).thenReturn(geometry);
    }

    @Test
    void computesAtRequestedCondition() {
        LoadcaseSnapshot loadcase = LoadcaseSnapshot.ofDensity(new BigDecimal("1025"));
        HydroResultDTO result = HydroResultDTO.builder().dispVolume(new BigDecimal("10000")).build();
        when(geometryService.loadLoadcase(VESSEL_ID, null)).thenReturn(loadcase);
        FloatingCondition condition = FloatingCondition.of(new BigDecimal("5"), new BigDecimal("0.5"), BigDecimal.ZERO);
        when(calculator.computeAt(geometry, loadcase, condition)).thenReturn(result);

        HydroConditionRequestDTO request = new HydroConditionRequestDTO();
        request.setDraft(new BigDecimal("5"));
        request.setTrimAngle(new BigDecimal("0.5"));

        assertSame(result, hydrostaticsService.compute(VESSEL_ID, request));
    }

    @Test
    void trimTargetFallsBackToLoadcaseWeight() {
        LoadcaseSnapshot loadcase = LoadcaseSnapshot.builder()
            .id(2L).rho(new BigDecimal("1025")).targetDisplacement(new BigDecimal("5000000")).build();
        when(geometryService.loadLoadcase(VESSEL_ID, 2L)).thenReturn(loadcase);
        TrimSolutionDTO solution = TrimSolutionDTO.builder().converged(true).build();
        when(trimSolver.solve(eq(geometry), eq(loadcase), any(TrimProblem.class), any())).thenReturn(solution);

        TrimSolveRequestDTO request = new TrimSolveRequestDTO();
        request.setLoadcaseId(2L);
        request.setTargetType(DisplacementTarget.VOLUME);
        request.setInitialAftDraft(new BigDecimal("4"));
        request.setInitialForwardDraft(new BigDecimal("4"));

        assertTrue(hydrostaticsService.solveTrim(VESSEL_ID, request).isConverged());

        ArgumentCaptor<TrimProblem> problem = ArgumentCaptor.forClass(TrimProblem.class);
        verify(trimSolver).solve(eq(geometry), eq(loadcase), problem.capture(), any());
        assertEquals(new BigDecimal("5000000"), problem.getValue().getTargetDisplacement());
        assertEquals(DisplacementTarget.WEIGHT, problem.getValue().getTargetType());
    }

    @Test
    void trimWithoutAnyTargetIsRejected() {
        when(geometryService.loadLoadcase(VESSEL_ID, null)).thenReturn(LoadcaseSnapshot.ofDensity(new BigDecimal("1025")));

        TrimSolveRequestDTO request = new TrimSolveRequestDTO();
        request.setInitialAftDraft(new BigDecimal("4"));
        request.setInitialForwardDraft(new BigDecimal("4"));

        assertThrows(IllegalArgumentException.class, () -> hydrostaticsService.solveTrim(VESSEL_ID, request));
        verify(trimSolver, never()).solve(any(), any(), any(), any());
    }

    @Test
    void achievabilityDefaultsToWeight() {
        LoadcaseSnapshot loadcase = LoadcaseSnapshot.ofDensity(new BigDecimal("1025"));
        when(geometryService.loadLoadcase(VESSEL_ID, null)).thenReturn(loadcase);
        when(trimSolver.isDisplacementAchievable(geometry, loadcase, new BigDecimal("1000"), DisplacementTarget.WEIGHT))
            .thenReturn(true);

        assertTrue(hydrostaticsService.isDisplacementAchievable(VESSEL_ID, null, new BigDecimal("1000"), null));
    }
}
