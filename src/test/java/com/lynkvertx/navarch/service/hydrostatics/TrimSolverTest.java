package com.lynkvertx.navarch.service.hydrostatics;

import com.lynkvertx.navarch.dto.HydroResultDTO;
import com.lynkvertx.navarch.dto.TrimSolutionDTO;
import com.lynkvertx.navarch.exception.CalculationCancelledException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.lynkvertx.navarch.service.hydrostatics.TestHulls.bd;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrimSolverTest {

    private final HydroCalculator calculator = TestHulls.calculator();
    private final TrimSolver solver = new TrimSolver(TestHulls.config(), TestHulls.numeric(), calculator);
    private final HullGeometry barge = TestHulls.boxBarge();

    @Test
    void findsLevelDraftForTargetWeight() {
        TrimProblem problem = TrimProblem.builder()
            .targetDisplacement(bd("10865000"))
            .initialAftDraft(bd("4"))
            .initialForwardDraft(bd("4"))
            .build();

        TrimSolutionDTO solution = solver.solve(barge, TestHulls.seaWater(), problem, CancellationSignal.NONE);

        assertTrue(solution.isConverged());
        assertFalse(solution.isLongitudinalBalance());
        assertEquals(4, solution.getIterations());
        assertEquals(4, solution.getTrace().size());
        assertEquals(5.3, solution.getMeanDraft().doubleValue(), 1e-6);
        assertEquals(5.3, solution.getAftDraft().doubleValue(), 1e-6);
        assertEquals(5.3, solution.getForwardDraft().doubleValue(), 1e-6);
        assertEquals(0, solution.getTrimAngle().signum());
        assertEquals(170.833333, solution.getMtc().doubleValue(), 1e-3);
        assertNull(solution.getLcbResidual());
        assertTrue(solution.getResidual().abs().compareTo(bd("100")) <= 0);
    }

    @Test
    void dampsLargeDraftSteps() {
        TrimProblem problem = TrimProblem.builder()
            .targetDisplacement(bd("10865000"))
            .initialAftDraft(bd("4"))
            .initialForwardDraft(bd("4"))
            .build();

        TrimSolutionDTO solution = solver.solve(barge, TestHulls.seaWater(), problem, CancellationSignal.NONE);

        TrimSolutionDTO.Iteration first = solution.getTrace().get(0);
        assertEquals(0.5, first.getDraftStep().doubleValue(), 1e-9);
        assertEquals(2050000.0, first.getDerivative().doubleValue(), 1e-3);
        assertEquals(0, solution.getTrace().get(3).getDraftStep().signum());
    }

    @Test
    void balancesLcbAgainstLcgOnBarge() {
        LoadcaseSnapshot loadcase = LoadcaseSnapshot.builder()
            .rho(TestHulls.SEA_WATER).lcg(bd("48.5")).build();
        TrimProblem problem = TrimProblem.builder()
            .targetDisplacement(bd("10250000"))
            .initialAftDraft(bd("5"))
            .initialForwardDraft(bd("5"))
            .build();

        TrimSolutionDTO solution = solver.solve(barge, loadcase, problem, CancellationSignal.NONE);

        // LCB = 50 - L²·tanθ / (12·T) gives tanθ = 0.009 at T = 5
        assertTrue(solution.isConverged());
        assertTrue(solution.isLongitudinalBalance());
        assertEquals(5.0, solution.getMeanDraft().doubleValue(), 1e-3);
        assertEquals(Math.toDegrees(Math.atan(0.009)), solution.getTrimAngle().doubleValue(), 1e-3);
        assertEquals(5.45, solution.getAftDraft().doubleValue(), 1e-3);
        assertEquals(4.55, solution.getForwardDraft().doubleValue(), 1e-3);
        assertEquals(0.9, solution.getTrim().doubleValue(), 1e-3);
        assertTrue(solution.getLcbResidual().abs().compareTo(bd("0.001")) <= 0);
    }

    @Test
    void trimsWigleyByTheBowForForwardLcg() {
        HullGeometry wigley = TestHulls.wigley();
        BigDecimal targetVolume = calculator.computeAt(wigley, TestHulls.seaWater(),
            FloatingCondition.upright(bd("5"))).getDispVolume();
        LoadcaseSnapshot loadcase = LoadcaseSnapshot.builder()
            .rho(TestHulls.SEA_WATER).lcg(bd("52")).build();
        TrimProblem problem = TrimProblem.builder()
            .targetDisplacement(targetVolume)
            .targetType(DisplacementTarget.VOLUME)
            .initialAftDraft(bd("6"))
            .initialForwardDraft(bd("6"))
            .tolerance(bd("0.01"))
            .build();

        TrimSolutionDTO solution = solver.solve(wigley, loadcase, problem, CancellationSignal.NONE);

        assertTrue(solution.isConverged());
        assertEquals(4.9975, solution.getMeanDraft().doubleValue(), 1e-2);
        assertEquals(-0.7003, solution.getTrimAngle().doubleValue(), 2e-2);
        assertTrue(solution.getForwardDraft().compareTo(solution.getAftDraft()) > 0);
        HydroResultDTO hydro = solution.getHydrostatics();
        assertEquals(52.0, hydro.getLcb().doubleValue(), 1e-3);
        assertEquals(targetVolume.doubleValue(), hydro.getDispVolume().doubleValue(), 0.01);
    }

    @Test
    void reportsNonConvergenceForUnreachableTarget() {
        TrimProblem problem = TrimProblem.builder()
            .targetDisplacement(bd("25000000"))
            .initialAftDraft(bd("4"))
            .initialForwardDraft(bd("4"))
            .maxIterations(5)
            .build();

        TrimSolutionDTO solution = solver.solve(barge, TestHulls.seaWater(), problem, CancellationSignal.NONE);

        assertFalse(solution.isConverged());
        assertEquals(5, solution.getIterations());
        assertTrue(solution.getResidual().signum() > 0);
    }

    @Test
    void stopsWhenCancelled() {
        TrimProblem problem = TrimProblem.builder()
            .targetDisplacement(bd("10865000"))
            .initialAftDraft(bd("4"))
            .initialForwardDraft(bd("4"))
            .build();

        assertThrows(CalculationCancelledException.class,
            () -> solver.solve(barge, TestHulls.seaWater(), problem, () -> true));
    }

    @Test
    void rejectsInvalidProblems() {
        TrimProblem noTarget = TrimProblem.builder()
            .initialAftDraft(bd("4")).initialForwardDraft(bd("4")).build();
        TrimProblem dryStart = TrimProblem.builder()
            .targetDisplacement(bd("1000")).initialAftDraft(BigDecimal.ZERO).initialForwardDraft(bd("4")).build();
        TrimProblem noIterations = TrimProblem.builder()
            .targetDisplacement(bd("1000")).initialAftDraft(bd("4")).initialForwardDraft(bd("4"))
            .maxIterations(0).build();

        assertThrows(IllegalArgumentException.class,
            () -> solver.solve(barge, TestHulls.seaWater(), noTarget, CancellationSignal.NONE));
        assertThrows(IllegalArgumentException.class,
            () -> solver.solve(barge, TestHulls.seaWater(), dryStart, CancellationSignal.NONE));
        assertThrows(IllegalArgumentException.class,
            () -> solver.solve(barge, TestHulls.seaWater(), noIterations, CancellationSignal.NONE));
    }

    @Test
    void achievableUpToFullDisplacement() {
        assertTrue(solver.isDisplacementAchievable(barge, TestHulls.seaWater(), bd("20500000"), DisplacementTarget.WEIGHT));
        assertFalse(solver.isDisplacementAchievable(barge, TestHulls.seaWater(), bd("20500001"), DisplacementTarget.WEIGHT));
        assertTrue(solver.isDisplacementAchievable(barge, TestHulls.seaWater(), bd("20000"), DisplacementTarget.VOLUME));
        assertFalse(solver.isDisplacementAchievable(barge, TestHulls.seaWater(), BigDecimal.ZERO, DisplacementTarget.WEIGHT));
    }

    @Test
    void halvesStepsThatWouldLeaveEveryStationOutOfRange() {
        // Trim fixed at the initial 19.9 m over 100 m: the aft station stays above the top
        // waterline, so the forward station is the only one that can be integrated
        TrimProblem problem = TrimProblem.builder()
            .targetDisplacement(bd("1000000"))
            .initialAftDraft(bd("20"))
            .initialForwardDraft(bd("0.1"))
            .build();

        TrimSolutionDTO solution = solver.solve(TestHulls.endStationBarge(), TestHulls.seaWater(), problem,
            CancellationSignal.NONE);

        assertFalse(solution.isConverged());
        assertTrue(solution.getIterations() >= 1 && solution.getIterations() <= 20);
        assertEquals(solution.getIterations(), solution.getTrace().size());
        assertEquals(Math.toDegrees(Math.atan(0.199)), solution.getTrimAngle().doubleValue(), 1e-6);
        assertTrue(solution.getMeanDraft().compareTo(bd("9.95")) >= 0);
        assertTrue(solution.getForwardDraft().signum() >= 0);
        assertTrue(solution.getResidual().signum() < 0);
        assertEquals(-0.03125, solution.getTrace().get(0).getDraftStep().doubleValue(), 1e-9);
        for (TrimSolutionDTO.Iteration iteration : solution.getTrace()) {
            assertTrue(iteration.getDraftStep().signum() <= 0);
        }
    }

    @Test
    void reducesInitialTrimUntilAStationIsInRange() {
        // Aft 30 / forward 0.1 about a mean draft clamped to 10 leaves the forward station dry
        // and the aft one above the top waterline; half the trim brings the forward one back
        TrimProblem problem = TrimProblem.builder()
            .targetDisplacement(bd("11275000"))
            .initialAftDraft(bd("30"))
            .initialForwardDraft(bd("0.1"))
            .build();

        TrimSolutionDTO solution = solver.solve(TestHulls.endStationBarge(), TestHulls.seaWater(), problem,
            CancellationSignal.NONE);

        assertTrue(solution.isConverged());
        assertEquals(Math.toDegrees(Math.atan(0.299)) / 2, solution.getTrimAngle().doubleValue(), 1e-6);
        assertEquals(1.0, solution.getForwardDraft().doubleValue(), 1e-3);
        assertEquals(11000.0, solution.getHydrostatics().getDispVolume().doubleValue(), 0.1);
    }
}
