package com.lynkvertx.navarch.service.hydrostatics;

import com.lynkvertx.navarch.config.HydrostaticsConfig;
import com.lynkvertx.navarch.dto.HydroResultDTO;
import com.lynkvertx.navarch.dto.TrimSolutionDTO;
import com.lynkvertx.navarch.exception.InvalidOperationException;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Trim Solver
 *
 * Finds the floating condition whose displacement matches a target, by damped
 * Newton-Raphson iteration over the Hydrostatic Calculator with finite-difference
 * derivatives.
 * <ul>
 *   <li>Without LCG the trim angle stays at the one implied by the initial drafts
 *       and only the mean draft is solved.</li>
 *   <li>With LCG, mean draft and trim angle are solved together so that LCB also
 *       comes over LCG. A singular Jacobian falls back to a draft-only step.</li>
 * </ul>
 * A step that would leave no station inside the waterline range is halved until
 * it does not. Every step is recorded in an immutable trace. Running out of
 * iterations, or of step halvings, is a normal outcome reported with
 * {@code converged = false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrimSolver {

    private static final BigDecimal TRIM_LIMIT = BigDecimal.valueOf(89);
    private static final BigDecimal DRAFT_FLOOR_FRACTION = new BigDecimal("0.001");
    private static final BigDecimal TONNE = BigDecimal.valueOf(1000);
    private static final BigDecimal CM_PER_M = BigDecimal.valueOf(100);
    private static final int MAX_HALVINGS = 30;

    private final HydrostaticsConfig config;
    private final NumericPolicy numeric;
    private final HydroCalculator calculator;

    /**
     * Solve for the target displacement of {@code problem}.
     *
     * @throws IllegalArgumentException for a non-positive target or initial draft
     */
    public TrimSolutionDTO solve(HullGeometry geometry, LoadcaseSnapshot loadcase, TrimProblem problem,
                                 CancellationSignal signal) {
        validate(problem);
        MathContext mc = numeric.mc();
        int maxIterations = problem.getMaxIterations() != null ? problem.getMaxIterations() : config.getTrimMaxIterations();
        BigDecimal tolerance = problem.getTolerance() != null ? problem.getTolerance() : config.getTrimTolerance();

        BigDecimal span = geometry.span();
        BigDecimal draft = problem.getInitialAftDraft().add(problem.getInitialForwardDraft(), mc)
            .multiply(NumericPolicy.HALF, mc);
        BigDecimal trim = numeric.atanDeg(numeric.divide(
            problem.getInitialAftDraft().subtract(problem.getInitialForwardDraft(), mc), span));
        draft = clampDraft(draft, geometry);

        Solver solver = new Solver(geometry, loadcase, problem.getTargetType(), problem.getTargetDisplacement(), tolerance);
        List<TrimSolutionDTO.Iteration> trace = new ArrayList<>();
        boolean converged = false;
        boolean stalled = false;
        State state = solver.initial(draft, trim);
        int iteration = 0;
        while (iteration < maxIterations) {
            signal.throwIfCancelled("trim solve");
            iteration++;
            if (solver.isConverged(state)) {
                trace.add(solver.record(iteration, state, null, BigDecimal.ZERO, BigDecimal.ZERO));
                converged = true;
                break;
            }
            Step step = loadcase.hasLcg() ? solver.coupledStep(state) : solver.draftStep(state);
            Optional<State> next = solver.advance(state, step);
            if (next.isEmpty()) {
                trace.add(solver.record(iteration, state, step.getDerivative(), BigDecimal.ZERO, BigDecimal.ZERO));
                log.warn("Trim solver stalled at T={} trim={}: no damped step keeps a station inside the waterline range",
                    state.getDraft(), state.getTrim());
                stalled = true;
                break;
            }
            State moved = next.get();
            BigDecimal draftStep = moved.getDraft().subtract(state.getDraft(), mc);
            BigDecimal trimStep = moved.getTrim().subtract(state.getTrim(), mc);
            trace.add(solver.record(iteration, state, step.getDerivative(), draftStep, trimStep));
            log.debug("Trim iteration {}: T={} trim={} residual={} lcbResidual={} step=({}, {})",
                iteration, state.getDraft(), state.getTrim(), state.getResidual(), state.getLcbResidual(),
                draftStep, trimStep);
            state = moved;
        }
        if (!converged) {
            converged = !stalled && solver.isConverged(state);
            if (!stalled) {
                iteration = maxIterations;
            }
            if (!converged) {
                log.warn("Trim solver did not converge in {} iterations: residual {} (tolerance {}), LCB residual {}",
                    iteration, state.getResidual(), tolerance, state.getLcbResidual());
            }
        }
        if (converged) {
            log.info("Trim solved in {} iterations: T={} m, trim={}°, residual {}",
                iteration, numeric.round(state.getDraft()), numeric.round(state.getTrim()), state.getResidual());
        }
        return toSolution(geometry, problem, state, converged, iteration, loadcase.hasLcg(), trace);
    }

    /**
     * Whether the target lies between zero and the upright displacement at the top waterline.
     */
    public boolean isDisplacementAchievable(HullGeometry geometry, LoadcaseSnapshot loadcase,
                                            BigDecimal target, DisplacementTarget targetType) {
        if (target == null || target.signum() <= 0) {
            return false;
        }
        HydroResultDTO full = calculator.computeAt(geometry, loadcase, FloatingCondition.upright(geometry.topWaterline()));
        return target.compareTo(measure(full, targetType)) <= 0;
    }

    private void validate(TrimProblem problem) {
        if (problem.getTargetDisplacement() == null || problem.getTargetDisplacement().signum() <= 0) {
            throw new IllegalArgumentException("Target displacement must be positive, got " + problem.getTargetDisplacement());
        }
        if (problem.getInitialForwardDraft() == null || problem.getInitialForwardDraft().signum() <= 0
            || problem.getInitialAftDraft() == null || problem.getInitialAftDraft().signum() <= 0) {
            throw new IllegalArgumentException("Initial drafts must be positive, got forward "
                + problem.getInitialForwardDraft() + " and aft " + problem.getInitialAftDraft());
        }
        if (problem.getMaxIterations() != null && problem.getMaxIterations() < 1) {
            throw new IllegalArgumentException("Iteration limit must be at least 1");
        }
        if (problem.getTolerance() != null && problem.getTolerance().signum() <= 0) {
            throw new IllegalArgumentException("Tolerance must be positive, got " + problem.getTolerance());
        }
    }

    private TrimSolutionDTO toSolution(HullGeometry geometry, TrimProblem problem, State state, boolean converged,
                                       int iterations, boolean balanced, List<TrimSolutionDTO.Iteration> trace) {
        MathContext mc = numeric.mc();
        BigDecimal tan = numeric.tanDeg(state.getTrim());
        BigDecimal aftDraft = state.getDraft().add(geometry.midX().subtract(geometry.aftX(), mc).multiply(tan, mc), mc);
        BigDecimal forwardDraft = state.getDraft().add(geometry.midX().subtract(geometry.foreX(), mc).multiply(tan, mc), mc);
        HydroResultDTO hydro = state.getResult();

        BigDecimal length = geometry.getLengthBetweenPerpendiculars() != null
            ? geometry.getLengthBetweenPerpendiculars() : geometry.span();
        BigDecimal mtc = hydro.getBml() == null ? null : numeric.divide(
            numeric.divide(hydro.getDispWeight(), TONNE).multiply(hydro.getBml(), mc),
            CM_PER_M.multiply(length, mc));

        return TrimSolutionDTO.builder()
            .targetDisplacement(problem.getTargetDisplacement())
            .targetType(problem.getTargetType())
            .converged(converged)
            .iterations(iterations)
            .longitudinalBalance(balanced)
            .aftDraft(numeric.round(aftDraft))
            .forwardDraft(numeric.round(forwardDraft))
            .meanDraft(numeric.round(state.getDraft()))
            .trim(numeric.round(aftDraft.subtract(forwardDraft, mc)))
            .trimAngle(numeric.round(state.getTrim()))
            .lcf(hydro.getLcf())
            .mtc(numeric.round(mtc))
            .residual(numeric.round(state.getResidual()))
            .lcbResidual(numeric.round(state.getLcbResidual()))
            .hydrostatics(hydro)
            .trace(List.copyOf(trace))
            .build();
    }

    private BigDecimal clampDraft(BigDecimal draft, HullGeometry geometry) {
        BigDecimal top = geometry.topWaterline();
        BigDecimal floor = top.multiply(DRAFT_FLOOR_FRACTION, numeric.mc());
        return draft.max(floor).min(top);
    }

    private BigDecimal clampTrim(BigDecimal trim) {
        return trim.max(TRIM_LIMIT.negate()).min(TRIM_LIMIT);
    }

    private static BigDecimal clampStep(BigDecimal step, BigDecimal limit) {
        return step.max(limit.negate()).min(limit);
    }

    private static BigDecimal measure(HydroResultDTO result, DisplacementTarget targetType) {
        return targetType == DisplacementTarget.VOLUME ? result.getDispVolume() : result.getDispWeight();
    }

    /** One evaluated point of the iteration */
    @Value
    private static class State {
        BigDecimal draft;
        BigDecimal trim;
        HydroResultDTO result;
        BigDecimal displacement;
        BigDecimal residual;
        BigDecimal lcbResidual;
    }

    @Value
    private static class Step {
        BigDecimal draft;
        BigDecimal trim;
        BigDecimal derivative;
    }

    /** Evaluation and step rules bound to one solve */
    @RequiredArgsConstructor(access = AccessLevel.PRIVATE)
    private final class Solver {
        private final HullGeometry geometry;
        private final LoadcaseSnapshot loadcase;
        private final DisplacementTarget targetType;
        private final BigDecimal target;
        private final BigDecimal tolerance;

        private State evaluate(BigDecimal draft, BigDecimal trim) {
            MathContext mc = numeric.mc();
            HydroResultDTO result = calculator.computeAt(geometry, loadcase, new FloatingCondition(draft, trim, BigDecimal.ZERO));
            BigDecimal displacement = measure(result, targetType);
            BigDecimal lcbResidual = loadcase.hasLcg() ? result.getLcb().subtract(loadcase.getLcg(), mc) : null;
            return new State(draft, trim, result, displacement, target.subtract(displacement, mc), lcbResidual);
        }

        /** Empty when no station has its local draft inside the waterline range */
        private Optional<State> tryEvaluate(BigDecimal draft, BigDecimal trim) {
            try {
                return Optional.of(evaluate(draft, trim));
            } catch (InvalidOperationException ex) {
                log.debug("Trim condition T={} trim={} rejected: {}", draft, trim, ex.getMessage());
                return Optional.empty();
            }
        }

        /**
         * The starting condition, with the trim halved towards zero until a station
         * lies inside the waterline range. At zero trim every station sits at the mean draft.
         */
        private State initial(BigDecimal draft, BigDecimal trim) {
            BigDecimal current = trim;
            for (int k = 0; k < MAX_HALVINGS; k++) {
                Optional<State> state = tryEvaluate(draft, current);
                if (state.isPresent()) {
                    if (k > 0) {
                        log.warn("Initial trim {}° leaves no station inside the waterline range; starting from {}°",
                            trim, current);
                    }
                    return state.get();
                }
                current = current.multiply(NumericPolicy.HALF, numeric.mc());
            }
            return evaluate(draft, BigDecimal.ZERO);
        }

        /** Applies the step, halving it until the new condition can be integrated */
        private Optional<State> advance(State state, Step step) {
            MathContext mc = numeric.mc();
            BigDecimal draftStep = step.getDraft();
            BigDecimal trimStep = step.getTrim();
            for (int k = 0; k < MAX_HALVINGS; k++) {
                Optional<State> next = tryEvaluate(
                    clampDraft(state.getDraft().add(draftStep, mc), geometry),
                    clampTrim(state.getTrim().add(trimStep, mc)));
                if (next.isPresent()) {
                    return next;
                }
                draftStep = draftStep.multiply(NumericPolicy.HALF, mc);
                trimStep = trimStep.multiply(NumericPolicy.HALF, mc);
            }
            return Optional.empty();
        }

        /** Evaluates one perturbation away, on the other side when the first side cannot be integrated */
        private Optional<State> perturbed(State state, BigDecimal dDraft, BigDecimal dTrim) {
            MathContext mc = numeric.mc();
            Optional<State> forward = tryEvaluate(state.getDraft().add(dDraft, mc), state.getTrim().add(dTrim, mc));
            if (forward.isPresent()) {
                return forward;
            }
            return tryEvaluate(state.getDraft().subtract(dDraft, mc), state.getTrim().subtract(dTrim, mc));
        }

        private boolean isConverged(State state) {
            if (state.getResidual().abs().compareTo(tolerance) > 0) {
                return false;
            }
            return state.getLcbResidual() == null || state.getLcbResidual().abs().compareTo(config.getTrimLcbTolerance()) <= 0;
        }

        /** d(displacement)/d(draft) by forward difference, backward at the top waterline; null when neither side integrates */
        private BigDecimal draftDerivative(State state) {
            Optional<State> perturbed = perturbed(state, draftPerturbation(state), BigDecimal.ZERO);
            return perturbed.map(p -> numeric.divide(p.getDisplacement().subtract(state.getDisplacement()),
                p.getDraft().subtract(state.getDraft()))).orElse(null);
        }

        private BigDecimal draftPerturbation(State state) {
            BigDecimal delta = config.getTrimDraftPerturbation();
            return state.getDraft().add(delta).compareTo(geometry.topWaterline()) > 0 ? delta.negate() : delta;
        }

        private Step draftStep(State state) {
            BigDecimal derivative = draftDerivative(state);
            BigDecimal maxStep = config.getTrimMaxDraftStep();
            BigDecimal step;
            if (derivative == null || numeric.isNegligible(derivative)) {
                log.warn("Flat displacement derivative at T={}; taking a full damped step", state.getDraft());
                step = state.getResidual().signum() >= 0 ? maxStep : maxStep.negate();
            } else {
                step = clampStep(numeric.divide(state.getResidual(), derivative), maxStep);
            }
            return new Step(step, BigDecimal.ZERO, derivative);
        }

        /**
         * Newton step on (draft, trim) for F = (displacement - target, LCB - LCG)
         * with a forward-difference Jacobian.
         */
        private Step coupledStep(State state) {
            MathContext mc = numeric.mc();
            Optional<State> draftSide = perturbed(state, draftPerturbation(state), BigDecimal.ZERO);
            Optional<State> trimSide = perturbed(state, BigDecimal.ZERO, config.getTrimAnglePerturbation());
            if (draftSide.isEmpty() || trimSide.isEmpty()) {
                log.warn("Trim Jacobian not available at T={} trim={}; stepping draft only", state.getDraft(), state.getTrim());
                return draftStep(state);
            }
            State byDraft = draftSide.get();
            State byTrim = trimSide.get();
            BigDecimal dT = byDraft.getDraft().subtract(state.getDraft(), mc);
            BigDecimal dTrim = byTrim.getTrim().subtract(state.getTrim(), mc);

            BigDecimal j11 = numeric.divide(byDraft.getDisplacement().subtract(state.getDisplacement(), mc), dT);
            BigDecimal j12 = numeric.divide(byTrim.getDisplacement().subtract(state.getDisplacement(), mc), dTrim);
            BigDecimal j21 = numeric.divide(byDraft.getLcbResidual().subtract(state.getLcbResidual(), mc), dT);
            BigDecimal j22 = numeric.divide(byTrim.getLcbResidual().subtract(state.getLcbResidual(), mc), dTrim);
            BigDecimal det = j11.multiply(j22, mc).subtract(j12.multiply(j21, mc), mc);

            BigDecimal scale = j11.abs().multiply(j22.abs(), mc).add(j12.abs().multiply(j21.abs(), mc), mc);
            if (scale.signum() == 0 || numeric.isNegligible(numeric.divide(det, scale))) {
                log.warn("Singular trim Jacobian at T={} trim={}; stepping draft only", state.getDraft(), state.getTrim());
                return draftStep(state);
            }
            BigDecimal f1 = state.getResidual().negate();
            BigDecimal f2 = state.getLcbResidual();
            BigDecimal draftStep = numeric.divide(f1.negate().multiply(j22, mc).add(f2.multiply(j12, mc), mc), det);
            BigDecimal trimStep = numeric.divide(f1.multiply(j21, mc).subtract(f2.multiply(j11, mc), mc), det);
            return new Step(
                clampStep(draftStep, config.getTrimMaxDraftStep()),
                clampStep(trimStep, config.getTrimMaxAngleStep()),
                j11);
        }

        private TrimSolutionDTO.Iteration record(int iteration, State state, BigDecimal derivative,
                                                 BigDecimal draftStep, BigDecimal trimStep) {
            return TrimSolutionDTO.Iteration.builder()
                .iteration(iteration)
                .meanDraft(numeric.round(state.getDraft()))
                .trimAngle(numeric.round(state.getTrim()))
                .displacement(state.getDisplacement())
                .residual(numeric.round(state.getResidual()))
                .derivative(numeric.round(derivative))
                .lcbResidual(numeric.round(state.getLcbResidual()))
                .draftStep(numeric.round(draftStep))
                .trimStep(numeric.round(trimStep))
                .build();
        }
    }
}
