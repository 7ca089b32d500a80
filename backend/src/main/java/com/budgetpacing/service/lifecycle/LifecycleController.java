package com.budgetpacing.service.lifecycle;

import com.budgetpacing.entity.BudgetAdjustment;
import com.budgetpacing.entity.BudgetPlan;
import com.budgetpacing.entity.PacingPhase;
import com.budgetpacing.entity.PacingState;
import com.budgetpacing.entity.PhaseTransitionLog;
import com.budgetpacing.entity.TransitionTrigger;
import com.budgetpacing.exception.ConcurrentStateModificationException;
import com.budgetpacing.exception.IllegalPhaseTransitionException;
import com.budgetpacing.exception.ResourceNotFoundException;
import com.budgetpacing.monitoring.PacingMetrics;
import com.budgetpacing.repository.jpa.PacingStateRepository;
import com.budgetpacing.repository.jpa.PhaseTransitionLogRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns each campaign's {@link PacingState}. No other component writes the state; every write goes
 * through {@link #save} so a concurrent change (typically an operator override) surfaces as a
 * {@link ConcurrentStateModificationException} instead of being overwritten.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LifecycleController {

    private static final String SYSTEM_ACTOR = "system";

    private final PacingStateRepository pacingStateRepository;
    private final PhaseTransitionLogRepository transitionLogRepository;
    private final PacingMetrics metrics;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<PacingState> find(String campaignId) {
        return pacingStateRepository.findById(campaignId);
    }

    public PacingState get(String campaignId) {
        return find(campaignId)
                .orElseThrow(() -> new ResourceNotFoundException("PacingState", campaignId));
    }

    /** Loads the live state, creating an ACTIVE one the first time a campaign is seen */
    @Transactional
    public PacingState loadOrInitialize(String campaignId, BudgetPlan plan) {
        Optional<PacingState> existing = pacingStateRepository.findById(campaignId);
        if (existing.isPresent()) {
            return existing.get();
        }
        PacingState state =
                PacingState.builder()
                        .campaignId(campaignId)
                        .planId(plan != null ? plan.getId() : null)
                        .phase(PacingPhase.ACTIVE)
                        .build();
        try {
            PacingState saved = pacingStateRepository.saveAndFlush(state);
            logTransition(
                    campaignId,
                    null,
                    PacingPhase.ACTIVE,
                    TransitionTrigger.PERIOD_ROLLOVER,
                    "Pacing state initialized",
                    SYSTEM_ACTOR);
            log.info("Initialized pacing state: campaignId={}", campaignId);
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new ConcurrentStateModificationException(
                    campaignId, "Pacing state was initialized concurrently", e);
        }
    }

    /**
     * Persists the outcome of an evaluation cycle: ratio bookkeeping, band-driven ACTIVE/THROTTLED
     * moves, exhaustion and, when an approval was requested, the move to AWAITING_APPROVAL.
     *
     * <p>{@code state} is the copy read at the start of the cycle; its version is the expected
     * version for the compare-and-swap.
     */
    @Transactional
    public PacingState finalizeEvaluation(PacingState state, EvaluationUpdate update) {
        state.setPacingRatio(update.getPacingRatio());
        state.setTargetDailySpend(update.getTargetDailySpend());
        state.setLastEvaluatedAt(update.getEvaluatedAt());
        state.setLastEvaluationBucket(update.getEvaluationBucket());
        if (update.getPlanId() != null) {
            state.setPlanId(update.getPlanId());
        }
        state.setConsecutiveOutOfBandCycles(
                update.isOutsideBand() ? state.getConsecutiveOutOfBandCycles() + 1 : 0);

        PacingPhase bandPhase = PhaseTransitions.bandPhase(update.isOutsideBand());

        if (update.isExhausted()) {
            if (state.getPhase() != PacingPhase.EXHAUSTED) {
                transition(
                        state,
                        PacingPhase.EXHAUSTED,
                        TransitionTrigger.BUDGET_EXHAUSTED,
                        "Remaining budget is zero or negative");
                state.setBlockingAdjustmentId(null);
                state.setResumePhase(null);
            }
            return save(state);
        }

        if (state.getPhase().isBandDriven() && state.getPhase() != bandPhase) {
            transition(
                    state,
                    bandPhase,
                    TransitionTrigger.PACING_BAND,
                    String.format(
                            "Pacing ratio %.3f %s normal band",
                            update.getPacingRatio(),
                            update.isOutsideBand() ? "left" : "returned to"));
        } else if (state.getPhase() == PacingPhase.AWAITING_APPROVAL
                && state.getResumePhase() != null
                && state.getResumePhase().isBandDriven()) {
            state.setResumePhase(bandPhase);
        }

        if (update.getBlockingAdjustmentId() != null) {
            holdForApproval(
                    state,
                    update.getBlockingAdjustmentId(),
                    TransitionTrigger.APPROVAL_REQUIRED,
                    "Adjustment " + update.getBlockingAdjustmentId() + " requires approval");
        }

        return save(state);
    }

    /** Records a successfully committed budget and releases the approval hold it was blocking */
    @Transactional
    public PacingState onAdjustmentApplied(BudgetAdjustment adjustment) {
        PacingState state = get(adjustment.getCampaignId());
        LocalDateTime now = LocalDateTime.now(clock);
        state.setLastAppliedBudget(adjustment.getProposedAmount());
        state.setLastAppliedAt(now);
        if (Objects.equals(state.getBlockingAdjustmentId(), adjustment.getId())) {
            release(state, "Adjustment " + adjustment.getId() + " applied");
        }
        log.info(
                "Adjustment applied to state: campaignId={}, adjustmentId={}, dailyBudget={},"
                        + " phase={}",
                state.getCampaignId(),
                adjustment.getId(),
                adjustment.getProposedAmount(),
                state.getPhase());
        return save(state);
    }

    /**
     * An adjustment closed without being applied (rejected, expired, failed or cancelled). If it
     * was the one blocking auto-adjustments the campaign goes back to its band phase.
     */
    @Transactional
    public PacingState onAdjustmentClosed(String campaignId, Long adjustmentId, String reason) {
        PacingState state = find(campaignId).orElse(null);
        if (state == null || !Objects.equals(state.getBlockingAdjustmentId(), adjustmentId)) {
            return state;
        }
        release(state, reason);
        return save(state);
    }

    /** Sends a campaign to manual review after an invariant violation */
    @Transactional
    public PacingState forceReview(String campaignId, String reason) {
        PacingState state =
                find(campaignId)
                        .orElseGet(
                                () ->
                                        PacingState.builder()
                                                .campaignId(campaignId)
                                                .phase(PacingPhase.ACTIVE)
                                                .build());
        if (state.getPhase() == PacingPhase.AWAITING_APPROVAL) {
            return state;
        }
        holdForApproval(state, null, TransitionTrigger.INVARIANT_VIOLATION, reason);
        log.warn(
                "Campaign forced into manual review: campaignId={}, reason={}", campaignId, reason);
        return save(state);
    }

    /** Campaign was paused on the platform by someone else */
    @Transactional
    public PacingState markExternallyPaused(String campaignId, String reason) {
        PacingState state = get(campaignId);
        if (state.getPhase() == PacingPhase.PAUSED || state.getPhase() == PacingPhase.EXHAUSTED) {
            return state;
        }
        transition(state, PacingPhase.PAUSED, TransitionTrigger.EXTERNAL_PAUSE, reason);
        state.setBlockingAdjustmentId(null);
        state.setResumePhase(null);
        return save(state);
    }

    /**
     * First day of a new period: back to ACTIVE against the fresh plan with all per-period
     * bookkeeping reset.
     */
    @Transactional
    public PacingState rollover(String campaignId, BudgetPlan newPlan) {
        PacingState state = find(campaignId).orElse(null);
        if (state == null) {
            return loadOrInitialize(campaignId, newPlan);
        }
        if (Objects.equals(state.getPlanId(), newPlan.getId())) {
            return state;
        }
        if (state.getPhase() != PacingPhase.ACTIVE) {
            transition(
                    state,
                    PacingPhase.ACTIVE,
                    TransitionTrigger.PERIOD_ROLLOVER,
                    "New period starting " + newPlan.getPeriodStart());
        }
        state.setPlanId(newPlan.getId());
        state.setPacingRatio(0.0);
        state.setTargetDailySpend(null);
        state.setLastAppliedBudget(null);
        state.setLastAppliedAt(null);
        state.setBlockingAdjustmentId(null);
        state.setResumePhase(null);
        state.setConsecutiveOutOfBandCycles(0);
        log.info(
                "Pacing state rolled over: campaignId={}, planId={}, periodStart={}",
                campaignId,
                newPlan.getId(),
                newPlan.getPeriodStart());
        return save(state);
    }

    /** Operator override; fails unless {@code expectedVersion} is still current */
    @Transactional
    public PhaseTransitionResult manualOverride(
            String campaignId,
            PacingPhase target,
            long expectedVersion,
            String actor,
            String reason) {
        PacingState state = get(campaignId);
        if (!Objects.equals(state.getVersion(), expectedVersion)) {
            throw new ConcurrentStateModificationException(
                    campaignId,
                    String.format(
                            "Expected version %d but state is at version %d",
                            expectedVersion, state.getVersion()));
        }
        PacingPhase from = state.getPhase();
        PhaseTransitionResult result =
                validateTransition(state, target, TransitionTrigger.MANUAL_OVERRIDE);
        if (!result.isSuccess()) {
            throw new IllegalPhaseTransitionException(campaignId, from, target);
        }
        state.setPhase(target);
        state.setBlockingAdjustmentId(null);
        state.setResumePhase(null);
        logTransition(campaignId, from, target, TransitionTrigger.MANUAL_OVERRIDE, reason, actor);
        save(state);
        log.info(
                "Manual phase override: campaignId={}, from={}, to={}, actor={}",
                campaignId,
                from,
                target,
                actor);
        return result;
    }

    private void holdForApproval(
            PacingState state, Long adjustmentId, TransitionTrigger trigger, String reason) {
        PacingPhase current = state.getPhase();
        if (current != PacingPhase.AWAITING_APPROVAL) {
            transition(state, PacingPhase.AWAITING_APPROVAL, trigger, reason);
            state.setResumePhase(current);
        }
        state.setBlockingAdjustmentId(adjustmentId);
    }

    private void release(PacingState state, String reason) {
        PacingPhase resume =
                state.getResumePhase() != null ? state.getResumePhase() : PacingPhase.ACTIVE;
        if (state.getPhase() == PacingPhase.AWAITING_APPROVAL) {
            transition(state, resume, TransitionTrigger.APPROVAL_RESOLVED, reason);
        }
        state.setBlockingAdjustmentId(null);
        state.setResumePhase(null);
    }

    private void transition(
            PacingState state, PacingPhase target, TransitionTrigger trigger, String reason) {
        PacingPhase from = state.getPhase();
        PhaseTransitionResult result = validateTransition(state, target, trigger);
        if (!result.isSuccess()) {
            throw new IllegalPhaseTransitionException(state.getCampaignId(), from, target);
        }
        state.setPhase(target);
        logTransition(state.getCampaignId(), from, target, trigger, reason, SYSTEM_ACTOR);
        log.info(
                "Phase transition: campaignId={}, from={}, to={}, trigger={}",
                state.getCampaignId(),
                from,
                target,
                trigger);
    }

    private PhaseTransitionResult validateTransition(
            PacingState state, PacingPhase target, TransitionTrigger trigger) {
        PacingPhase current = state.getPhase();
        if (!PhaseTransitions.isAllowed(current, target, trigger)) {
            String message =
                    String.format(
                            "Invalid phase transition: %s -> %s (%s)", current, target, trigger);
            log.warn("Campaign {}: {}", state.getCampaignId(), message);
            return PhaseTransitionResult.failed(state.getCampaignId(), current, target, message);
        }
        return PhaseTransitionResult.success(state.getCampaignId(), current, target);
    }

    private void logTransition(
            String campaignId,
            PacingPhase from,
            PacingPhase to,
            TransitionTrigger trigger,
            String reason,
            String actor) {
        transitionLogRepository.save(
                PhaseTransitionLog.builder()
                        .campaignId(campaignId)
                        .fromPhase(from)
                        .toPhase(to)
                        .trigger(trigger)
                        .reason(reason)
                        .actor(actor)
                        .transitionedAt(LocalDateTime.now(clock))
                        .build());
        metrics.recordTransition(from, to);
    }

    private PacingState save(PacingState state) {
        try {
            return pacingStateRepository.saveAndFlush(state);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn(
                    "Concurrent pacing state modification: campaignId={}, version={}",
                    state.getCampaignId(),
                    state.getVersion());
            throw new ConcurrentStateModificationException(
                    state.getCampaignId(),
                    "Pacing state was modified concurrently; evaluation result discarded",
                    e);
        }
    }
}
