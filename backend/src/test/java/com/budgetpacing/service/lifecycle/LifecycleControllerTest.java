package com.budgetpacing.service.lifecycle;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.budgetpacing.entity.BudgetAdjustment;
import com.budgetpacing.entity.BudgetPlan;
import com.budgetpacing.entity.PacingPhase;
import com.budgetpacing.entity.PacingState;
import com.budgetpacing.entity.PhaseTransitionLog;
import com.budgetpacing.entity.TransitionTrigger;
import com.budgetpacing.exception.ConcurrentStateModificationException;
import com.budgetpacing.exception.IllegalPhaseTransitionException;
import com.budgetpacing.monitoring.PacingMetrics;
import com.budgetpacing.repository.jpa.PacingStateRepository;
import com.budgetpacing.repository.jpa.PhaseTransitionLogRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LifecycleControllerTest {

    private static final String CAMPAIGN = "camp-1";

    @Mock private PacingStateRepository pacingStateRepository;
    @Mock private PhaseTransitionLogRepository transitionLogRepository;

    private LifecycleController controller;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-06-15T10:00:00Z"), ZoneOffset.UTC);
        controller =
                new LifecycleController(
                        pacingStateRepository,
                        transitionLogRepository,
                        new PacingMetrics(new SimpleMeterRegistry()),
                        clock);
        when(pacingStateRepository.saveAndFlush(any(PacingState.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private PacingState state(PacingPhase phase) {
        PacingState state =
                PacingState.builder()
                        .campaignId(CAMPAIGN)
                        .planId(7L)
                        .phase(phase)
                        .version(3L)
                        .build();
        when(pacingStateRepository.findById(CAMPAIGN)).thenReturn(Optional.of(state));
        return state;
    }

    private EvaluationUpdate.EvaluationUpdateBuilder update(double ratio) {
        return EvaluationUpdate.builder()
                .evaluationBucket(100L)
                .evaluatedAt(LocalDateTime.of(2026, 6, 15, 10, 0))
                .planId(7L)
                .pacingRatio(ratio)
                .targetDailySpend(new BigDecimal("112.50"));
    }

    @Test
    void finalizeEvaluation_InsideBand_StaysActiveAndRecordsBucket() {
        PacingState state = state(PacingPhase.ACTIVE);

        PacingState result = controller.finalizeEvaluation(state, update(1.0).build());

        assertEquals(PacingPhase.ACTIVE, result.getPhase());
        assertEquals(100L, result.getLastEvaluationBucket());
        assertEquals(0, result.getConsecutiveOutOfBandCycles());
        verify(transitionLogRepository, never()).save(any());
    }

    @Test
    void finalizeEvaluation_EmergencyAwaitingApproval_ResumesThrottledOnApply() {
        PacingState state = state(PacingPhase.ACTIVE);

        controller.finalizeEvaluation(
                state, update(1.8).outsideBand(true).blockingAdjustmentId(42L).build());

        assertEquals(PacingPhase.AWAITING_APPROVAL, state.getPhase());
        assertEquals(PacingPhase.THROTTLED, state.getResumePhase());
        assertEquals(42L, state.getBlockingAdjustmentId());
        assertEquals(1, state.getConsecutiveOutOfBandCycles());

        BudgetAdjustment applied =
                BudgetAdjustment.builder()
                        .id(42L)
                        .campaignId(CAMPAIGN)
                        .proposedAmount(new BigDecimal("55.55"))
                        .build();
        PacingState after = controller.onAdjustmentApplied(applied);

        assertEquals(PacingPhase.THROTTLED, after.getPhase());
        assertNull(after.getBlockingAdjustmentId());
        assertEquals(0, new BigDecimal("55.55").compareTo(after.getLastAppliedBudget()));
    }

    @Test
    void finalizeEvaluation_WhileAwaitingApproval_TracksBandForResume() {
        PacingState state = state(PacingPhase.AWAITING_APPROVAL);
        state.setResumePhase(PacingPhase.THROTTLED);
        state.setBlockingAdjustmentId(42L);

        controller.finalizeEvaluation(state, update(1.0).build());

        assertEquals(PacingPhase.AWAITING_APPROVAL, state.getPhase());
        assertEquals(PacingPhase.ACTIVE, state.getResumePhase());
        assertEquals(42L, state.getBlockingAdjustmentId());
    }

    @Test
    void finalizeEvaluation_Exhausted_MovesToExhaustedAndClearsHold() {
        PacingState state = state(PacingPhase.AWAITING_APPROVAL);
        state.setBlockingAdjustmentId(42L);
        state.setResumePhase(PacingPhase.ACTIVE);

        controller.finalizeEvaluation(
                state, update(1.4).exhausted(true).targetDailySpend(BigDecimal.ZERO).build());

        assertEquals(PacingPhase.EXHAUSTED, state.getPhase());
        assertNull(state.getBlockingAdjustmentId());
        ArgumentCaptor<PhaseTransitionLog> captor =
                ArgumentCaptor.forClass(PhaseTransitionLog.class);
        verify(transitionLogRepository).save(captor.capture());
        assertEquals(TransitionTrigger.BUDGET_EXHAUSTED, captor.getValue().getTrigger());
    }

    @Test
    void finalizeEvaluation_StaleVersion_ThrowsConcurrentModification() {
        PacingState state = state(PacingPhase.ACTIVE);
        when(pacingStateRepository.saveAndFlush(any(PacingState.class)))
                .thenThrow(
                        new ObjectOptimisticLockingFailureException(PacingState.class, CAMPAIGN));

        assertThrows(
                ConcurrentStateModificationException.class,
                () -> controller.finalizeEvaluation(state, update(1.3).outsideBand(true).build()));
    }

    @Test
    void onAdjustmentClosed_NotTheBlockingAdjustment_LeavesStateAlone() {
        PacingState state = state(PacingPhase.AWAITING_APPROVAL);
        state.setBlockingAdjustmentId(42L);

        controller.onAdjustmentClosed(CAMPAIGN, 41L, "rejected");

        assertEquals(PacingPhase.AWAITING_APPROVAL, state.getPhase());
        verify(pacingStateRepository, never()).saveAndFlush(any());
    }

    @Test
    void onAdjustmentClosed_BlockingAdjustmentWithoutResume_ReturnsToActive() {
        PacingState state = state(PacingPhase.AWAITING_APPROVAL);
        state.setBlockingAdjustmentId(42L);

        controller.onAdjustmentClosed(CAMPAIGN, 42L, "expired");

        assertEquals(PacingPhase.ACTIVE, state.getPhase());
        assertNull(state.getBlockingAdjustmentId());
    }

    @Test
    void rollover_FromExhausted_ReturnsToActiveAndResetsBookkeeping() {
        PacingState state = state(PacingPhase.EXHAUSTED);
        state.setLastAppliedBudget(BigDecimal.ZERO);
        state.setConsecutiveOutOfBandCycles(4);
        BudgetPlan july =
                BudgetPlan.builder()
                        .id(8L)
                        .campaignId(CAMPAIGN)
                        .periodStart(LocalDate.of(2026, 7, 1))
                        .periodEnd(LocalDate.of(2026, 7, 31))
                        .build();

        controller.rollover(CAMPAIGN, july);

        assertEquals(PacingPhase.ACTIVE, state.getPhase());
        assertEquals(8L, state.getPlanId());
        assertNull(state.getLastAppliedBudget());
        assertEquals(0, state.getConsecutiveOutOfBandCycles());
    }

    @Test
    void markExternallyPaused_ActiveCampaign_MovesToPaused() {
        PacingState state = state(PacingPhase.THROTTLED);

        controller.markExternallyPaused(CAMPAIGN, "paused on platform");

        assertEquals(PacingPhase.PAUSED, state.getPhase());
    }

    @Test
    void forceReview_ActiveCampaign_HoldsWithoutBlockingAdjustment() {
        PacingState state = state(PacingPhase.ACTIVE);

        controller.forceReview(CAMPAIGN, "negative spend reported");

        assertEquals(PacingPhase.AWAITING_APPROVAL, state.getPhase());
        assertEquals(PacingPhase.ACTIVE, state.getResumePhase());
        assertNull(state.getBlockingAdjustmentId());
    }

    @Test
    void manualOverride_MatchingVersion_AppliesTransition() {
        PacingState state = state(PacingPhase.ACTIVE);

        PhaseTransitionResult result =
                controller.manualOverride(CAMPAIGN, PacingPhase.PAUSED, 3L, "ops", "holiday");

        assertTrue(result.isSuccess());
        assertEquals(PacingPhase.PAUSED, state.getPhase());
        ArgumentCaptor<PhaseTransitionLog> captor =
                ArgumentCaptor.forClass(PhaseTransitionLog.class);
        verify(transitionLogRepository).save(captor.capture());
        assertEquals("ops", captor.getValue().getActor());
    }

    @Test
    void manualOverride_StaleVersion_ThrowsConcurrentModification() {
        PacingState state = state(PacingPhase.ACTIVE);

        assertThrows(
                ConcurrentStateModificationException.class,
                () -> controller.manualOverride(CAMPAIGN, PacingPhase.PAUSED, 2L, "ops", null));
        assertEquals(PacingPhase.ACTIVE, state.getPhase());
    }

    @Test
    void manualOverride_ExhaustedToActive_ThrowsIllegalTransition() {
        state(PacingPhase.EXHAUSTED);

        assertThrows(
                IllegalPhaseTransitionException.class,
                () -> controller.manualOverride(CAMPAIGN, PacingPhase.ACTIVE, 3L, "ops", null));
    }
}
