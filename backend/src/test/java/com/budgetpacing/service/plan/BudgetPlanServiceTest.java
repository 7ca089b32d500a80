package com.budgetpacing.service.plan;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.budgetpacing.dto.request.CreatePlanRequest;
import com.budgetpacing.entity.AdjustmentKind;
import com.budgetpacing.entity.AdjustmentStatus;
import com.budgetpacing.entity.BudgetAdjustment;
import com.budgetpacing.entity.BudgetPlan;
import com.budgetpacing.entity.PacingStrategy;
import com.budgetpacing.exception.InvariantViolationException;
import com.budgetpacing.exception.PacingException;
import com.budgetpacing.repository.jpa.BudgetPlanRepository;
import com.budgetpacing.service.alert.AlertGenerator;
import com.budgetpacing.service.approval.ApprovalGate;
import com.budgetpacing.service.lifecycle.LifecycleController;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
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

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BudgetPlanServiceTest {

    @Mock private BudgetPlanRepository planRepository;
    @Mock private LifecycleController lifecycleController;
    @Mock private ApprovalGate approvalGate;
    @Mock private AlertGenerator alertGenerator;

    private BudgetPlanService planService;

    @BeforeEach
    void setUp() {
        planService =
                new BudgetPlanService(
                        planRepository,
                        lifecycleController,
                        approvalGate,
                        alertGenerator,
                        Clock.fixed(Instant.parse("2026-06-15T10:00:00Z"), ZoneOffset.UTC));
        when(planRepository.saveAndFlush(any(BudgetPlan.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        when(approvalGate.autoApprove(any(BudgetAdjustment.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        when(approvalGate.findOwnPause(anyString())).thenReturn(Optional.empty());
    }

    private static BudgetPlan plan(LocalDate start, LocalDate end) {
        return BudgetPlan.builder()
                .id(7L)
                .campaignId("camp-1")
                .monthlyBudget(new BigDecimal("3100.00"))
                .periodStart(start)
                .periodEnd(end)
                .strategy(PacingStrategy.EVEN)
                .build();
    }

    private static BudgetAdjustment exhaustionPause() {
        return BudgetAdjustment.builder()
                .id(40L)
                .campaignId("camp-1")
                .planId(7L)
                .evaluationBucket(100L)
                .kind(AdjustmentKind.EXHAUSTION_PAUSE)
                .previousAmount(new BigDecimal("100.00"))
                .proposedAmount(BigDecimal.ZERO)
                .status(AdjustmentStatus.APPLIED)
                .build();
    }

    private static BudgetPlan june(boolean current) {
        BudgetPlan plan =
                BudgetPlan.builder()
                        .id(7L)
                        .campaignId("camp-1")
                        .monthlyBudget(new BigDecimal("3000.00"))
                        .periodStart(LocalDate.of(2026, 6, 1))
                        .periodEnd(LocalDate.of(2026, 6, 30))
                        .strategy(PacingStrategy.ADAPTIVE)
                        .build();
        if (!current) {
            plan.retire();
        }
        return plan;
    }

    @Test
    void createPlan_NoPeriodGiven_DefaultsToCurrentMonth() {
        CreatePlanRequest request =
                CreatePlanRequest.builder()
                        .campaignId("camp-1")
                        .monthlyBudget(new BigDecimal("3000.00"))
                        .build();

        BudgetPlan plan = planService.createPlan(request);

        assertEquals(LocalDate.of(2026, 6, 1), plan.getPeriodStart());
        assertEquals(LocalDate.of(2026, 6, 30), plan.getPeriodEnd());
        assertEquals(PacingStrategy.EVEN, plan.getStrategy());
        assertEquals(30, plan.daysInPeriod());
        verify(lifecycleController).rollover("camp-1", plan);
    }

    @Test
    void createPlan_EndBeforeStart_ThrowsInvariantViolation() {
        CreatePlanRequest request =
                CreatePlanRequest.builder()
                        .campaignId("camp-1")
                        .monthlyBudget(new BigDecimal("3000.00"))
                        .periodStart(LocalDate.of(2026, 6, 30))
                        .periodEnd(LocalDate.of(2026, 6, 1))
                        .build();

        assertThrows(InvariantViolationException.class, () -> planService.createPlan(request));
        verify(planRepository, never()).saveAndFlush(any());
    }

    @Test
    void createPlan_PeriodAlreadyPlanned_Rejected() {
        when(planRepository.existsByCampaignIdAndPeriodStart("camp-1", LocalDate.of(2026, 6, 1)))
                .thenReturn(true);
        CreatePlanRequest request =
                CreatePlanRequest.builder()
                        .campaignId("camp-1")
                        .monthlyBudget(new BigDecimal("3000.00"))
                        .build();

        PacingException ex =
                assertThrows(PacingException.class, () -> planService.createPlan(request));
        assertEquals("DUPLICATE_PLAN", ex.getErrorCode());
    }

    @Test
    void resolvePlan_CoveringPlanExists_ReturnsIt() {
        BudgetPlan june = june(true);
        when(planRepository.findCovering("camp-1", LocalDate.of(2026, 6, 15)))
                .thenReturn(Optional.of(june));

        assertSame(june, planService.resolvePlan("camp-1", LocalDate.of(2026, 6, 15)).get());
        verify(lifecycleController, never()).rollover(anyString(), any());
    }

    @Test
    void resolvePlan_LatestPlanEnded_RollsIntoNewMonth() {
        BudgetPlan june = june(true);
        LocalDate julySecond = LocalDate.of(2026, 7, 2);
        when(planRepository.findCovering("camp-1", julySecond)).thenReturn(Optional.empty());
        when(planRepository.findFirstByCampaignIdOrderByPeriodStartDesc("camp-1"))
                .thenReturn(Optional.of(june));

        BudgetPlan july = planService.resolvePlan("camp-1", julySecond).orElseThrow();

        assertEquals(LocalDate.of(2026, 7, 1), july.getPeriodStart());
        assertEquals(LocalDate.of(2026, 7, 31), july.getPeriodEnd());
        assertEquals(0, new BigDecimal("3000.00").compareTo(july.getMonthlyBudget()));
        assertEquals(PacingStrategy.ADAPTIVE, july.getStrategy());
        assertFalse(june.isCurrent());
        verify(approvalGate).cancelPending(eq("camp-1"), anyString());
        verify(lifecycleController).rollover("camp-1", july);
        verify(alertGenerator).resolveOpen(eq("camp-1"), any(), eq("rollover"));
    }

    @Test
    void rolloverPlan_NewPeriodAlreadyPlanned_ReusesExistingPlan() {
        BudgetPlan june = june(true);
        BudgetPlan planned =
                BudgetPlan.builder()
                        .id(9L)
                        .campaignId("camp-1")
                        .monthlyBudget(new BigDecimal("4000.00"))
                        .periodStart(LocalDate.of(2026, 7, 1))
                        .periodEnd(LocalDate.of(2026, 7, 31))
                        .strategy(PacingStrategy.EVEN)
                        .build();
        when(planRepository.findByCampaignIdAndPeriodStart("camp-1", LocalDate.of(2026, 7, 1)))
                .thenReturn(Optional.of(planned));

        assertSame(planned, planService.rolloverPlan(june, LocalDate.of(2026, 7, 1)));
        verify(planRepository, never()).saveAndFlush(any());
        verify(lifecycleController).rollover("camp-1", planned);
    }

    @Test
    void resolvePlan_NoPlanAtAll_ReturnsEmpty() {
        LocalDate date = LocalDate.of(2026, 6, 15);
        when(planRepository.findCovering("camp-1", date)).thenReturn(Optional.empty());
        when(planRepository.findFirstByCampaignIdOrderByPeriodStartDesc("camp-1"))
                .thenReturn(Optional.empty());

        assertTrue(planService.resolvePlan("camp-1", date).isEmpty());
        verify(planRepository, never()).saveAndFlush(any());
    }

    @Test
    void rolloverPlan_PeriodFromTheFifth_NextPeriodStartsTheDayAfterTheEnd() {
        BudgetPlan current = plan(LocalDate.of(2026, 6, 5), LocalDate.of(2026, 7, 4));

        BudgetPlan next = planService.rolloverPlan(current, LocalDate.of(2026, 7, 5));

        assertEquals(LocalDate.of(2026, 7, 5), next.getPeriodStart());
        assertEquals(LocalDate.of(2026, 8, 4), next.getPeriodEnd());
        assertTrue(next.getPeriodStart().isAfter(current.getPeriodEnd()));
    }

    @Test
    void rolloverPlan_MonthsWithoutEvaluation_StartsThePeriodContainingTheDate() {
        BudgetPlan june = plan(LocalDate.of(2026, 6, 1), LocalDate.of(2026, 6, 30));

        BudgetPlan next = planService.rolloverPlan(june, LocalDate.of(2026, 8, 10));

        assertEquals(LocalDate.of(2026, 8, 1), next.getPeriodStart());
        assertEquals(LocalDate.of(2026, 8, 31), next.getPeriodEnd());
    }

    @Test
    void rolloverPlan_FixedLengthPeriod_RepeatsItsLength() {
        BudgetPlan sprint = plan(LocalDate.of(2026, 6, 1), LocalDate.of(2026, 6, 14));

        BudgetPlan next = planService.rolloverPlan(sprint, LocalDate.of(2026, 6, 16));

        assertEquals(LocalDate.of(2026, 6, 15), next.getPeriodStart());
        assertEquals(LocalDate.of(2026, 6, 28), next.getPeriodEnd());
        assertEquals(14, next.daysInPeriod());
    }

    @Test
    void rolloverPlan_CampaignPausedForExhaustion_QueuesResumeAtBaselineBudget() {
        when(approvalGate.findOwnPause("camp-1")).thenReturn(Optional.of(exhaustionPause()));
        BudgetPlan june = june(true);

        BudgetPlan july = planService.rolloverPlan(june, LocalDate.of(2026, 7, 1));

        ArgumentCaptor<BudgetAdjustment> captor = ArgumentCaptor.forClass(BudgetAdjustment.class);
        verify(approvalGate).autoApprove(captor.capture());
        BudgetAdjustment resume = captor.getValue();
        assertEquals(AdjustmentKind.RESUME, resume.getKind());
        assertNull(resume.getEvaluationBucket());
        assertFalse(resume.isRequiresApproval());
        assertEquals(july.getId(), resume.getPlanId());
        assertEquals(0, new BigDecimal("96.77").compareTo(resume.getProposedAmount()));
        assertEquals(0, BigDecimal.ZERO.compareTo(resume.getPreviousAmount()));
    }

    @Test
    void rolloverPlan_ResumeAlreadyInFlight_DoesNotQueueAnother() {
        when(approvalGate.findOwnPause("camp-1")).thenReturn(Optional.of(exhaustionPause()));
        when(approvalGate.isResumeInFlight("camp-1")).thenReturn(true);

        planService.rolloverPlan(june(true), LocalDate.of(2026, 7, 1));

        verify(approvalGate, never()).autoApprove(any());
    }

    @Test
    void rolloverPlan_CampaignNotPausedByEngine_NoResume() {
        planService.rolloverPlan(june(true), LocalDate.of(2026, 7, 1));

        verify(approvalGate, never()).autoApprove(any());
    }
}
