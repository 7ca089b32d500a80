package com.budgetpacing.service.plan;

import com.budgetpacing.dto.request.CreatePlanRequest;
import com.budgetpacing.entity.AdjustmentKind;
import com.budgetpacing.entity.AlertType;
import com.budgetpacing.entity.BudgetAdjustment;
import com.budgetpacing.entity.BudgetPlan;
import com.budgetpacing.entity.PacingStrategy;
import com.budgetpacing.exception.InvariantViolationException;
import com.budgetpacing.exception.PacingException;
import com.budgetpacing.repository.jpa.BudgetPlanRepository;
import com.budgetpacing.service.alert.AlertGenerator;
import com.budgetpacing.service.approval.ApprovalGate;
import com.budgetpacing.service.lifecycle.LifecycleController;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Creates budget plans at campaign launch and rolls them into the next period. */
@Slf4j
@Service
@RequiredArgsConstructor
public class BudgetPlanService {

    /** Alerts that describe one period and make no sense in the next */
    private static final Set<AlertType> PERIOD_ALERTS =
            EnumSet.of(
                    AlertType.BUDGET_EXHAUSTED,
                    AlertType.PROJECTED_OVERSPEND,
                    AlertType.UNDERSPENDING,
                    AlertType.PACING_OUT_OF_BAND,
                    AlertType.ZERO_SPEND,
                    AlertType.MISSING_PLAN);

    private final BudgetPlanRepository planRepository;
    private final LifecycleController lifecycleController;
    private final ApprovalGate approvalGate;
    private final AlertGenerator alertGenerator;
    private final Clock clock;

    @Transactional
    public BudgetPlan createPlan(CreatePlanRequest request) {
        String campaignId = request.getCampaignId();
        LocalDate start =
                request.getPeriodStart() != null
                        ? request.getPeriodStart()
                        : LocalDate.now(clock).withDayOfMonth(1);
        LocalDate end =
                request.getPeriodEnd() != null
                        ? request.getPeriodEnd()
                        : start.with(TemporalAdjusters.lastDayOfMonth());
        PacingStrategy strategy =
                request.getStrategy() != null ? request.getStrategy() : PacingStrategy.EVEN;

        BudgetPlan plan =
                BudgetPlan.builder()
                        .campaignId(campaignId)
                        .monthlyBudget(request.getMonthlyBudget())
                        .periodStart(start)
                        .periodEnd(end)
                        .strategy(strategy)
                        .build();
        if (!plan.isWellFormed()) {
            throw new InvariantViolationException(
                    campaignId,
                    String.format(
                            "Malformed budget plan: budget=%s, period=%s..%s",
                            request.getMonthlyBudget(), start, end));
        }
        if (planRepository.existsByCampaignIdAndPeriodStart(campaignId, start)) {
            throw new PacingException(
                    "DUPLICATE_PLAN",
                    campaignId,
                    "A budget plan already exists for the period starting " + start);
        }

        planRepository
                .findFirstByCampaignIdOrderByPeriodStartDesc(campaignId)
                .filter(BudgetPlan::isCurrent)
                .filter(previous -> previous.getPeriodStart().isBefore(start))
                .ifPresent(
                        previous -> {
                            previous.retire();
                            planRepository.save(previous);
                        });

        BudgetPlan saved = planRepository.saveAndFlush(plan);
        lifecycleController.rollover(campaignId, saved);
        resumeAfterExhaustion(saved);
        log.info(
                "Budget plan created: campaignId={}, planId={}, budget={}, period={}..{},"
                        + " strategy={}",
                campaignId,
                saved.getId(),
                saved.getMonthlyBudget(),
                saved.getPeriodStart(),
                saved.getPeriodEnd(),
                saved.getStrategy());
        return saved;
    }

    /** Plan that covers {@code date}, rolling the latest plan forward when none does yet */
    @Transactional
    public Optional<BudgetPlan> resolvePlan(String campaignId, LocalDate date) {
        Optional<BudgetPlan> covering = planRepository.findCovering(campaignId, date);
        if (covering.isPresent()) {
            return covering;
        }
        return planRepository
                .findFirstByCampaignIdOrderByPeriodStartDesc(campaignId)
                .filter(latest -> latest.getPeriodEnd().isBefore(date))
                .map(latest -> rolloverPlan(latest, date));
    }

    /**
     * Starts the period containing {@code date} with the previous plan's budget, strategy and
     * cadence. The previous plan is retired, pending approvals are withdrawn, the pacing state is
     * reset to ACTIVE, and a campaign this engine paused for exhaustion is resumed.
     */
    @Transactional
    public BudgetPlan rolloverPlan(BudgetPlan previous, LocalDate date) {
        String campaignId = previous.getCampaignId();
        LocalDate start = nextPeriodStart(previous, date);
        Optional<BudgetPlan> existing =
                planRepository.findByCampaignIdAndPeriodStart(campaignId, start);
        if (existing.isPresent()) {
            lifecycleController.rollover(campaignId, existing.get());
            resumeAfterExhaustion(existing.get());
            return existing.get();
        }

        if (previous.isCurrent()) {
            previous.retire();
            planRepository.save(previous);
        }
        BudgetPlan next =
                planRepository.saveAndFlush(
                        BudgetPlan.builder()
                                .campaignId(campaignId)
                                .monthlyBudget(previous.getMonthlyBudget())
                                .periodStart(start)
                                .periodEnd(periodEnd(previous, start))
                                .strategy(previous.getStrategy())
                                .build());

        approvalGate.cancelPending(campaignId, "Period rolled over to " + start);
        lifecycleController.rollover(campaignId, next);
        resumeAfterExhaustion(next);
        alertGenerator.resolveOpen(campaignId, PERIOD_ALERTS, "rollover");
        log.info(
                "Budget plan rolled over: campaignId={}, previousPlanId={}, planId={},"
                        + " period={}..{}",
                campaignId,
                previous.getId(),
                next.getId(),
                start,
                next.getPeriodEnd());
        return next;
    }

    /**
     * The platform still holds the pause applied when the previous budget ran out; lift it at the
     * new plan's baseline daily budget. Pauses made by anyone else are left alone.
     */
    private void resumeAfterExhaustion(BudgetPlan plan) {
        String campaignId = plan.getCampaignId();
        Optional<BudgetAdjustment> pause = approvalGate.findOwnPause(campaignId);
        if (pause.isEmpty() || approvalGate.isResumeInFlight(campaignId)) {
            return;
        }
        BudgetAdjustment resume =
                approvalGate.autoApprove(
                        BudgetAdjustment.builder()
                                .campaignId(campaignId)
                                .planId(plan.getId())
                                .kind(AdjustmentKind.RESUME)
                                .previousAmount(pause.get().getProposedAmount())
                                .proposedAmount(plan.baselineDailyBudget())
                                .reason(
                                        "New period starting "
                                                + plan.getPeriodStart()
                                                + "; resuming after budget exhaustion")
                                .requiresApproval(false)
                                .createdAt(LocalDateTime.now(clock))
                                .build());
        log.info(
                "Resume queued after exhaustion pause: campaignId={}, adjustmentId={},"
                        + " dailyBudget={}",
                campaignId,
                resume.getId(),
                resume.getProposedAmount());
    }

    /**
     * First day of the period after {@code previous} that contains {@code date}. Monthly plans keep
     * their start day of month; other plans repeat their length in days.
     */
    static LocalDate nextPeriodStart(BudgetPlan previous, LocalDate date) {
        LocalDate anchor = previous.getPeriodStart();
        if (isMonthly(previous)) {
            int months = 1;
            while (anchor.plusMonths(months + 1L).minusDays(1).isBefore(date)) {
                months++;
            }
            return anchor.plusMonths(months);
        }
        int length = previous.daysInPeriod();
        LocalDate start = previous.getPeriodEnd().plusDays(1);
        while (start.plusDays(length - 1L).isBefore(date)) {
            start = start.plusDays(length);
        }
        return start;
    }

    static LocalDate periodEnd(BudgetPlan previous, LocalDate start) {
        if (isMonthly(previous)) {
            LocalDate anchor = previous.getPeriodStart();
            long months =
                    ChronoUnit.MONTHS.between(anchor.withDayOfMonth(1), start.withDayOfMonth(1));
            return anchor.plusMonths(months + 1).minusDays(1);
        }
        return start.plusDays(previous.daysInPeriod() - 1L);
    }

    private static boolean isMonthly(BudgetPlan plan) {
        return plan.getPeriodEnd().equals(plan.getPeriodStart().plusMonths(1).minusDays(1));
    }
}
