package com.budgetpacing.service.query;

import com.budgetpacing.dto.response.AdjustmentResponse;
import com.budgetpacing.dto.response.AlertResponse;
import com.budgetpacing.dto.response.OverviewResponse;
import com.budgetpacing.dto.response.PacingStateResponse;
import com.budgetpacing.dto.response.RecommendationResponse;
import com.budgetpacing.entity.AdjustmentStatus;
import com.budgetpacing.entity.BudgetPlan;
import com.budgetpacing.entity.BudgetStatus;
import com.budgetpacing.entity.PacingPhase;
import com.budgetpacing.entity.PacingState;
import com.budgetpacing.entity.SpendSnapshot;
import com.budgetpacing.exception.ResourceNotFoundException;
import com.budgetpacing.repository.jpa.AlertRepository;
import com.budgetpacing.repository.jpa.BudgetAdjustmentRepository;
import com.budgetpacing.repository.jpa.BudgetPlanRepository;
import com.budgetpacing.repository.jpa.PacingStateRepository;
import com.budgetpacing.service.ingestion.SpendIngestionAdapter;
import com.budgetpacing.service.lifecycle.LifecycleController;
import com.budgetpacing.service.outbox.OutboxEventService;
import com.budgetpacing.service.pacing.PacingCalculator;
import com.budgetpacing.service.pacing.PacingInput;
import com.budgetpacing.service.pacing.PacingResult;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read side exposed to dashboards and operators. Never changes state. */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PacingQueryService {

    private final LifecycleController lifecycleController;
    private final PacingStateRepository stateRepository;
    private final AlertRepository alertRepository;
    private final BudgetAdjustmentRepository adjustmentRepository;
    private final BudgetPlanRepository planRepository;
    private final SpendIngestionAdapter spendIngestion;
    private final PacingCalculator pacingCalculator;
    private final OutboxEventService outboxEventService;
    private final Clock clock;

    public PacingStateResponse getState(String campaignId) {
        return PacingStateResponse.from(lifecycleController.get(campaignId));
    }

    public List<AlertResponse> getAlerts(String campaignId, boolean openOnly, int limit) {
        return (openOnly
                        ? alertRepository.findByCampaignIdAndResolvedAtIsNullOrderByCreatedAtDesc(
                                campaignId)
                        : alertRepository.findByCampaignIdOrderByCreatedAtDesc(
                                campaignId, PageRequest.of(0, limit)))
                .stream()
                .map(AlertResponse::from)
                .collect(Collectors.toList());
    }

    public List<AdjustmentResponse> getAdjustments(String campaignId, int limit) {
        return adjustmentRepository
                .findByCampaignIdOrderByCreatedAtDesc(campaignId, PageRequest.of(0, limit))
                .stream()
                .map(AdjustmentResponse::from)
                .collect(Collectors.toList());
    }

    public List<AdjustmentResponse> getPendingApprovals() {
        return adjustmentRepository
                .findByStatusAndRequiresApprovalTrueOrderByCreatedAtAsc(AdjustmentStatus.PENDING)
                .stream()
                .map(AdjustmentResponse::from)
                .collect(Collectors.toList());
    }

    /** Pacing advice from the latest snapshot, computed on demand */
    public RecommendationResponse getRecommendations(String campaignId) {
        LocalDate today = LocalDate.now(clock);
        BudgetPlan plan =
                planRepository
                        .findCovering(campaignId, today)
                        .orElseThrow(() -> new ResourceNotFoundException("BudgetPlan", campaignId));
        LocalDateTime periodStart = plan.getPeriodStart().atStartOfDay();
        SpendSnapshot snapshot =
                spendIngestion
                        .latest(campaignId)
                        .filter(s -> !s.getCapturedAt().isBefore(periodStart))
                        .orElseThrow(
                                () -> new ResourceNotFoundException("SpendSnapshot", campaignId));
        PacingResult pacing =
                pacingCalculator.calculate(
                        new PacingInput(
                                campaignId,
                                plan.getMonthlyBudget(),
                                snapshot.getCumulativeSpendMonthToDate(),
                                plan.dayOfPeriod(today),
                                plan.daysInPeriod()));

        BigDecimal current =
                lifecycleController
                        .find(campaignId)
                        .map(PacingState::getLastAppliedBudget)
                        .orElse(null);
        if (current == null) {
            current = plan.baselineDailyBudget();
        }
        BigDecimal recommended = pacing.getTargetDailySpend();
        double adjustment =
                current.signum() > 0
                        ? recommended
                                        .subtract(current)
                                        .divide(current, MathContext.DECIMAL64)
                                        .doubleValue()
                                * 100
                        : 0.0;

        return RecommendationResponse.builder()
                .campaignId(campaignId)
                .status(pacing.getBudgetStatus())
                .currentDailyBudget(current)
                .recommendedDailyBudget(recommended)
                .adjustmentPercentage(adjustment)
                .pacingRatio(pacing.getPacingRatio())
                .projectedSpend(pacing.getProjectedSpend())
                .confidenceScore(pacing.getConfidenceScore())
                .actions(actions(pacing.getBudgetStatus(), recommended))
                .build();
    }

    public OverviewResponse getOverview() {
        Map<PacingPhase, Long> byPhase = new EnumMap<>(PacingPhase.class);
        for (PacingPhase phase : PacingPhase.values()) {
            byPhase.put(phase, 0L);
        }
        long total = 0;
        for (Object[] row : stateRepository.countByPhase()) {
            long count = ((Number) row[1]).longValue();
            byPhase.put((PacingPhase) row[0], count);
            total += count;
        }
        OutboxEventService.OutboxStats outbox = outboxEventService.getOutboxStats();
        return OverviewResponse.builder()
                .totalCampaigns(total)
                .campaignsByPhase(byPhase)
                .openAlerts(alertRepository.countByResolvedAtIsNull())
                .pendingApprovals(
                        adjustmentRepository.countByStatusAndRequiresApprovalTrue(
                                AdjustmentStatus.PENDING))
                .unpublishedEvents(outbox.pending())
                .undeliverableEvents(outbox.undeliverable())
                .build();
    }

    static List<RecommendationResponse.Action> actions(BudgetStatus status, BigDecimal target) {
        List<RecommendationResponse.Action> actions = new ArrayList<>();
        if (status == BudgetStatus.OVERSPENDING) {
            actions.add(
                    new RecommendationResponse.Action(
                            "budget_adjustment",
                            "high",
                            "Reduce daily budget to $" + target.toPlainString(),
                            "Prevents budget exhaustion"));
            actions.add(
                    new RecommendationResponse.Action(
                            "bid_adjustment",
                            "medium",
                            "Reduce bid adjustments by 10-15%",
                            "Slower spend rate"));
        } else if (status == BudgetStatus.UNDERSPENDING) {
            actions.add(
                    new RecommendationResponse.Action(
                            "budget_adjustment",
                            "medium",
                            "Increase daily budget to $" + target.toPlainString(),
                            "Better budget utilization"));
            actions.add(
                    new RecommendationResponse.Action(
                            "targeting_expansion",
                            "medium",
                            "Expand targeting to increase reach",
                            "Higher impression volume"));
        } else if (status == BudgetStatus.EXHAUSTED) {
            actions.add(
                    new RecommendationResponse.Action(
                            "pause",
                            "high",
                            "Pause campaign or increase the monthly budget",
                            "Stops spend beyond the plan"));
        }
        return actions;
    }
}
