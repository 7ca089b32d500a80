package com.budgetpacing.scheduler;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.entity.AlertSeverity;
import com.budgetpacing.entity.AlertType;
import com.budgetpacing.entity.BudgetPlan;
import com.budgetpacing.repository.jpa.BudgetPlanRepository;
import com.budgetpacing.service.alert.AlertGenerator;
import com.budgetpacing.service.alert.AlertRequest;
import com.budgetpacing.service.lock.CampaignLeaseService;
import com.budgetpacing.service.plan.BudgetPlanService;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Calendar boundary event: on the first day of a period every campaign whose plan has ended gets a
 * fresh plan and returns to ACTIVE. Campaigns whose lease is taken are left to the lazy rollover in
 * their next evaluation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "app.pacing.monitoring.enabled",
        havingValue = "true",
        matchIfMissing = true)
public class MonthRolloverScheduler {

    private final BudgetPlanRepository planRepository;
    private final BudgetPlanService planService;
    private final CampaignLeaseService leaseService;
    private final AlertGenerator alertGenerator;
    private final PacingProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${app.pacing.monitoring.rollover-cron:0 5 0 1 * *}")
    public void rolloverPeriods() {
        try {
            int rolled = rolloverEndedPlans(LocalDate.now(clock));
            log.info("Period rollover finished: {} campaigns rolled over", rolled);
        } catch (Exception e) {
            log.error("Period rollover aborted: {}", e.getMessage(), e);
        }
    }

    public int rolloverEndedPlans(LocalDate today) {
        List<BudgetPlan> ended =
                planRepository.findByCurrentTrue().stream()
                        .filter(plan -> plan.getPeriodEnd().isBefore(today))
                        .collect(Collectors.toList());
        int rolled = 0;
        for (BudgetPlan plan : ended) {
            Optional<String> lease =
                    leaseService.tryAcquire(
                            plan.getCampaignId(), properties.getMonitoring().leaseTtl());
            if (lease.isEmpty()) {
                log.info(
                        "Campaign busy, deferring rollover to its next evaluation: campaignId={}",
                        plan.getCampaignId());
                continue;
            }
            try {
                planService.rolloverPlan(plan, today);
                rolled++;
            } catch (RuntimeException e) {
                log.error(
                        "Rollover failed: campaignId={}, planId={}, error={}",
                        plan.getCampaignId(),
                        plan.getId(),
                        e.getMessage(),
                        e);
                alertGenerator.raise(
                        AlertRequest.of(
                                plan.getCampaignId(),
                                AlertType.EVALUATION_FAILURE,
                                AlertSeverity.HIGH,
                                "Period rollover failed: " + e.getMessage()));
            } finally {
                leaseService.release(plan.getCampaignId(), lease.get());
            }
        }
        return rolled;
    }
}
