package com.budgetpacing.service.policy;

import com.budgetpacing.entity.PacingPhase;
import com.budgetpacing.entity.PacingStrategy;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PolicyInput {
    String campaignId;
    PacingStrategy strategy;
    PacingPhase phase;

    double pacingRatio;

    /** Ratios of earlier evaluated cycles, newest first */
    @Builder.Default List<Double> ratioHistory = List.of();

    /** Daily budget currently live on the platform */
    BigDecimal currentDailyBudget;

    /** B / D for the plan */
    BigDecimal baselineDailyBudget;

    BigDecimal targetDailySpend;
    boolean exhausted;
    int dayOfPeriod;
    int daysInPeriod;
}
