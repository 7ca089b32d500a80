package com.budgetpacing.dto.response;

import com.budgetpacing.entity.BudgetPlan;
import com.budgetpacing.entity.PacingStrategy;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanResponse {
    private Long id;
    private String campaignId;
    private BigDecimal monthlyBudget;
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private PacingStrategy strategy;
    private BigDecimal baselineDailyBudget;

    public static PlanResponse from(BudgetPlan plan) {
        return PlanResponse.builder()
                .id(plan.getId())
                .campaignId(plan.getCampaignId())
                .monthlyBudget(plan.getMonthlyBudget())
                .periodStart(plan.getPeriodStart())
                .periodEnd(plan.getPeriodEnd())
                .strategy(plan.getStrategy())
                .baselineDailyBudget(plan.baselineDailyBudget())
                .build();
    }
}
