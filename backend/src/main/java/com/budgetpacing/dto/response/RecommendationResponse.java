package com.budgetpacing.dto.response;

import com.budgetpacing.entity.BudgetStatus;
import java.math.BigDecimal;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResponse {
    private String campaignId;
    private BudgetStatus status;
    private BigDecimal currentDailyBudget;
    private BigDecimal recommendedDailyBudget;
    private double adjustmentPercentage;
    private double pacingRatio;
    private BigDecimal projectedSpend;
    private double confidenceScore;
    private List<Action> actions;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Action {
        private String type;
        private String priority;
        private String description;
        private String impact;
    }
}
