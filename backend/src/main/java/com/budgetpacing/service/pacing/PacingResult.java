package com.budgetpacing.service.pacing;

import com.budgetpacing.entity.BudgetStatus;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PacingResult {

    /** False when the calendar position could not be evaluated; every other field is then empty */
    boolean evaluable;

    BigDecimal monthlyBudget;
    BigDecimal spendToDate;
    BigDecimal idealSpendToDate;
    double pacingRatio;
    BigDecimal remainingBudget;
    int remainingDays;
    BigDecimal targetDailySpend;

    /** Remaining budget is zero or negative */
    boolean exhausted;

    /** Month-end spend if the current run rate holds */
    BigDecimal projectedSpend;

    BudgetStatus budgetStatus;
    double confidenceScore;

    public static PacingResult noop() {
        return PacingResult.builder().evaluable(false).build();
    }
}
