package com.budgetpacing.dto.platform;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetChangeResponse {
    private String changeId;
    private String campaignId;
    private BigDecimal appliedDailyBudget;

    /** True when the platform had already applied this idempotency key */
    private boolean duplicate;
}
