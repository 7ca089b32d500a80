package com.budgetpacing.dto.platform;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Budget change sent to the advertising platform. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetChangeCommand {
    private String campaignId;
    private BigDecimal newDailyBudget;
    private LocalDateTime effectiveAt;

    /** Pause delivery instead of only lowering the budget */
    private boolean pause;

    /** Restart delivery of a campaign paused by an earlier change */
    private boolean resume;

    /** Same key for every attempt of one adjustment, so the platform applies it at most once */
    private String idempotencyKey;
}
