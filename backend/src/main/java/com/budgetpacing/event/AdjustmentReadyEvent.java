package com.budgetpacing.event;

import com.budgetpacing.entity.AdjustmentKind;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** An adjustment is approved (or auto-approved) and waits for the commit worker. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdjustmentReadyEvent {
    private Long adjustmentId;
    private String campaignId;
    private AdjustmentKind kind;
    private BigDecimal proposedAmount;
    private LocalDateTime timestamp;
}
