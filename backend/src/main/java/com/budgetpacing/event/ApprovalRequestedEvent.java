package com.budgetpacing.event;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalRequestedEvent {
    private Long adjustmentId;
    private String campaignId;
    private BigDecimal previousAmount;
    private BigDecimal proposedAmount;
    private String reason;
    private LocalDateTime expiresAt;
    private LocalDateTime timestamp;
}
