package com.budgetpacing.event;

import com.budgetpacing.entity.AlertSeverity;
import com.budgetpacing.entity.AlertType;
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
public class AlertRaisedEvent {
    private Long alertId;
    private String campaignId;
    private AlertType type;
    private AlertSeverity severity;
    private String message;
    private String recommendedAction;
    private BigDecimal currentSpend;
    private BigDecimal budgetLimit;
    private BigDecimal projectedSpend;
    private LocalDateTime createdAt;
}
