package com.budgetpacing.dto.response;

import com.budgetpacing.entity.Alert;
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
public class AlertResponse {
    private Long id;
    private String campaignId;
    private AlertType type;
    private AlertSeverity severity;
    private String message;
    private String recommendedAction;
    private BigDecimal currentSpend;
    private BigDecimal budgetLimit;
    private BigDecimal projectedSpend;
    private LocalDateTime createdAt;
    private LocalDateTime resolvedAt;
    private String resolvedBy;

    public static AlertResponse from(Alert alert) {
        return AlertResponse.builder()
                .id(alert.getId())
                .campaignId(alert.getCampaignId())
                .type(alert.getType())
                .severity(alert.getSeverity())
                .message(alert.getMessage())
                .recommendedAction(alert.getRecommendedAction())
                .currentSpend(alert.getCurrentSpend())
                .budgetLimit(alert.getBudgetLimit())
                .projectedSpend(alert.getProjectedSpend())
                .createdAt(alert.getCreatedAt())
                .resolvedAt(alert.getResolvedAt())
                .resolvedBy(alert.getResolvedBy())
                .build();
    }
}
