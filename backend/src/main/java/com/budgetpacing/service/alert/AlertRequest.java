package com.budgetpacing.service.alert;

import com.budgetpacing.entity.AlertSeverity;
import com.budgetpacing.entity.AlertType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AlertRequest {
    String campaignId;
    AlertType type;
    AlertSeverity severity;
    String message;
    String recommendedAction;
    BigDecimal currentSpend;
    BigDecimal budgetLimit;
    BigDecimal projectedSpend;

    public static AlertRequest of(
            String campaignId, AlertType type, AlertSeverity severity, String message) {
        return AlertRequest.builder()
                .campaignId(campaignId)
                .type(type)
                .severity(severity)
                .message(message)
                .build();
    }
}
