package com.budgetpacing.service.notification;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.entity.AlertSeverity;
import com.budgetpacing.event.AlertRaisedEvent;
import com.budgetpacing.event.ApprovalRequestedEvent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts alerts and approval requests to a Slack incoming webhook. Disabled unless a webhook URL
 * is configured and the feature is switched on.
 */
@Slf4j
@Service
public class SlackNotifier {

    private final RestTemplate restTemplate;
    private final PacingProperties.Alerts.Slack slack;

    public SlackNotifier(
            @Qualifier("collaboratorRestTemplate") RestTemplate restTemplate,
            PacingProperties properties) {
        this.restTemplate = restTemplate;
        this.slack = properties.getAlerts().getSlack();
    }

    public boolean isEnabled() {
        return slack.isEnabled() && StringUtils.hasText(slack.getWebhookUrl());
    }

    public boolean notifyAlert(AlertRaisedEvent alert) {
        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(field("Campaign", alert.getCampaignId()));
        fields.add(field("Type", alert.getType() != null ? alert.getType().name() : "-"));
        if (alert.getCurrentSpend() != null) {
            fields.add(field("Current spend", "$" + alert.getCurrentSpend().toPlainString()));
        }
        if (alert.getBudgetLimit() != null) {
            fields.add(field("Budget", "$" + alert.getBudgetLimit().toPlainString()));
        }
        if (alert.getProjectedSpend() != null) {
            fields.add(field("Projected", "$" + alert.getProjectedSpend().toPlainString()));
        }
        if (StringUtils.hasText(alert.getRecommendedAction())) {
            fields.add(field("Recommended action", alert.getRecommendedAction()));
        }
        String title = String.format("[%s] %s", alert.getSeverity(), alert.getType());
        return post(title, alert.getMessage(), colour(alert.getSeverity()), fields);
    }

    public boolean notifyApprovalRequested(ApprovalRequestedEvent request) {
        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(field("Campaign", request.getCampaignId()));
        fields.add(field("Adjustment", String.valueOf(request.getAdjustmentId())));
        fields.add(
                field(
                        "Daily budget",
                        "$" + request.getPreviousAmount() + " -> $" + request.getProposedAmount()));
        fields.add(field("Expires", String.valueOf(request.getExpiresAt())));
        return post("Budget adjustment awaiting approval", request.getReason(), "#439FE0", fields);
    }

    private boolean post(
            String title, String text, String colour, List<Map<String, Object>> fields) {
        if (!isEnabled()) {
            log.debug("Slack notifications disabled, dropping: {}", title);
            return false;
        }
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", colour);
        attachment.put("title", title);
        attachment.put("text", text);
        attachment.put("fields", fields);
        Map<String, Object> payload = Map.of("attachments", List.of(attachment));
        try {
            restTemplate.postForEntity(slack.getWebhookUrl(), payload, String.class);
            return true;
        } catch (RestClientException e) {
            log.warn("Slack notification failed: title={}, error={}", title, e.getMessage());
            return false;
        }
    }

    static String colour(AlertSeverity severity) {
        if (severity == null) {
            return "#808080";
        }
        switch (severity) {
            case CRITICAL:
                return "#8B0000";
            case HIGH:
                return "#FF0000";
            case MEDIUM:
                return "#FFA500";
            default:
                return "#36A64F";
        }
    }

    private static Map<String, Object> field(String title, String value) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", value == null || value.length() < 40);
        return field;
    }
}
