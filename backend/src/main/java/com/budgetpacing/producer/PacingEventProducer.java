package com.budgetpacing.producer;

import com.budgetpacing.config.KafkaTopics;
import com.budgetpacing.entity.Alert;
import com.budgetpacing.entity.BudgetAdjustment;
import com.budgetpacing.event.AdjustmentReadyEvent;
import com.budgetpacing.event.AlertRaisedEvent;
import com.budgetpacing.event.ApprovalRequestedEvent;
import com.budgetpacing.service.outbox.OutboxEventService;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Publishes pacing events through the outbox, keyed by campaign so that events of one campaign
 * stay ordered. Must be called inside the transaction that made the change.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PacingEventProducer {

    private final OutboxEventService outboxEventService;
    private final Clock clock;

    public void publishAdjustmentReady(BudgetAdjustment adjustment) {
        AdjustmentReadyEvent event =
                AdjustmentReadyEvent.builder()
                        .adjustmentId(adjustment.getId())
                        .campaignId(adjustment.getCampaignId())
                        .kind(adjustment.getKind())
                        .proposedAmount(adjustment.getProposedAmount())
                        .timestamp(LocalDateTime.now(clock))
                        .build();

        log.info(
                "Publishing adjustment ready event: adjustmentId={}, campaignId={}",
                adjustment.getId(),
                adjustment.getCampaignId());

        outboxEventService.publishEvent(
                "ADJUSTMENT_READY",
                adjustment.getId(),
                adjustment.getCampaignId(),
                KafkaTopics.ADJUSTMENTS_READY,
                event);
    }

    public void publishApprovalRequested(BudgetAdjustment adjustment) {
        ApprovalRequestedEvent event =
                ApprovalRequestedEvent.builder()
                        .adjustmentId(adjustment.getId())
                        .campaignId(adjustment.getCampaignId())
                        .previousAmount(adjustment.getPreviousAmount())
                        .proposedAmount(adjustment.getProposedAmount())
                        .reason(adjustment.getReason())
                        .expiresAt(adjustment.getExpiresAt())
                        .timestamp(LocalDateTime.now(clock))
                        .build();

        log.info(
                "Publishing approval requested event: adjustmentId={}, campaignId={},"
                        + " expiresAt={}",
                adjustment.getId(),
                adjustment.getCampaignId(),
                adjustment.getExpiresAt());

        outboxEventService.publishEvent(
                "APPROVAL_REQUESTED",
                adjustment.getId(),
                adjustment.getCampaignId(),
                KafkaTopics.APPROVAL_REQUESTED,
                event);
    }

    public void publishAlertRaised(Alert alert) {
        AlertRaisedEvent event =
                AlertRaisedEvent.builder()
                        .alertId(alert.getId())
                        .campaignId(alert.getCampaignId())
                        .type(alert.getType())
                        .severity(alert.getSeverity())
                        .message(alert.getMessage())
                        .recommendedAction(alert.getRecommendedAction())
                        .currentSpend(alert.getCurrentSpend())
                        .budgetLimit(alert.getBudgetLimit())
                        .projectedSpend(alert.getProjectedSpend())
                        .createdAt(alert.getCreatedAt())
                        .build();

        outboxEventService.publishEvent(
                "ALERT_RAISED",
                alert.getId(),
                alert.getCampaignId(),
                KafkaTopics.ALERTS_RAISED,
                event);
    }
}
