package com.budgetpacing.consumer;

import com.budgetpacing.config.KafkaTopics;
import com.budgetpacing.event.AlertRaisedEvent;
import com.budgetpacing.event.ApprovalRequestedEvent;
import com.budgetpacing.service.notification.SlackNotifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/** Notification worker for raised alerts and approval requests */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationConsumer {

    private final SlackNotifier slackNotifier;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = KafkaTopics.ALERTS_RAISED,
            groupId = "pacing-notification-group",
            containerFactory = "kafkaListenerContainerFactory")
    public void handleAlert(@Payload String message, Acknowledgment acknowledgment) {
        try {
            AlertRaisedEvent alert = objectMapper.readValue(message, AlertRaisedEvent.class);
            slackNotifier.notifyAlert(alert);
        } catch (JsonProcessingException e) {
            log.error("Unreadable alert event dropped: {}", e.getMessage());
        }
        acknowledgment.acknowledge();
    }

    @KafkaListener(
            topics = KafkaTopics.APPROVAL_REQUESTED,
            groupId = "pacing-notification-group",
            containerFactory = "kafkaListenerContainerFactory")
    public void handleApprovalRequested(@Payload String message, Acknowledgment acknowledgment) {
        try {
            ApprovalRequestedEvent request =
                    objectMapper.readValue(message, ApprovalRequestedEvent.class);
            slackNotifier.notifyApprovalRequested(request);
        } catch (JsonProcessingException e) {
            log.error("Unreadable approval request event dropped: {}", e.getMessage());
        }
        acknowledgment.acknowledge();
    }
}
