package com.budgetpacing.consumer;

import com.budgetpacing.config.KafkaTopics;
import com.budgetpacing.event.ApprovalDecisionEvent;
import com.budgetpacing.exception.PacingException;
import com.budgetpacing.service.approval.ApprovalGate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/** Operator decisions arriving through the approval queue */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApprovalDecisionConsumer {

    private final ApprovalGate approvalGate;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = KafkaTopics.APPROVAL_DECISIONS,
            groupId = "pacing-approval-group",
            containerFactory = "kafkaListenerContainerFactory")
    public void handleDecision(@Payload String message, Acknowledgment acknowledgment) {
        try {
            ApprovalDecisionEvent decision =
                    objectMapper.readValue(message, ApprovalDecisionEvent.class);
            if (decision.isApproved()) {
                approvalGate.approve(
                        decision.getAdjustmentId(), decision.getDecidedBy(), decision.getNote());
            } else {
                approvalGate.reject(
                        decision.getAdjustmentId(), decision.getDecidedBy(), decision.getNote());
            }
        } catch (JsonProcessingException e) {
            log.error("Unreadable approval decision dropped: {}", e.getMessage());
        } catch (PacingException e) {
            // expired, already decided or unknown: the decision can never succeed
            log.warn(
                    "Approval decision rejected: code={}, campaignId={}, error={}",
                    e.getErrorCode(),
                    e.getCampaignId(),
                    e.getMessage());
        }
        acknowledgment.acknowledge();
    }
}
