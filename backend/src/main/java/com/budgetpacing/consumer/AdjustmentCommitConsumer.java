package com.budgetpacing.consumer;

import com.budgetpacing.config.KafkaTopics;
import com.budgetpacing.event.AdjustmentReadyEvent;
import com.budgetpacing.service.commit.CommitAdapter;
import com.budgetpacing.service.commit.CommitOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.DltHandler;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.annotation.RetryableTopic;
import org.springframework.kafka.retrytopic.DltStrategy;
import org.springframework.kafka.retrytopic.TopicSuffixingStrategy;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.retry.annotation.Backoff;
import org.springframework.stereotype.Component;

/** Commit worker: applies adjustments that are ready to the ad platform */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdjustmentCommitConsumer {

    private final CommitAdapter commitAdapter;
    private final ObjectMapper objectMapper;

    // redeliveries span about eight minutes so a commit outlasts an evaluation holding the lease
    @RetryableTopic(
            attempts = "5",
            backoff = @Backoff(delay = 30000, multiplier = 2.0),
            autoCreateTopics = "true",
            topicSuffixingStrategy = TopicSuffixingStrategy.SUFFIX_WITH_INDEX_VALUE,
            dltStrategy = DltStrategy.FAIL_ON_ERROR,
            exclude = {JsonProcessingException.class})
    @KafkaListener(
            topics = KafkaTopics.ADJUSTMENTS_READY,
            groupId = "pacing-commit-group",
            containerFactory = "kafkaListenerContainerFactory")
    public void handleAdjustmentReady(
            @Payload String message,
            @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment)
            throws JsonProcessingException {
        AdjustmentReadyEvent event;
        try {
            event = objectMapper.readValue(message, AdjustmentReadyEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Unreadable adjustment event at {}@{}: {}", topic, offset, e.getMessage());
            acknowledgment.acknowledge();
            throw e;
        }

        CommitOutcome outcome = commitAdapter.commit(event.getAdjustmentId());
        acknowledgment.acknowledge();
        log.info(
                "Adjustment commit processed: adjustmentId={}, campaignId={}, outcome={}",
                event.getAdjustmentId(),
                event.getCampaignId(),
                outcome);
    }

    @DltHandler
    public void handleDlt(
            @Payload String message,
            @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
            @Header(value = KafkaHeaders.EXCEPTION_MESSAGE, required = false)
                    String exceptionMessage) {
        log.error(
                "Adjustment commit gave up after redeliveries: topic={}, error={}, message={}",
                topic,
                exceptionMessage,
                message);
        try {
            AdjustmentReadyEvent event =
                    objectMapper.readValue(message, AdjustmentReadyEvent.class);
            commitAdapter.markFailed(
                    event.getAdjustmentId(),
                    "Commit abandoned after redeliveries: " + exceptionMessage);
        } catch (JsonProcessingException e) {
            log.error("Unreadable adjustment event in DLT: {}", e.getMessage());
        }
    }
}
