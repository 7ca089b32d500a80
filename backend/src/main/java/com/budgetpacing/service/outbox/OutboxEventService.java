package com.budgetpacing.service.outbox;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.entity.OutboxEvent;
import com.budgetpacing.repository.jpa.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Transactional outbox. Events are stored with the state change that produced them and relayed
 * to Kafka only once that transaction has committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxEventService {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final PacingProperties properties;
    private final Clock clock;

    /**
     * Stores the event within the caller's transaction. The campaign id is the Kafka key so the
     * events of one campaign reach consumers in order.
     */
    @Transactional
    public void publishEvent(
            String eventType, Long sourceId, String campaignId, String topic, Object payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error(
                    "Failed to serialize outbox event: eventType={}, sourceId={}, campaignId={}",
                    eventType,
                    sourceId,
                    campaignId,
                    e);
            throw new IllegalStateException("Failed to store outbox event " + eventType, e);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        outboxEventRepository.save(
                OutboxEvent.builder()
                        .campaignId(campaignId)
                        .eventType(eventType)
                        .sourceId(sourceId)
                        .topic(topic)
                        .payload(json)
                        .createdAt(now)
                        .nextAttemptAt(now)
                        .build());
        log.debug(
                "Outbox event stored: eventType={}, sourceId={}, campaignId={}, topic={}",
                eventType,
                sourceId,
                campaignId,
                topic);
    }

    @Scheduled(fixedDelayString = "${app.pacing.outbox.relay-interval:PT5S}")
    @Transactional
    public void relayDueEvents() {
        PacingProperties.Outbox outbox = properties.getOutbox();
        List<OutboxEvent> due =
                outboxEventRepository.findDue(
                        LocalDateTime.now(clock),
                        outbox.getMaxRetries(),
                        PageRequest.of(0, outbox.getBatchSize()));
        if (due.isEmpty()) {
            return;
        }
        log.debug("Relaying {} outbox events", due.size());
        Set<String> blocked = new HashSet<>();
        for (OutboxEvent event : due) {
            // a failed send holds back the rest of that campaign's batch
            if (blocked.contains(event.getCampaignId()) || !relay(event)) {
                blocked.add(event.getCampaignId());
            }
        }
    }

    /** Sends synchronously so that the published mark never runs ahead of the broker ack */
    boolean relay(OutboxEvent event) {
        try {
            SendResult<String, String> result =
                    kafkaTemplate
                            .send(event.getTopic(), event.getCampaignId(), event.getPayload())
                            .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            event.published(LocalDateTime.now(clock));
            outboxEventRepository.save(event);
            log.debug(
                    "Outbox event published: id={}, eventType={}, partition={}, offset={}",
                    event.getId(),
                    event.getEventType(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            onSendFailure(event, e);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            onSendFailure(event, e);
        }
        return false;
    }

    private void onSendFailure(OutboxEvent event, Throwable error) {
        int maxAttempts = properties.getOutbox().getMaxRetries();
        event.sendFailed(String.valueOf(error.getMessage()), LocalDateTime.now(clock));
        outboxEventRepository.save(event);
        if (event.getAttempts() >= maxAttempts) {
            log.error(
                    "Outbox event undeliverable after {} attempts: id={}, eventType={},"
                            + " sourceId={}, campaignId={}, error={}",
                    maxAttempts,
                    event.getId(),
                    event.getEventType(),
                    event.getSourceId(),
                    event.getCampaignId(),
                    error.getMessage());
        } else {
            log.warn(
                    "Outbox send failed, will retry: id={}, attempts={}, nextAttemptAt={},"
                            + " error={}",
                    event.getId(),
                    event.getAttempts(),
                    event.getNextAttemptAt(),
                    error.getMessage());
        }
    }

    @Scheduled(cron = "0 0 2 * * ?") // Daily at 2 AM
    @Transactional
    public void purgePublishedEvents() {
        int retentionDays = properties.getOutbox().getRetentionDays();
        int deleted =
                outboxEventRepository.deletePublishedBefore(
                        LocalDateTime.now(clock).minusDays(retentionDays));
        if (deleted > 0) {
            log.info("Purged {} outbox events published over {} days ago", deleted, retentionDays);
        }
    }

    public OutboxStats getOutboxStats() {
        return new OutboxStats(
                outboxEventRepository.countByPublishedAtIsNull(),
                outboxEventRepository.countByPublishedAtIsNullAndAttemptsGreaterThanEqual(
                        properties.getOutbox().getMaxRetries()));
    }

    /** Unpublished events, and the part of them the relay has given up on */
    public record OutboxStats(long pending, long undeliverable) {}
}
