package com.budgetpacing.service.outbox;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.entity.OutboxEvent;
import com.budgetpacing.repository.jpa.OutboxEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OutboxEventServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 6, 15, 10, 0);

    @Mock private OutboxEventRepository outboxEventRepository;
    @Mock private KafkaTemplate<String, String> kafkaTemplate;

    private OutboxEventService outboxEventService;

    @BeforeEach
    void setUp() {
        outboxEventService =
                new OutboxEventService(
                        outboxEventRepository,
                        kafkaTemplate,
                        new ObjectMapper(),
                        new PacingProperties(),
                        Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    private static OutboxEvent event(long id, String campaignId) {
        return OutboxEvent.builder()
                .id(id)
                .campaignId(campaignId)
                .eventType("ALERT_RAISED")
                .sourceId(id)
                .topic("pacing.alerts.raised")
                .payload("{\"alertId\":" + id + "}")
                .createdAt(NOW.minusMinutes(1))
                .nextAttemptAt(NOW.minusMinutes(1))
                .build();
    }

    private static CompletableFuture<SendResult<String, String>> acked(String key) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>("pacing.alerts.raised", key, "{}");
        RecordMetadata metadata =
                new RecordMetadata(new TopicPartition("pacing.alerts.raised", 0), 12L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    private static CompletableFuture<SendResult<String, String>> brokerDown() {
        return CompletableFuture.failedFuture(new IllegalStateException("broker unavailable"));
    }

    @Test
    void publishEvent_StoresPayloadKeyedByCampaignAndDueNow() {
        outboxEventService.publishEvent(
                "ADJUSTMENT_READY", 42L, "camp-1", "pacing.adjustments.ready", Map.of("id", 42));

        ArgumentCaptor<OutboxEvent> captor = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxEventRepository).save(captor.capture());
        OutboxEvent stored = captor.getValue();
        assertEquals("camp-1", stored.getCampaignId());
        assertEquals(42L, stored.getSourceId());
        assertEquals("{\"id\":42}", stored.getPayload());
        assertEquals(NOW, stored.getNextAttemptAt());
        assertFalse(stored.isPublished());
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    void relayDueEvents_BrokerAcks_MarksPublished() {
        OutboxEvent event = event(1L, "camp-1");
        when(outboxEventRepository.findDue(eq(NOW), eq(5), any())).thenReturn(List.of(event));
        when(kafkaTemplate.send("pacing.alerts.raised", "camp-1", event.getPayload()))
                .thenReturn(acked("camp-1"));

        outboxEventService.relayDueEvents();

        assertTrue(event.isPublished());
        assertEquals(NOW, event.getPublishedAt());
        verify(outboxEventRepository).save(event);
    }

    @Test
    void relayDueEvents_SendFails_HoldsBackLaterEventsOfThatCampaignOnly() {
        OutboxEvent first = event(1L, "camp-1");
        OutboxEvent second = event(2L, "camp-1");
        OutboxEvent other = event(3L, "camp-2");
        when(outboxEventRepository.findDue(any(), anyInt(), any()))
                .thenReturn(List.of(first, second, other));
        when(kafkaTemplate.send(anyString(), eq("camp-1"), anyString())).thenReturn(brokerDown());
        when(kafkaTemplate.send(anyString(), eq("camp-2"), anyString()))
                .thenReturn(acked("camp-2"));

        outboxEventService.relayDueEvents();

        verify(kafkaTemplate, times(1)).send(anyString(), eq("camp-1"), anyString());
        assertEquals(1, first.getAttempts());
        assertEquals(NOW.plusMinutes(2), first.getNextAttemptAt());
        assertTrue(first.getLastError().contains("broker unavailable"));
        assertEquals(0, second.getAttempts());
        assertFalse(second.isPublished());
        assertTrue(other.isPublished());
    }

    @Test
    void sendFailed_RepeatedFailures_BackoffCappedAtAnHour() {
        OutboxEvent event = event(1L, "camp-1");
        for (int i = 0; i < 9; i++) {
            event.sendFailed("timeout", NOW);
        }

        assertEquals(9, event.getAttempts());
        assertEquals(NOW.plusMinutes(60), event.getNextAttemptAt());
    }

    @Test
    void getOutboxStats_CountsPendingAndGivenUp() {
        when(outboxEventRepository.countByPublishedAtIsNull()).thenReturn(4L);
        when(outboxEventRepository.countByPublishedAtIsNullAndAttemptsGreaterThanEqual(5))
                .thenReturn(1L);

        OutboxEventService.OutboxStats stats = outboxEventService.getOutboxStats();

        assertEquals(4L, stats.pending());
        assertEquals(1L, stats.undeliverable());
    }
}
