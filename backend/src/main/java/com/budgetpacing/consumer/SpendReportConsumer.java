package com.budgetpacing.consumer;

import com.budgetpacing.config.KafkaTopics;
import com.budgetpacing.dto.platform.SpendReport;
import com.budgetpacing.entity.AlertSeverity;
import com.budgetpacing.entity.AlertType;
import com.budgetpacing.entity.SnapshotSource;
import com.budgetpacing.exception.InvariantViolationException;
import com.budgetpacing.service.alert.AlertGenerator;
import com.budgetpacing.service.alert.AlertRequest;
import com.budgetpacing.service.ingestion.SpendIngestionAdapter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/** Spend figures pushed by the metrics feed */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpendReportConsumer {

    private final SpendIngestionAdapter spendIngestion;
    private final AlertGenerator alertGenerator;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = KafkaTopics.SPEND_REPORTS,
            groupId = "pacing-spend-group",
            containerFactory = "kafkaListenerContainerFactory")
    public void handleSpendReport(@Payload String message, Acknowledgment acknowledgment) {
        try {
            SpendReport report = objectMapper.readValue(message, SpendReport.class);
            spendIngestion.record(report, SnapshotSource.PUSH);
        } catch (JsonProcessingException e) {
            log.error("Unreadable spend report dropped: {}", e.getMessage());
        } catch (InvariantViolationException e) {
            log.error(
                    "Invalid spend report dropped: campaignId={}, error={}",
                    e.getCampaignId(),
                    e.getMessage());
            alertGenerator.raise(
                    AlertRequest.of(
                            e.getCampaignId(),
                            AlertType.INVARIANT_VIOLATION,
                            AlertSeverity.HIGH,
                            e.getMessage()));
        }
        acknowledgment.acknowledge();
    }
}
