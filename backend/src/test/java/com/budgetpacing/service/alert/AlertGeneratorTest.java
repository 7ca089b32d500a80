package com.budgetpacing.service.alert;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.entity.Alert;
import com.budgetpacing.entity.AlertSeverity;
import com.budgetpacing.entity.AlertType;
import com.budgetpacing.entity.BudgetStatus;
import com.budgetpacing.monitoring.PacingMetrics;
import com.budgetpacing.producer.PacingEventProducer;
import com.budgetpacing.repository.jpa.AlertRepository;
import com.budgetpacing.service.pacing.PacingResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AlertGeneratorTest {

    @Mock private AlertRepository alertRepository;
    @Mock private PacingEventProducer eventProducer;
    @Mock private PlatformTransactionManager transactionManager;

    private final Map<String, Alert> openAlerts = new HashMap<>();
    private AlertGenerator alertGenerator;

    @BeforeEach
    void setUp() {
        alertGenerator =
                new AlertGenerator(
                        alertRepository,
                        new AlertRules(new PacingProperties()),
                        eventProducer,
                        new PacingMetrics(new SimpleMeterRegistry()),
                        Clock.fixed(Instant.parse("2026-06-15T10:00:00Z"), ZoneOffset.UTC),
                        transactionManager);

        when(alertRepository.findByOpenKey(anyString()))
                .thenAnswer(
                        invocation ->
                                Optional.ofNullable(openAlerts.get(invocation.getArgument(0))));
        when(alertRepository.saveAndFlush(any(Alert.class)))
                .thenAnswer(
                        invocation -> {
                            Alert alert = invocation.getArgument(0);
                            openAlerts.put(alert.getOpenKey(), alert);
                            return alert;
                        });
        when(alertRepository.save(any(Alert.class)))
                .thenAnswer(
                        invocation -> {
                            Alert alert = invocation.getArgument(0);
                            if (!alert.isOpen()) {
                                openAlerts.values().remove(alert);
                            }
                            return alert;
                        });
    }

    private static AlertRequest request(AlertType type) {
        return AlertRequest.of("camp-1", type, AlertSeverity.HIGH, "test " + type);
    }

    private static PacingResult pacing(BudgetStatus status) {
        return PacingResult.builder()
                .evaluable(true)
                .monthlyBudget(new BigDecimal("3000.00"))
                .spendToDate(new BigDecimal("1800.00"))
                .projectedSpend(new BigDecimal("5400.00"))
                .targetDailySpend(new BigDecimal("57.14"))
                .budgetStatus(status)
                .build();
    }

    @Test
    void raise_SameConditionTwice_KeepsSingleOpenAlert() {
        Optional<Alert> first = alertGenerator.raise(request(AlertType.COMMIT_FAILURE));
        Optional<Alert> second = alertGenerator.raise(request(AlertType.COMMIT_FAILURE));

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        verify(alertRepository, times(1)).saveAndFlush(any(Alert.class));
        verify(eventProducer, times(1)).publishAlertRaised(any());
    }

    @Test
    void raise_AfterResolution_RaisesAgain() {
        alertGenerator.raise(request(AlertType.STALE_DATA));

        alertGenerator.resolveOpen("camp-1", Set.of(AlertType.STALE_DATA), "auto");
        Optional<Alert> again = alertGenerator.raise(request(AlertType.STALE_DATA));

        assertTrue(again.isPresent());
        verify(alertRepository, times(2)).saveAndFlush(any(Alert.class));
    }

    @Test
    void raise_ConcurrentInsertLosesRace_ReturnsEmpty() {
        when(alertRepository.saveAndFlush(any(Alert.class)))
                .thenThrow(new DataIntegrityViolationException("uk_alert_open_key"));

        assertTrue(alertGenerator.raise(request(AlertType.ZERO_SPEND)).isEmpty());
    }

    @Test
    void applyCycle_OverspendThenRecovery_RaisesThenAutoResolves() {
        PacingResult overspending = pacing(BudgetStatus.OVERSPENDING);
        PacingResult onTrack = pacing(BudgetStatus.ON_TRACK);

        List<Alert> raised =
                alertGenerator.applyCycle(
                        CycleSignals.builder().campaignId("camp-1").pacing(overspending).build());
        assertEquals(1, raised.size());
        assertEquals(AlertType.PROJECTED_OVERSPEND, raised.get(0).getType());

        alertGenerator.applyCycle(
                CycleSignals.builder().campaignId("camp-1").pacing(onTrack).build());

        assertFalse(raised.get(0).isOpen());
        assertEquals("auto", raised.get(0).getResolvedBy());
    }

    @Test
    void resolve_OperatorClosesAlert() {
        Alert alert = alertGenerator.raise(request(AlertType.COMMIT_FAILURE)).orElseThrow();
        when(alertRepository.findById(5L)).thenReturn(Optional.of(alert));

        Alert resolved = alertGenerator.resolve(5L, "alice");

        assertFalse(resolved.isOpen());
        assertEquals("alice", resolved.getResolvedBy());
    }
}
