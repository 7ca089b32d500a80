package com.budgetpacing.service.approval;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.entity.AdjustmentKind;
import com.budgetpacing.entity.AdjustmentStatus;
import com.budgetpacing.entity.AlertSeverity;
import com.budgetpacing.entity.AlertType;
import com.budgetpacing.entity.AuditAction;
import com.budgetpacing.entity.BudgetAdjustment;
import com.budgetpacing.exception.ApprovalTimeoutException;
import com.budgetpacing.exception.IllegalAdjustmentStateException;
import com.budgetpacing.monitoring.PacingMetrics;
import com.budgetpacing.producer.PacingEventProducer;
import com.budgetpacing.repository.jpa.BudgetAdjustmentRepository;
import com.budgetpacing.service.alert.AlertGenerator;
import com.budgetpacing.service.alert.AlertRequest;
import com.budgetpacing.service.lifecycle.LifecycleController;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ApprovalGateTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 6, 15, 10, 0);

    @Mock private BudgetAdjustmentRepository adjustmentRepository;
    @Mock private AdjustmentAuditTrail auditTrail;
    @Mock private LifecycleController lifecycleController;
    @Mock private AlertGenerator alertGenerator;
    @Mock private PacingEventProducer eventProducer;
    @Mock private PlatformTransactionManager transactionManager;

    private ApprovalGate approvalGate;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        approvalGate =
                new ApprovalGate(
                        adjustmentRepository,
                        auditTrail,
                        lifecycleController,
                        alertGenerator,
                        eventProducer,
                        new PacingMetrics(new SimpleMeterRegistry()),
                        new PacingProperties(),
                        clock,
                        transactionManager);
        when(adjustmentRepository.saveAndFlush(any(BudgetAdjustment.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private BudgetAdjustment pending(LocalDateTime expiresAt) {
        BudgetAdjustment adjustment =
                BudgetAdjustment.builder()
                        .id(42L)
                        .campaignId("camp-1")
                        .kind(AdjustmentKind.EMERGENCY_REDUCTION)
                        .previousAmount(new BigDecimal("100.00"))
                        .proposedAmount(new BigDecimal("55.55"))
                        .requiresApproval(true)
                        .status(AdjustmentStatus.PENDING)
                        .expiresAt(expiresAt)
                        .build();
        when(adjustmentRepository.findById(42L)).thenReturn(Optional.of(adjustment));
        return adjustment;
    }

    @Test
    void submit_SetsExpiryAndPublishesApprovalRequest() {
        BudgetAdjustment adjustment =
                BudgetAdjustment.builder()
                        .campaignId("camp-1")
                        .kind(AdjustmentKind.EMERGENCY_REDUCTION)
                        .proposedAmount(new BigDecimal("55.55"))
                        .build();

        BudgetAdjustment saved = approvalGate.submit(adjustment);

        assertEquals(AdjustmentStatus.PENDING, saved.getStatus());
        assertEquals(NOW.plusHours(24), saved.getExpiresAt());
        verify(eventProducer).publishApprovalRequested(saved);
        verify(eventProducer, never()).publishAdjustmentReady(any());
    }

    @Test
    void autoApprove_PublishesReadyEvent() {
        BudgetAdjustment adjustment =
                BudgetAdjustment.builder()
                        .campaignId("camp-1")
                        .kind(AdjustmentKind.INCREASE)
                        .proposedAmount(new BigDecimal("120.00"))
                        .build();

        BudgetAdjustment saved = approvalGate.autoApprove(adjustment);

        assertEquals(AdjustmentStatus.APPROVED, saved.getStatus());
        assertEquals(ApprovalGate.SYSTEM_ACTOR, saved.getDecidedBy());
        verify(auditTrail)
                .record(saved, AuditAction.AUTO_APPROVED, ApprovalGate.SYSTEM_ACTOR, null);
        verify(eventProducer).publishAdjustmentReady(saved);
    }

    @Test
    void approve_WithinWindow_ApprovesAndPublishes() {
        BudgetAdjustment adjustment = pending(NOW.plusHours(3));

        approvalGate.approve(42L, "alice", "ok");

        assertEquals(AdjustmentStatus.APPROVED, adjustment.getStatus());
        assertEquals("alice", adjustment.getDecidedBy());
        verify(eventProducer).publishAdjustmentReady(adjustment);
    }

    @Test
    void approve_AfterExpiry_ThrowsApprovalTimeout() {
        BudgetAdjustment adjustment = pending(NOW.minusMinutes(1));

        assertThrows(
                ApprovalTimeoutException.class, () -> approvalGate.approve(42L, "alice", null));
        assertEquals(AdjustmentStatus.PENDING, adjustment.getStatus());
        verify(eventProducer, never()).publishAdjustmentReady(any());
    }

    @Test
    void approve_AlreadyDecided_ThrowsIllegalState() {
        BudgetAdjustment adjustment = pending(NOW.plusHours(3));
        adjustment.setStatus(AdjustmentStatus.APPLIED);

        assertThrows(
                IllegalAdjustmentStateException.class,
                () -> approvalGate.approve(42L, "alice", null));
    }

    @Test
    void reject_ClosesAdjustmentAndReleasesHold() {
        BudgetAdjustment adjustment = pending(NOW.plusHours(3));

        approvalGate.reject(42L, "bob", "too aggressive");

        assertEquals(AdjustmentStatus.REJECTED, adjustment.getStatus());
        verify(lifecycleController).onAdjustmentClosed(eq("camp-1"), eq(42L), anyString());
        verify(eventProducer, never()).publishAdjustmentReady(any());
    }

    @Test
    void expireOverdue_RejectsOnceAndRaisesSingleAlert() {
        BudgetAdjustment adjustment = pending(NOW.minusHours(1));
        when(adjustmentRepository.findExpiredPending(NOW)).thenReturn(List.of(adjustment));

        assertEquals(1, approvalGate.expireOverdue());
        // a second sweep sees the adjustment already closed
        assertEquals(0, approvalGate.expireOverdue());

        assertEquals(AdjustmentStatus.REJECTED, adjustment.getStatus());
        verify(auditTrail, times(1))
                .record(
                        adjustment,
                        AuditAction.EXPIRED,
                        ApprovalGate.SYSTEM_ACTOR,
                        "Approval window expired");
        ArgumentCaptor<AlertRequest> captor = ArgumentCaptor.forClass(AlertRequest.class);
        verify(alertGenerator, times(1)).raise(captor.capture());
        assertEquals(AlertType.APPROVAL_EXPIRED, captor.getValue().getType());
        assertEquals(AlertSeverity.HIGH, captor.getValue().getSeverity());
        verify(lifecycleController, times(1))
                .onAdjustmentClosed(eq("camp-1"), eq(42L), anyString());
    }

    @Test
    void cancelPending_ClosesEveryPendingAdjustment() {
        BudgetAdjustment first = pending(NOW.plusHours(1));
        BudgetAdjustment second =
                BudgetAdjustment.builder()
                        .id(43L)
                        .campaignId("camp-1")
                        .status(AdjustmentStatus.PENDING)
                        .build();
        when(adjustmentRepository.findByCampaignIdAndStatus("camp-1", AdjustmentStatus.PENDING))
                .thenReturn(List.of(first, second));

        List<BudgetAdjustment> cancelled = approvalGate.cancelPending("camp-1", "exhausted");

        assertEquals(2, cancelled.size());
        assertEquals(AdjustmentStatus.REJECTED, first.getStatus());
        assertEquals(AdjustmentStatus.REJECTED, second.getStatus());
        verify(auditTrail)
                .record(first, AuditAction.CANCELLED, ApprovalGate.SYSTEM_ACTOR, "exhausted");
    }

    @Test
    void findOwnPause_LatestAppliedIsExhaustionPause_ReturnsIt() {
        BudgetAdjustment pause =
                BudgetAdjustment.builder()
                        .id(40L)
                        .campaignId("camp-1")
                        .kind(AdjustmentKind.EXHAUSTION_PAUSE)
                        .status(AdjustmentStatus.APPLIED)
                        .build();
        when(adjustmentRepository.findFirstByCampaignIdAndStatusOrderByAppliedAtDesc(
                        "camp-1", AdjustmentStatus.APPLIED))
                .thenReturn(Optional.of(pause));

        assertSame(pause, approvalGate.findOwnPause("camp-1").orElseThrow());
    }

    @Test
    void findOwnPause_LatestAppliedIsResume_ReturnsEmpty() {
        when(adjustmentRepository.findFirstByCampaignIdAndStatusOrderByAppliedAtDesc(
                        "camp-1", AdjustmentStatus.APPLIED))
                .thenReturn(
                        Optional.of(
                                BudgetAdjustment.builder()
                                        .id(41L)
                                        .campaignId("camp-1")
                                        .kind(AdjustmentKind.RESUME)
                                        .status(AdjustmentStatus.APPLIED)
                                        .build()));

        assertTrue(approvalGate.findOwnPause("camp-1").isEmpty());
    }
}
