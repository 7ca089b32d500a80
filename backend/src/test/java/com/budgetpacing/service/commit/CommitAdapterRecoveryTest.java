package com.budgetpacing.service.commit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.budgetpacing.client.AdPlatformClient;
import com.budgetpacing.client.CampaignRegistryClient;
import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.dto.platform.BudgetChangeCommand;
import com.budgetpacing.dto.platform.BudgetChangeResponse;
import com.budgetpacing.dto.platform.CampaignInfo;
import com.budgetpacing.dto.platform.CampaignStatus;
import com.budgetpacing.entity.AdjustmentKind;
import com.budgetpacing.entity.AdjustmentStatus;
import com.budgetpacing.entity.AlertType;
import com.budgetpacing.entity.BudgetAdjustment;
import com.budgetpacing.entity.PacingPhase;
import com.budgetpacing.entity.PacingState;
import com.budgetpacing.exception.ConcurrentStateModificationException;
import com.budgetpacing.monitoring.PacingMetrics;
import com.budgetpacing.repository.jpa.AdjustmentAuditLogRepository;
import com.budgetpacing.repository.jpa.BudgetAdjustmentRepository;
import com.budgetpacing.repository.jpa.PacingStateRepository;
import com.budgetpacing.repository.jpa.PhaseTransitionLogRepository;
import com.budgetpacing.service.alert.AlertGenerator;
import com.budgetpacing.service.alert.AlertRequest;
import com.budgetpacing.service.approval.AdjustmentAuditTrail;
import com.budgetpacing.service.lifecycle.LifecycleController;
import com.budgetpacing.service.lock.CampaignLeaseService;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Commit recovery against real transactions: what a failed state update leaves behind must be
 * committable again by the next delivery of the same message.
 */
@DataJpaTest
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class CommitAdapterRecoveryTest {

    private static final String CAMPAIGN = "camp-recovery";
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 6, 15, 10, 0);

    @Autowired private BudgetAdjustmentRepository adjustmentRepository;
    @Autowired private PacingStateRepository pacingStateRepository;
    @Autowired private PhaseTransitionLogRepository transitionLogRepository;
    @Autowired private AdjustmentAuditLogRepository auditLogRepository;
    @Autowired private PlatformTransactionManager transactionManager;

    private final AdPlatformClient adPlatformClient = mock(AdPlatformClient.class);
    private final CampaignRegistryClient registryClient = mock(CampaignRegistryClient.class);
    private final CampaignLeaseService leaseService = mock(CampaignLeaseService.class);
    private final AlertGenerator alertGenerator = mock(AlertGenerator.class);

    private LifecycleController lifecycleController;
    private CommitAdapter commitAdapter;
    private Long adjustmentId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        PacingMetrics metrics = new PacingMetrics(new SimpleMeterRegistry());
        lifecycleController =
                spy(
                        new LifecycleController(
                                pacingStateRepository, transitionLogRepository, metrics, clock));
        commitAdapter =
                new CommitAdapter(
                        adjustmentRepository,
                        adPlatformClient,
                        registryClient,
                        lifecycleController,
                        leaseService,
                        new AdjustmentAuditTrail(auditLogRepository, clock),
                        alertGenerator,
                        metrics,
                        Retry.ofDefaults("recovery-commit"),
                        new PacingProperties(),
                        clock,
                        transactionManager);

        when(leaseService.tryAcquire(eq(CAMPAIGN), any())).thenReturn(Optional.of("lease-1"));
        when(registryClient.getCampaign(CAMPAIGN))
                .thenReturn(
                        Optional.of(
                                CampaignInfo.builder()
                                        .campaignId(CAMPAIGN)
                                        .status(CampaignStatus.ACTIVE)
                                        .build()));
        when(adPlatformClient.applyBudgetChange(any()))
                .thenReturn(
                        BudgetChangeResponse.builder()
                                .changeId("chg-1")
                                .campaignId(CAMPAIGN)
                                .build());

        adjustmentId =
                adjustmentRepository
                        .saveAndFlush(
                                BudgetAdjustment.builder()
                                        .campaignId(CAMPAIGN)
                                        .planId(7L)
                                        .evaluationBucket(1L)
                                        .kind(AdjustmentKind.EMERGENCY_REDUCTION)
                                        .previousAmount(new BigDecimal("100.00"))
                                        .proposedAmount(new BigDecimal("55.00"))
                                        .pacingRatio(1.8)
                                        .reason("Overspending")
                                        .requiresApproval(true)
                                        .status(AdjustmentStatus.APPROVED)
                                        .createdAt(NOW.minusHours(1))
                                        .expiresAt(NOW.plusHours(23))
                                        .build())
                        .getId();
        pacingStateRepository.saveAndFlush(
                PacingState.builder()
                        .campaignId(CAMPAIGN)
                        .planId(7L)
                        .phase(PacingPhase.AWAITING_APPROVAL)
                        .resumePhase(PacingPhase.THROTTLED)
                        .blockingAdjustmentId(adjustmentId)
                        .build());
    }

    @AfterEach
    void cleanUp() {
        auditLogRepository.deleteAll();
        transitionLogRepository.deleteAll();
        adjustmentRepository.deleteAll();
        pacingStateRepository.deleteAll();
    }

    @Test
    @DisplayName("A state update that keeps losing after the platform accepted is redelivered")
    void commit_StateUpdateFailsAfterPlatformSuccess_RedeliveryAppliesWithSameKey() {
        doThrow(new ConcurrentStateModificationException(CAMPAIGN, "version moved"))
                .when(lifecycleController)
                .onAdjustmentApplied(any());

        assertThrows(
                ConcurrentStateModificationException.class,
                () -> commitAdapter.commit(adjustmentId));

        BudgetAdjustment afterFailure = adjustmentRepository.findById(adjustmentId).orElseThrow();
        assertEquals(AdjustmentStatus.APPROVED, afterFailure.getStatus());
        assertNull(afterFailure.getCommitStartedAt());
        ArgumentCaptor<AlertRequest> alert = ArgumentCaptor.forClass(AlertRequest.class);
        verify(alertGenerator).raise(alert.capture());
        assertEquals(AlertType.COMMIT_FAILURE, alert.getValue().getType());

        doCallRealMethod().when(lifecycleController).onAdjustmentApplied(any());

        assertEquals(CommitOutcome.APPLIED, commitAdapter.commit(adjustmentId));

        ArgumentCaptor<BudgetChangeCommand> sent =
                ArgumentCaptor.forClass(BudgetChangeCommand.class);
        verify(adPlatformClient, times(2)).applyBudgetChange(sent.capture());
        List<BudgetChangeCommand> commands = sent.getAllValues();
        assertEquals(commands.get(0).getIdempotencyKey(), commands.get(1).getIdempotencyKey());

        BudgetAdjustment applied = adjustmentRepository.findById(adjustmentId).orElseThrow();
        assertEquals(AdjustmentStatus.APPLIED, applied.getStatus());
        PacingState state = pacingStateRepository.findById(CAMPAIGN).orElseThrow();
        assertEquals(0, new BigDecimal("55.00").compareTo(state.getLastAppliedBudget()));
        assertEquals(PacingPhase.THROTTLED, state.getPhase());
        assertNull(state.getBlockingAdjustmentId());
    }

    @Test
    @DisplayName("A single lost state update is retried without calling the platform again")
    void commit_StateUpdateLosesOnce_AppliedInOneDelivery() {
        doThrow(new ConcurrentStateModificationException(CAMPAIGN, "version moved"))
                .doCallRealMethod()
                .when(lifecycleController)
                .onAdjustmentApplied(any());

        assertEquals(CommitOutcome.APPLIED, commitAdapter.commit(adjustmentId));

        verify(adPlatformClient, times(1)).applyBudgetChange(any());
        verify(alertGenerator, never()).raise(any());
        assertEquals(
                AdjustmentStatus.APPLIED,
                adjustmentRepository.findById(adjustmentId).orElseThrow().getStatus());
        PacingState state = pacingStateRepository.findById(CAMPAIGN).orElseThrow();
        assertNull(state.getBlockingAdjustmentId());
    }

    @Test
    @DisplayName("A claim left by a crashed worker does not block the next delivery")
    void commit_ClaimLeftByCrashedWorker_IsTakenOver() {
        BudgetAdjustment claimed = adjustmentRepository.findById(adjustmentId).orElseThrow();
        claimed.setCommitStartedAt(NOW.minusMinutes(1));
        adjustmentRepository.saveAndFlush(claimed);

        assertEquals(CommitOutcome.APPLIED, commitAdapter.commit(adjustmentId));

        verify(adPlatformClient).applyBudgetChange(any());
        assertEquals(
                AdjustmentStatus.APPLIED,
                adjustmentRepository.findById(adjustmentId).orElseThrow().getStatus());
    }
}
