package com.budgetpacing.service.commit;

import com.budgetpacing.client.AdPlatformClient;
import com.budgetpacing.client.CampaignRegistryClient;
import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.dto.platform.BudgetChangeCommand;
import com.budgetpacing.dto.platform.BudgetChangeResponse;
import com.budgetpacing.dto.platform.CampaignInfo;
import com.budgetpacing.dto.platform.CampaignStatus;
import com.budgetpacing.entity.AdjustmentKind;
import com.budgetpacing.entity.AdjustmentStatus;
import com.budgetpacing.entity.AlertSeverity;
import com.budgetpacing.entity.AlertType;
import com.budgetpacing.entity.AuditAction;
import com.budgetpacing.entity.BudgetAdjustment;
import com.budgetpacing.entity.PacingPhase;
import com.budgetpacing.entity.PacingState;
import com.budgetpacing.exception.AdPlatformException;
import com.budgetpacing.exception.CommitFailureException;
import com.budgetpacing.exception.ConcurrentStateModificationException;
import com.budgetpacing.exception.ResourceNotFoundException;
import com.budgetpacing.monitoring.PacingMetrics;
import com.budgetpacing.repository.jpa.BudgetAdjustmentRepository;
import com.budgetpacing.service.alert.AlertGenerator;
import com.budgetpacing.service.alert.AlertRequest;
import com.budgetpacing.service.approval.AdjustmentAuditTrail;
import com.budgetpacing.service.approval.ApprovalGate;
import com.budgetpacing.service.lifecycle.LifecycleController;
import com.budgetpacing.service.lock.CampaignLeaseService;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Applies approved adjustments to the advertising platform.
 *
 * <p>A commit runs under the campaign's lease, so it never overlaps an evaluation of the same
 * campaign. It claims the adjustment (optimistic lock on its version), re-checks that it is still
 * valid, then calls the platform with the adjustment's idempotency key under the retry policy. An
 * adjustment that is already APPLIED is never sent again; a claim left behind by an interrupted
 * attempt is taken over and the change re-sent under the same key.
 */
@Slf4j
@Service
public class CommitAdapter {

    private final BudgetAdjustmentRepository adjustmentRepository;
    private final AdPlatformClient adPlatformClient;
    private final CampaignRegistryClient registryClient;
    private final LifecycleController lifecycleController;
    private final CampaignLeaseService leaseService;
    private final AdjustmentAuditTrail auditTrail;
    private final AlertGenerator alertGenerator;
    private final PacingMetrics metrics;
    private final Retry commitRetry;
    private final Duration leaseTtl;
    private final int stateUpdateAttempts;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public CommitAdapter(
            BudgetAdjustmentRepository adjustmentRepository,
            AdPlatformClient adPlatformClient,
            CampaignRegistryClient registryClient,
            LifecycleController lifecycleController,
            CampaignLeaseService leaseService,
            AdjustmentAuditTrail auditTrail,
            AlertGenerator alertGenerator,
            PacingMetrics metrics,
            @Qualifier("adPlatformCommitRetry") Retry commitRetry,
            PacingProperties properties,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.adjustmentRepository = adjustmentRepository;
        this.adPlatformClient = adPlatformClient;
        this.registryClient = registryClient;
        this.lifecycleController = lifecycleController;
        this.leaseService = leaseService;
        this.auditTrail = auditTrail;
        this.alertGenerator = alertGenerator;
        this.metrics = metrics;
        this.commitRetry = commitRetry;
        this.leaseTtl = properties.getMonitoring().leaseTtl();
        this.stateUpdateAttempts = properties.getCommit().getStateUpdateAttempts();
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Commits one adjustment.
     *
     * @throws ConcurrentStateModificationException when the campaign's lease is held; the message
     *     is redelivered
     */
    public CommitOutcome commit(Long adjustmentId) {
        String campaignId = load(adjustmentId).getCampaignId();
        Optional<String> lease = leaseService.tryAcquire(campaignId, leaseTtl);
        if (lease.isEmpty()) {
            log.info(
                    "Campaign busy, commit deferred to redelivery: adjustmentId={}, campaignId={}",
                    adjustmentId,
                    campaignId);
            throw new ConcurrentStateModificationException(
                    campaignId,
                    "Campaign is being evaluated; adjustment " + adjustmentId + " will be retried");
        }
        try {
            return commitUnderLease(adjustmentId);
        } finally {
            leaseService.release(campaignId, lease.get());
        }
    }

    private CommitOutcome commitUnderLease(Long adjustmentId) {
        BudgetAdjustment adjustment;
        try {
            adjustment = transactionTemplate.execute(status -> claim(adjustmentId));
        } catch (ObjectOptimisticLockingFailureException e) {
            log.info("Adjustment claimed concurrently: adjustmentId={}", adjustmentId);
            return CommitOutcome.IN_PROGRESS;
        }
        if (adjustment == null) {
            return outcomeForUnclaimed(adjustmentId);
        }

        try {
            return applyClaimed(adjustment);
        } catch (AdPlatformException e) {
            // registry lookup failed; the redelivery must be able to claim again
            releaseClaim(adjustmentId);
            throw e;
        } catch (RuntimeException e) {
            releaseClaim(adjustmentId);
            raiseInterrupted(adjustment, e);
            throw e;
        }
    }

    private CommitOutcome applyClaimed(BudgetAdjustment adjustment) {
        Long adjustmentId = adjustment.getId();
        Optional<String> invalidReason = checkStillValid(adjustment);
        if (invalidReason.isPresent()) {
            cancel(adjustment, invalidReason.get());
            return CommitOutcome.CANCELLED;
        }

        AtomicInteger attempts = new AtomicInteger();
        BudgetChangeCommand command = toCommand(adjustment);
        Timer.Sample sample = metrics.startTimer();
        BudgetChangeResponse response;
        try {
            response =
                    commitRetry.executeSupplier(
                            () -> {
                                attempts.incrementAndGet();
                                return adPlatformClient.applyBudgetChange(command);
                            });
            metrics.recordPlatformCallTime(sample);
        } catch (AdPlatformException e) {
            metrics.recordPlatformCallTime(sample);
            CommitFailureException failure =
                    new CommitFailureException(
                            adjustment.getCampaignId(),
                            adjustmentId,
                            attempts.get(),
                            String.format(
                                    "Budget change failed after %d attempt(s): %s",
                                    attempts.get(), e.getMessage()),
                            e);
            markFailed(adjustmentId, failure.getMessage(), attempts.get());
            return CommitOutcome.FAILED;
        }
        markApplied(adjustmentId, attempts.get(), response);
        return CommitOutcome.APPLIED;
    }

    /** Marks the adjustment APPROVED-but-claimed; null when there is nothing to commit */
    private BudgetAdjustment claim(Long adjustmentId) {
        BudgetAdjustment adjustment = load(adjustmentId);
        if (adjustment.getStatus() != AdjustmentStatus.APPROVED) {
            return null;
        }
        if (adjustment.getCommitStartedAt() != null) {
            log.warn(
                    "Taking over interrupted commit, re-sending with the same idempotency key:"
                            + " adjustmentId={}, commitStartedAt={}",
                    adjustmentId,
                    adjustment.getCommitStartedAt());
        }
        adjustment.setCommitStartedAt(LocalDateTime.now(clock));
        return adjustmentRepository.saveAndFlush(adjustment);
    }

    private void releaseClaim(Long adjustmentId) {
        transactionTemplate.executeWithoutResult(
                status ->
                        adjustmentRepository
                                .findById(adjustmentId)
                                .filter(a -> a.getStatus() == AdjustmentStatus.APPROVED)
                                .ifPresent(
                                        a -> {
                                            a.setCommitStartedAt(null);
                                            adjustmentRepository.saveAndFlush(a);
                                        }));
    }

    private BudgetAdjustment load(Long adjustmentId) {
        return adjustmentRepository
                .findById(adjustmentId)
                .orElseThrow(() -> new ResourceNotFoundException("BudgetAdjustment", adjustmentId));
    }

    private CommitOutcome outcomeForUnclaimed(Long adjustmentId) {
        BudgetAdjustment current = load(adjustmentId);
        if (current.getStatus() == AdjustmentStatus.APPLIED) {
            log.info(
                    "Adjustment already applied, skipping: adjustmentId={}, appliedAt={}",
                    adjustmentId,
                    current.getAppliedAt());
            return CommitOutcome.ALREADY_APPLIED;
        }
        log.info(
                "Adjustment not committable: adjustmentId={}, status={}",
                adjustmentId,
                current.getStatus());
        return CommitOutcome.SKIPPED;
    }

    /**
     * Re-checked immediately before mutating the platform: the campaign may have been paused
     * externally, exhausted or rolled into a new period since the adjustment was proposed.
     */
    Optional<String> checkStillValid(BudgetAdjustment adjustment) {
        String campaignId = adjustment.getCampaignId();
        Optional<CampaignInfo> campaign = registryClient.getCampaign(campaignId);
        if (campaign.isEmpty()) {
            return Optional.of("Campaign no longer exists in the registry");
        }
        boolean pausing = adjustment.getKind() == AdjustmentKind.EXHAUSTION_PAUSE;
        boolean resuming =
                adjustment.getKind() == AdjustmentKind.RESUME
                        && campaign.get().getStatus() == CampaignStatus.PAUSED;
        if (!campaign.get().isRunning() && !pausing && !resuming) {
            return Optional.of("Campaign is " + campaign.get().getStatus() + " on the platform");
        }

        Optional<PacingState> state = lifecycleController.find(campaignId);
        if (state.isEmpty()) {
            return Optional.of("Campaign has no pacing state");
        }
        PacingPhase phase = state.get().getPhase();
        if (phase == PacingPhase.PAUSED) {
            return Optional.of("Campaign pacing is paused");
        }
        if (phase == PacingPhase.EXHAUSTED && !pausing) {
            return Optional.of("Campaign budget is exhausted");
        }
        if (state.get().getPlanId() != null
                && !Objects.equals(state.get().getPlanId(), adjustment.getPlanId())) {
            return Optional.of("Budget plan has rolled over since the adjustment was proposed");
        }
        return Optional.empty();
    }

    private BudgetChangeCommand toCommand(BudgetAdjustment adjustment) {
        return BudgetChangeCommand.builder()
                .campaignId(adjustment.getCampaignId())
                .newDailyBudget(adjustment.getProposedAmount())
                .effectiveAt(LocalDateTime.now(clock))
                .pause(adjustment.getKind() == AdjustmentKind.EXHAUSTION_PAUSE)
                .resume(adjustment.getKind() == AdjustmentKind.RESUME)
                .idempotencyKey(adjustment.idempotencyKey())
                .build();
    }

    /**
     * Records the platform's acceptance. The pacing state may move under us (operator override),
     * so a lost compare-and-swap is retried against freshly loaded rows.
     */
    private void markApplied(Long adjustmentId, int attempts, BudgetChangeResponse response) {
        for (int attempt = 1; ; attempt++) {
            try {
                transactionTemplate.executeWithoutResult(
                        status -> recordApplied(adjustmentId, attempts, response));
                break;
            } catch (ConcurrentStateModificationException
                    | ObjectOptimisticLockingFailureException e) {
                if (attempt >= stateUpdateAttempts) {
                    throw e;
                }
                log.warn(
                        "Pacing state changed while recording commit, retrying: adjustmentId={},"
                                + " attempt={}",
                        adjustmentId,
                        attempt);
            }
        }
        metrics.recordAdjustment(AdjustmentStatus.APPLIED);
        log.info(
                "Adjustment applied: adjustmentId={}, attempts={}, changeId={}, duplicate={}",
                adjustmentId,
                attempts,
                response.getChangeId(),
                response.isDuplicate());
    }

    private void recordApplied(Long adjustmentId, int attempts, BudgetChangeResponse response) {
        BudgetAdjustment adjustment = load(adjustmentId);
        adjustment.setStatus(AdjustmentStatus.APPLIED);
        adjustment.setAppliedAt(LocalDateTime.now(clock));
        adjustment.setCommitAttempts(attempts);
        adjustmentRepository.saveAndFlush(adjustment);
        auditTrail.record(
                adjustment,
                AuditAction.APPLIED,
                ApprovalGate.SYSTEM_ACTOR,
                "Platform change " + response.getChangeId());
        lifecycleController.onAdjustmentApplied(adjustment);
    }

    private void raiseInterrupted(BudgetAdjustment adjustment, RuntimeException error) {
        log.error(
                "Adjustment commit interrupted, claim released for redelivery: adjustmentId={},"
                        + " campaignId={}, error={}",
                adjustment.getId(),
                adjustment.getCampaignId(),
                error.getMessage(),
                error);
        alertGenerator.raise(
                AlertRequest.builder()
                        .campaignId(adjustment.getCampaignId())
                        .type(AlertType.COMMIT_FAILURE)
                        .severity(AlertSeverity.HIGH)
                        .message(
                                String.format(
                                        "Commit of adjustment %d was interrupted: %s",
                                        adjustment.getId(), error.getMessage()))
                        .recommendedAction(
                                "The commit is redelivered with the same idempotency key; check"
                                        + " the adjustment if it stays APPROVED")
                        .build());
    }

    /** Used when redelivery gave up on the commit message itself */
    public void markFailed(Long adjustmentId, String reason) {
        markFailed(adjustmentId, reason, 0);
    }

    /** Terminal failure: FAILED, approval hold released, HIGH alert */
    public void markFailed(Long adjustmentId, String reason, int attempts) {
        BudgetAdjustment failed =
                transactionTemplate.execute(
                        status -> {
                            BudgetAdjustment adjustment =
                                    adjustmentRepository.findById(adjustmentId).orElse(null);
                            if (adjustment == null || adjustment.getStatus().isTerminal()) {
                                return null;
                            }
                            adjustment.setStatus(AdjustmentStatus.FAILED);
                            adjustment.setFailureReason(reason);
                            adjustment.setCommitAttempts(
                                    Math.max(adjustment.getCommitAttempts(), attempts));
                            adjustmentRepository.saveAndFlush(adjustment);
                            auditTrail.record(
                                    adjustment,
                                    AuditAction.FAILED,
                                    ApprovalGate.SYSTEM_ACTOR,
                                    reason);
                            lifecycleController.onAdjustmentClosed(
                                    adjustment.getCampaignId(),
                                    adjustmentId,
                                    "Adjustment " + adjustmentId + " failed to commit");
                            return adjustment;
                        });
        if (failed == null) {
            return;
        }
        metrics.recordAdjustment(AdjustmentStatus.FAILED);
        log.error(
                "Adjustment commit failed: adjustmentId={}, campaignId={}, attempts={}, reason={}",
                adjustmentId,
                failed.getCampaignId(),
                attempts,
                reason);
        alertGenerator.raise(
                AlertRequest.builder()
                        .campaignId(failed.getCampaignId())
                        .type(AlertType.COMMIT_FAILURE)
                        .severity(AlertSeverity.HIGH)
                        .message(
                                String.format(
                                        "Failed to apply daily budget %s for adjustment %d: %s",
                                        failed.getProposedAmount(), adjustmentId, reason))
                        .recommendedAction(
                                "Check the ad platform connection and apply the budget manually if"
                                        + " needed")
                        .build());
    }

    private void cancel(BudgetAdjustment claimed, String reason) {
        BudgetAdjustment cancelled =
                transactionTemplate.execute(
                        status -> {
                            BudgetAdjustment adjustment =
                                    adjustmentRepository.findById(claimed.getId()).get();
                            adjustment.setStatus(AdjustmentStatus.REJECTED);
                            adjustment.setDecisionNote(reason);
                            adjustment.setDecidedAt(LocalDateTime.now(clock));
                            adjustmentRepository.saveAndFlush(adjustment);
                            auditTrail.record(
                                    adjustment,
                                    AuditAction.CANCELLED,
                                    ApprovalGate.SYSTEM_ACTOR,
                                    reason);
                            lifecycleController.onAdjustmentClosed(
                                    adjustment.getCampaignId(),
                                    adjustment.getId(),
                                    "Adjustment " + adjustment.getId() + " cancelled");
                            return adjustment;
                        });
        metrics.recordAdjustment(AdjustmentStatus.REJECTED);
        log.warn(
                "Adjustment cancelled before commit: adjustmentId={}, campaignId={}, reason={}",
                cancelled.getId(),
                cancelled.getCampaignId(),
                reason);
        alertGenerator.raise(
                AlertRequest.builder()
                        .campaignId(cancelled.getCampaignId())
                        .type(AlertType.ADJUSTMENT_CANCELLED)
                        .severity(AlertSeverity.MEDIUM)
                        .message(
                                String.format(
                                        "Adjustment %d was cancelled before commit: %s",
                                        cancelled.getId(), reason))
                        .recommendedAction("No action needed unless the campaign should be running")
                        .build());
    }
}
