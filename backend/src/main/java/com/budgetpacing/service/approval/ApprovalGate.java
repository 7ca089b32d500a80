package com.budgetpacing.service.approval;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.entity.AdjustmentKind;
import com.budgetpacing.entity.AdjustmentStatus;
import com.budgetpacing.entity.AlertSeverity;
import com.budgetpacing.entity.AlertType;
import com.budgetpacing.entity.AuditAction;
import com.budgetpacing.entity.BudgetAdjustment;
import com.budgetpacing.exception.ApprovalTimeoutException;
import com.budgetpacing.exception.IllegalAdjustmentStateException;
import com.budgetpacing.exception.ResourceNotFoundException;
import com.budgetpacing.monitoring.PacingMetrics;
import com.budgetpacing.producer.PacingEventProducer;
import com.budgetpacing.repository.jpa.BudgetAdjustmentRepository;
import com.budgetpacing.service.alert.AlertGenerator;
import com.budgetpacing.service.alert.AlertRequest;
import com.budgetpacing.service.lifecycle.LifecycleController;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Holds high-impact adjustments in PENDING until an operator decides or the expiry window
 * elapses. Approved adjustments leave through the {@code ADJUSTMENTS_READY} event; the gate never
 * calls the platform itself.
 */
@Slf4j
@Service
public class ApprovalGate {

    public static final String SYSTEM_ACTOR = "system";

    private final BudgetAdjustmentRepository adjustmentRepository;
    private final AdjustmentAuditTrail auditTrail;
    private final LifecycleController lifecycleController;
    private final AlertGenerator alertGenerator;
    private final PacingEventProducer eventProducer;
    private final PacingMetrics metrics;
    private final PacingProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public ApprovalGate(
            BudgetAdjustmentRepository adjustmentRepository,
            AdjustmentAuditTrail auditTrail,
            LifecycleController lifecycleController,
            AlertGenerator alertGenerator,
            PacingEventProducer eventProducer,
            PacingMetrics metrics,
            PacingProperties properties,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.adjustmentRepository = adjustmentRepository;
        this.auditTrail = auditTrail;
        this.lifecycleController = lifecycleController;
        this.alertGenerator = alertGenerator;
        this.eventProducer = eventProducer;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /** Parks a new adjustment for operator sign-off */
    @Transactional
    public BudgetAdjustment submit(BudgetAdjustment adjustment) {
        LocalDateTime now = LocalDateTime.now(clock);
        adjustment.setStatus(AdjustmentStatus.PENDING);
        adjustment.setRequiresApproval(true);
        adjustment.setExpiresAt(now.plus(properties.getApproval().getExpiry()));
        BudgetAdjustment saved = adjustmentRepository.saveAndFlush(adjustment);

        auditTrail.record(saved, AuditAction.CREATED, SYSTEM_ACTOR, saved.getReason());
        auditTrail.record(
                saved,
                AuditAction.APPROVAL_REQUESTED,
                SYSTEM_ACTOR,
                "Expires at " + saved.getExpiresAt());
        eventProducer.publishApprovalRequested(saved);
        metrics.recordAdjustment(AdjustmentStatus.PENDING);

        log.info(
                "Adjustment awaiting approval: adjustmentId={}, campaignId={}, previous={},"
                        + " proposed={}, expiresAt={}",
                saved.getId(),
                saved.getCampaignId(),
                saved.getPreviousAmount(),
                saved.getProposedAmount(),
                saved.getExpiresAt());
        return saved;
    }

    /** Adjustments within the automatic limits skip the operator and go straight to commit */
    @Transactional
    public BudgetAdjustment autoApprove(BudgetAdjustment adjustment) {
        LocalDateTime now = LocalDateTime.now(clock);
        adjustment.setStatus(AdjustmentStatus.APPROVED);
        adjustment.setDecidedBy(SYSTEM_ACTOR);
        adjustment.setDecidedAt(now);
        BudgetAdjustment saved = adjustmentRepository.saveAndFlush(adjustment);

        auditTrail.record(saved, AuditAction.CREATED, SYSTEM_ACTOR, saved.getReason());
        auditTrail.record(saved, AuditAction.AUTO_APPROVED, SYSTEM_ACTOR, null);
        eventProducer.publishAdjustmentReady(saved);
        metrics.recordAdjustment(AdjustmentStatus.APPROVED);

        log.info(
                "Adjustment auto-approved: adjustmentId={}, campaignId={}, kind={}, proposed={}",
                saved.getId(),
                saved.getCampaignId(),
                saved.getKind(),
                saved.getProposedAmount());
        return saved;
    }

    @Transactional
    public BudgetAdjustment approve(Long adjustmentId, String actor, String note) {
        BudgetAdjustment adjustment = loadPending(adjustmentId, "approve");
        LocalDateTime now = LocalDateTime.now(clock);
        if (adjustment.isExpired(now)) {
            throw new ApprovalTimeoutException(adjustment.getCampaignId(), adjustmentId);
        }

        adjustment.setStatus(AdjustmentStatus.APPROVED);
        adjustment.setDecidedBy(actor);
        adjustment.setDecidedAt(now);
        adjustment.setDecisionNote(note);
        BudgetAdjustment saved = adjustmentRepository.saveAndFlush(adjustment);

        auditTrail.record(saved, AuditAction.APPROVED, actor, note);
        eventProducer.publishAdjustmentReady(saved);
        metrics.recordAdjustment(AdjustmentStatus.APPROVED);

        log.info(
                "Adjustment approved: adjustmentId={}, campaignId={}, actor={}",
                adjustmentId,
                saved.getCampaignId(),
                actor);
        return saved;
    }

    /** Rejected adjustments close without further action beyond the audit record */
    @Transactional
    public BudgetAdjustment reject(Long adjustmentId, String actor, String note) {
        BudgetAdjustment adjustment = loadPending(adjustmentId, "reject");
        close(adjustment, AuditAction.REJECTED, actor, note);
        lifecycleController.onAdjustmentClosed(
                adjustment.getCampaignId(),
                adjustmentId,
                "Adjustment " + adjustmentId + " rejected");

        log.info(
                "Adjustment rejected: adjustmentId={}, campaignId={}, actor={}",
                adjustmentId,
                adjustment.getCampaignId(),
                actor);
        return adjustment;
    }

    /**
     * Auto-rejects every pending approval whose window has elapsed and raises one HIGH alert per
     * campaign. Each adjustment expires in its own transaction.
     */
    public int expireOverdue() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<BudgetAdjustment> expired = adjustmentRepository.findExpiredPending(now);
        int count = 0;
        for (BudgetAdjustment candidate : expired) {
            try {
                BudgetAdjustment adjustment =
                        transactionTemplate.execute(status -> expire(candidate.getId()));
                if (adjustment == null) {
                    continue;
                }
                count++;
                alertGenerator.raise(
                        AlertRequest.builder()
                                .campaignId(adjustment.getCampaignId())
                                .type(AlertType.APPROVAL_EXPIRED)
                                .severity(AlertSeverity.HIGH)
                                .message(
                                        String.format(
                                                "Adjustment %d (%s -> %s) was not approved within"
                                                        + " %d hours and has been auto-rejected",
                                                adjustment.getId(),
                                                adjustment.getPreviousAmount(),
                                                adjustment.getProposedAmount(),
                                                properties.getApproval().getExpiry().toHours()))
                                .recommendedAction(
                                        "Review pacing; the next cycle will propose a fresh"
                                                + " adjustment if still needed")
                                .build());
            } catch (RuntimeException e) {
                log.error(
                        "Failed to expire adjustment: adjustmentId={}, campaignId={}, error={}",
                        candidate.getId(),
                        candidate.getCampaignId(),
                        e.getMessage(),
                        e);
                alertGenerator.raise(
                        AlertRequest.of(
                                candidate.getCampaignId(),
                                AlertType.EVALUATION_FAILURE,
                                AlertSeverity.HIGH,
                                "Failed to expire adjustment "
                                        + candidate.getId()
                                        + ": "
                                        + e.getMessage()));
            }
        }
        if (count > 0) {
            log.info("Expired {} overdue approvals", count);
        }
        return count;
    }

    private BudgetAdjustment expire(Long adjustmentId) {
        BudgetAdjustment adjustment = adjustmentRepository.findById(adjustmentId).orElse(null);
        // decided in the meantime
        if (adjustment == null || adjustment.getStatus() != AdjustmentStatus.PENDING) {
            return null;
        }
        close(adjustment, AuditAction.EXPIRED, SYSTEM_ACTOR, "Approval window expired");
        lifecycleController.onAdjustmentClosed(
                adjustment.getCampaignId(),
                adjustmentId,
                "Approval for adjustment " + adjustmentId + " expired");
        log.warn(
                "Approval expired: adjustmentId={}, campaignId={}, expiresAt={}",
                adjustmentId,
                adjustment.getCampaignId(),
                adjustment.getExpiresAt());
        return adjustment;
    }

    /**
     * Withdraws every pending approval of a campaign, for example when its budget is exhausted or
     * a new period starts. The caller owns the resulting phase change.
     */
    @Transactional
    public List<BudgetAdjustment> cancelPending(String campaignId, String reason) {
        List<BudgetAdjustment> cancelled = new ArrayList<>();
        for (BudgetAdjustment adjustment :
                adjustmentRepository.findByCampaignIdAndStatus(
                        campaignId, AdjustmentStatus.PENDING)) {
            close(adjustment, AuditAction.CANCELLED, SYSTEM_ACTOR, reason);
            cancelled.add(adjustment);
        }
        if (!cancelled.isEmpty()) {
            log.info(
                    "Cancelled {} pending adjustments: campaignId={}, reason={}",
                    cancelled.size(),
                    campaignId,
                    reason);
        }
        return cancelled;
    }

    /**
     * The exhaustion pause this engine applied, if it is still the latest change on the platform.
     * A campaign in that state is paused by us, not by its owner.
     */
    @Transactional(readOnly = true)
    public Optional<BudgetAdjustment> findOwnPause(String campaignId) {
        return adjustmentRepository
                .findFirstByCampaignIdAndStatusOrderByAppliedAtDesc(
                        campaignId, AdjustmentStatus.APPLIED)
                .filter(latest -> latest.getKind() == AdjustmentKind.EXHAUSTION_PAUSE);
    }

    @Transactional(readOnly = true)
    public boolean isResumeInFlight(String campaignId) {
        return adjustmentRepository.existsByCampaignIdAndKindAndStatus(
                campaignId, AdjustmentKind.RESUME, AdjustmentStatus.APPROVED);
    }

    @Transactional(readOnly = true)
    public List<BudgetAdjustment> listPending() {
        return adjustmentRepository.findByStatusAndRequiresApprovalTrueOrderByCreatedAtAsc(
                AdjustmentStatus.PENDING);
    }

    private void close(BudgetAdjustment adjustment, AuditAction action, String actor, String note) {
        adjustment.setStatus(AdjustmentStatus.REJECTED);
        adjustment.setDecidedBy(actor);
        adjustment.setDecidedAt(LocalDateTime.now(clock));
        adjustment.setDecisionNote(note);
        adjustmentRepository.saveAndFlush(adjustment);
        auditTrail.record(adjustment, action, actor, note);
        metrics.recordAdjustment(AdjustmentStatus.REJECTED);
    }

    private BudgetAdjustment loadPending(Long adjustmentId, String operation) {
        BudgetAdjustment adjustment =
                adjustmentRepository
                        .findById(adjustmentId)
                        .orElseThrow(
                                () ->
                                        new ResourceNotFoundException(
                                                "BudgetAdjustment", adjustmentId));
        if (adjustment.getStatus() != AdjustmentStatus.PENDING) {
            throw new IllegalAdjustmentStateException(
                    adjustment.getCampaignId(), adjustmentId, adjustment.getStatus(), operation);
        }
        return adjustment;
    }
}
