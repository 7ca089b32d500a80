package com.budgetpacing.service.evaluation;

import com.budgetpacing.client.CampaignRegistryClient;
import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.dto.platform.CampaignInfo;
import com.budgetpacing.dto.platform.CampaignStatus;
import com.budgetpacing.entity.AlertSeverity;
import com.budgetpacing.entity.AlertType;
import com.budgetpacing.entity.BudgetAdjustment;
import com.budgetpacing.entity.BudgetPlan;
import com.budgetpacing.entity.EvaluationOutcome;
import com.budgetpacing.entity.PacingEvaluation;
import com.budgetpacing.entity.PacingPhase;
import com.budgetpacing.entity.PacingState;
import com.budgetpacing.entity.SpendSnapshot;
import com.budgetpacing.exception.AdPlatformException;
import com.budgetpacing.exception.ConcurrentStateModificationException;
import com.budgetpacing.exception.InvariantViolationException;
import com.budgetpacing.exception.PacingException;
import com.budgetpacing.exception.StaleDataException;
import com.budgetpacing.exception.TransientIngestionException;
import com.budgetpacing.monitoring.PacingMetrics;
import com.budgetpacing.repository.jpa.PacingEvaluationRepository;
import com.budgetpacing.service.alert.AlertGenerator;
import com.budgetpacing.service.alert.AlertRequest;
import com.budgetpacing.service.alert.CycleSignals;
import com.budgetpacing.service.approval.ApprovalGate;
import com.budgetpacing.service.ingestion.SpendIngestionAdapter;
import com.budgetpacing.service.lifecycle.EvaluationUpdate;
import com.budgetpacing.service.lifecycle.LifecycleController;
import com.budgetpacing.service.lock.CampaignLeaseService;
import com.budgetpacing.service.pacing.PacingCalculator;
import com.budgetpacing.service.pacing.PacingInput;
import com.budgetpacing.service.pacing.PacingResult;
import com.budgetpacing.service.plan.BudgetPlanService;
import com.budgetpacing.service.policy.AdjustmentPolicyEngine;
import com.budgetpacing.service.policy.PolicyDecision;
import com.budgetpacing.service.policy.PolicyInput;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * One monitoring cycle for one campaign: ingest, calculate, decide, persist, alert.
 *
 * <p>The cycle runs under the campaign's lease, so evaluations of the same campaign never overlap,
 * and each cycle is keyed by its evaluation bucket (evaluation time divided by the monitoring
 * interval). A bucket that already has an evaluation is not evaluated again, which makes replays
 * of the same cycle harmless. The adjustment, the phase change and the evaluation record commit
 * together; the next cycle starts only after that commit.
 *
 * <p>Failures stay inside the campaign: every exception is mapped to an outcome and an alert.
 */
@Slf4j
@Service
public class CampaignEvaluationService {

    private final CampaignLeaseService leaseService;
    private final BudgetPlanService planService;
    private final LifecycleController lifecycleController;
    private final CampaignRegistryClient registryClient;
    private final SpendIngestionAdapter spendIngestion;
    private final PacingCalculator pacingCalculator;
    private final AdjustmentPolicyEngine policyEngine;
    private final ApprovalGate approvalGate;
    private final AlertGenerator alertGenerator;
    private final PacingEvaluationRepository evaluationRepository;
    private final PacingMetrics metrics;
    private final PacingProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public CampaignEvaluationService(
            CampaignLeaseService leaseService,
            BudgetPlanService planService,
            LifecycleController lifecycleController,
            CampaignRegistryClient registryClient,
            SpendIngestionAdapter spendIngestion,
            PacingCalculator pacingCalculator,
            AdjustmentPolicyEngine policyEngine,
            ApprovalGate approvalGate,
            AlertGenerator alertGenerator,
            PacingEvaluationRepository evaluationRepository,
            PacingMetrics metrics,
            PacingProperties properties,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.leaseService = leaseService;
        this.planService = planService;
        this.lifecycleController = lifecycleController;
        this.registryClient = registryClient;
        this.spendIngestion = spendIngestion;
        this.pacingCalculator = pacingCalculator;
        this.policyEngine = policyEngine;
        this.approvalGate = approvalGate;
        this.alertGenerator = alertGenerator;
        this.evaluationRepository = evaluationRepository;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public EvaluationOutcome evaluate(String campaignId) {
        LocalDateTime now = LocalDateTime.now(clock);
        long bucket = evaluationBucket(now);

        Optional<String> lease =
                leaseService.tryAcquire(campaignId, properties.getMonitoring().leaseTtl());
        if (lease.isEmpty()) {
            log.info("Evaluation already in flight, skipping: campaignId={}", campaignId);
            metrics.recordEvaluation(EvaluationOutcome.LEASE_HELD);
            return EvaluationOutcome.LEASE_HELD;
        }

        Timer.Sample sample = metrics.startTimer();
        EvaluationOutcome outcome;
        try {
            outcome = runCycle(campaignId, bucket, now);
        } catch (StaleDataException e) {
            outcome = onStaleData(e);
        } catch (InvariantViolationException e) {
            outcome = onInvariantViolation(campaignId, e);
        } catch (TransientIngestionException e) {
            log.warn(
                    "Spend ingestion failed, retrying next cycle: campaignId={}, error={}",
                    campaignId,
                    e.getMessage());
            alertGenerator.raise(
                    AlertRequest.builder()
                            .campaignId(campaignId)
                            .type(AlertType.INGESTION_FAILURE)
                            .severity(AlertSeverity.MEDIUM)
                            .message("Spend data could not be fetched: " + e.getMessage())
                            .recommendedAction("Check the spend feed; the next cycle will retry")
                            .build());
            outcome = EvaluationOutcome.INGESTION_FAILED;
        } catch (ConcurrentStateModificationException
                | ObjectOptimisticLockingFailureException e) {
            log.warn(
                    "Pacing state changed during evaluation: campaignId={}, error={}",
                    campaignId,
                    e.getMessage());
            alertGenerator.raise(
                    AlertRequest.of(
                            campaignId,
                            AlertType.CONCURRENT_MODIFICATION,
                            AlertSeverity.MEDIUM,
                            "Evaluation discarded because the pacing state was modified"
                                    + " concurrently: "
                                    + e.getMessage()));
            outcome = EvaluationOutcome.CONFLICT;
        } catch (DataIntegrityViolationException e) {
            log.info(
                    "Evaluation bucket already taken: campaignId={}, bucket={}",
                    campaignId,
                    bucket);
            outcome = EvaluationOutcome.DUPLICATE;
        } catch (RuntimeException e) {
            log.error(
                    "Evaluation failed: campaignId={}, error={}", campaignId, e.getMessage(), e);
            alertGenerator.raise(
                    AlertRequest.of(
                            campaignId,
                            AlertType.EVALUATION_FAILURE,
                            AlertSeverity.HIGH,
                            "Evaluation failed: " + e.getMessage()));
            outcome = EvaluationOutcome.FAILED;
        } finally {
            leaseService.release(campaignId, lease.get());
            metrics.recordEvaluationTime(sample);
        }
        metrics.recordEvaluation(outcome);
        return outcome;
    }

    private EvaluationOutcome runCycle(String campaignId, long bucket, LocalDateTime now) {
        if (evaluationRepository.existsByCampaignIdAndEvaluationBucket(campaignId, bucket)) {
            log.debug("Cycle already evaluated: campaignId={}, bucket={}", campaignId, bucket);
            return EvaluationOutcome.DUPLICATE;
        }

        LocalDate today = now.toLocalDate();
        Optional<BudgetPlan> resolved = planService.resolvePlan(campaignId, today);
        if (resolved.isEmpty()) {
            log.warn("No budget plan covers today: campaignId={}, date={}", campaignId, today);
            alertGenerator.raise(
                    AlertRequest.builder()
                            .campaignId(campaignId)
                            .type(AlertType.MISSING_PLAN)
                            .severity(AlertSeverity.MEDIUM)
                            .message("No budget plan covers " + today)
                            .recommendedAction("Create a budget plan for the current period")
                            .build());
            return EvaluationOutcome.NO_PLAN;
        }
        BudgetPlan plan = resolved.get();
        if (!plan.isWellFormed()) {
            throw new InvariantViolationException(campaignId, "Malformed budget plan: " + plan);
        }

        PacingState state = lifecycleController.loadOrInitialize(campaignId, plan);
        if (Objects.equals(state.getLastEvaluationBucket(), bucket)) {
            return EvaluationOutcome.DUPLICATE;
        }
        if (state.getPhase().isDormant()) {
            log.debug(
                    "Campaign dormant until next period: campaignId={}, phase={}",
                    campaignId,
                    state.getPhase());
            return EvaluationOutcome.INACTIVE;
        }

        if (!isRunningOnPlatform(campaignId)) {
            return onExternallyPaused(campaignId);
        }

        SpendSnapshot snapshot = freshSnapshot(state, plan, now);
        PacingResult pacing =
                pacingCalculator.calculate(
                        new PacingInput(
                                campaignId,
                                plan.getMonthlyBudget(),
                                snapshot.getCumulativeSpendMonthToDate(),
                                plan.dayOfPeriod(today),
                                plan.daysInPeriod()));
        if (!pacing.isEvaluable()) {
            log.warn("Calendar position not evaluable: campaignId={}, date={}", campaignId, today);
            return EvaluationOutcome.NO_OP;
        }

        PolicyDecision decision =
                policyEngine.decide(
                        PolicyInput.builder()
                                .campaignId(campaignId)
                                .strategy(plan.getStrategy())
                                .phase(state.getPhase())
                                .pacingRatio(pacing.getPacingRatio())
                                .ratioHistory(ratioHistory(campaignId, plan))
                                .currentDailyBudget(state.getLastAppliedBudget())
                                .baselineDailyBudget(plan.baselineDailyBudget())
                                .targetDailySpend(pacing.getTargetDailySpend())
                                .exhausted(pacing.isExhausted())
                                .dayOfPeriod(plan.dayOfPeriod(today))
                                .daysInPeriod(plan.daysInPeriod())
                                .build());

        if (Thread.currentThread().isInterrupted()) {
            throw new PacingException(
                    "EVALUATION_TIMEOUT",
                    campaignId,
                    "Evaluation abandoned after exceeding its time limit; nothing was recorded");
        }
        PacingPhase phaseBefore = state.getPhase();
        PacingState after =
                transactionTemplate.execute(
                        status -> persistCycle(state, plan, bucket, now, pacing, decision));

        log.info(
                "Campaign evaluated: campaignId={}, ratio={}, effectiveRatio={}, status={},"
                        + " phase={}->{}, proposal={}",
                campaignId,
                String.format("%.3f", pacing.getPacingRatio()),
                String.format("%.3f", decision.getEffectiveRatio()),
                pacing.getBudgetStatus(),
                phaseBefore,
                after.getPhase(),
                decision.hasProposal() ? decision.getKind() : "none");

        alertGenerator.resolveOpen(
                campaignId,
                EnumSet.of(
                        AlertType.STALE_DATA,
                        AlertType.INGESTION_FAILURE,
                        AlertType.MISSING_PLAN,
                        AlertType.EVALUATION_FAILURE),
                "auto");
        alertGenerator.applyCycle(
                CycleSignals.builder()
                        .campaignId(campaignId)
                        .pacing(pacing)
                        .effectiveRatio(decision.getEffectiveRatio())
                        .outsideBand(decision.getBand().isOutside())
                        .consecutiveOutOfBandCycles(after.getConsecutiveOutOfBandCycles())
                        .zeroSpendDuration(
                                spendIngestion.zeroSpendDuration(
                                        campaignId, snapshot, plan.getPeriodStart().atStartOfDay()))
                        .build());
        return EvaluationOutcome.EVALUATED;
    }

    private PacingState persistCycle(
            PacingState state,
            BudgetPlan plan,
            long bucket,
            LocalDateTime now,
            PacingResult pacing,
            PolicyDecision decision) {
        String campaignId = state.getCampaignId();
        PacingPhase phaseBefore = state.getPhase();
        BudgetAdjustment adjustment = null;
        Long blockingAdjustmentId = null;

        if (decision.hasProposal()) {
            BudgetAdjustment proposal =
                    BudgetAdjustment.builder()
                            .campaignId(campaignId)
                            .planId(plan.getId())
                            .evaluationBucket(bucket)
                            .kind(decision.getKind())
                            .previousAmount(decision.getPreviousAmount())
                            .proposedAmount(decision.getProposedAmount())
                            .pacingRatio(decision.getEffectiveRatio())
                            .reason(decision.getReason())
                            .requiresApproval(decision.isRequiresApproval())
                            .createdAt(now)
                            .build();
            if (pacing.isExhausted()) {
                approvalGate.cancelPending(campaignId, "Monthly budget exhausted");
                adjustment = approvalGate.autoApprove(proposal);
            } else if (decision.isRequiresApproval()) {
                adjustment = approvalGate.submit(proposal);
                blockingAdjustmentId = adjustment.getId();
            } else {
                adjustment = approvalGate.autoApprove(proposal);
            }
        }

        PacingState after =
                lifecycleController.finalizeEvaluation(
                        state,
                        EvaluationUpdate.builder()
                                .evaluationBucket(bucket)
                                .evaluatedAt(now)
                                .planId(plan.getId())
                                .pacingRatio(pacing.getPacingRatio())
                                .targetDailySpend(pacing.getTargetDailySpend())
                                .outsideBand(decision.getBand().isOutside())
                                .exhausted(pacing.isExhausted())
                                .blockingAdjustmentId(blockingAdjustmentId)
                                .build());

        evaluationRepository.saveAndFlush(
                PacingEvaluation.builder()
                        .campaignId(campaignId)
                        .planId(plan.getId())
                        .evaluationBucket(bucket)
                        .evaluatedAt(now)
                        .outcome(EvaluationOutcome.EVALUATED)
                        .pacingRatio(pacing.getPacingRatio())
                        .smoothedRatio(decision.getEffectiveRatio())
                        .cumulativeSpend(pacing.getSpendToDate())
                        .targetDailySpend(pacing.getTargetDailySpend())
                        .projectedSpend(pacing.getProjectedSpend())
                        .budgetStatus(pacing.getBudgetStatus())
                        .phaseBefore(phaseBefore)
                        .phaseAfter(after.getPhase())
                        .adjustmentId(adjustment != null ? adjustment.getId() : null)
                        .detail(truncate(decision.getReason()))
                        .build());
        return after;
    }

    private boolean isRunningOnPlatform(String campaignId) {
        Optional<CampaignInfo> campaign;
        try {
            campaign = registryClient.getCampaign(campaignId);
        } catch (AdPlatformException e) {
            throw new TransientIngestionException(
                    campaignId, "Campaign registry unavailable: " + e.getMessage(), e);
        }
        if (campaign.isEmpty()) {
            return false;
        }
        if (campaign.get().isRunning()) {
            return true;
        }
        // our own exhaustion pause, lifted by the resume queued at the start of the period
        if (campaign.get().getStatus() == CampaignStatus.PAUSED
                && approvalGate.findOwnPause(campaignId).isPresent()) {
            log.info(
                    "Campaign still paused from budget exhaustion, resume pending: campaignId={}",
                    campaignId);
            return true;
        }
        return false;
    }

    private EvaluationOutcome onExternallyPaused(String campaignId) {
        List<BudgetAdjustment> cancelled =
                transactionTemplate.execute(
                        status -> {
                            lifecycleController.markExternallyPaused(
                                    campaignId, "Campaign paused or removed on the platform");
                            return approvalGate.cancelPending(
                                    campaignId, "Campaign paused on the platform");
                        });
        log.info("Campaign externally paused: campaignId={}", campaignId);
        if (cancelled != null && !cancelled.isEmpty()) {
            alertGenerator.raise(
                    AlertRequest.of(
                            campaignId,
                            AlertType.ADJUSTMENT_CANCELLED,
                            AlertSeverity.MEDIUM,
                            String.format(
                                    "%d pending adjustment(s) withdrawn because the campaign was"
                                            + " paused on the platform",
                                    cancelled.size())));
        }
        return EvaluationOutcome.EXTERNALLY_PAUSED;
    }

    /**
     * Latest snapshot of the current period, rejected when too old or too uncertain. The age
     * carried by the rejection is how long the campaign has gone unpaced, so a feed that keeps
     * delivering fresh but unusable snapshots still ends up alerting.
     */
    private SpendSnapshot freshSnapshot(PacingState state, BudgetPlan plan, LocalDateTime now) {
        String campaignId = state.getCampaignId();
        Optional<SpendSnapshot> latest = spendIngestion.pull(campaignId);
        LocalDateTime periodStart = plan.getPeriodStart().atStartOfDay();
        if (latest.isEmpty() || latest.get().getCapturedAt().isBefore(periodStart)) {
            throw new StaleDataException(
                    campaignId,
                    Duration.between(periodStart, now),
                    "No spend snapshot for the current period");
        }
        SpendSnapshot snapshot = latest.get();
        Duration age = Duration.between(snapshot.getCapturedAt(), now);
        Duration unpaced = Duration.between(lastPacedAt(state, periodStart), now);
        Duration reported = age.compareTo(unpaced) >= 0 ? age : unpaced;
        PacingProperties.Monitoring monitoring = properties.getMonitoring();
        if (age.compareTo(monitoring.getMaxSnapshotAge()) > 0) {
            throw new StaleDataException(
                    campaignId,
                    reported,
                    "Latest spend snapshot is " + age.toMinutes() + " minutes old");
        }
        if (snapshot.getSourceConfidence() < monitoring.getMinSourceConfidence()) {
            throw new StaleDataException(
                    campaignId,
                    reported,
                    String.format(
                            "Latest spend snapshot confidence %.2f below %.2f; not evaluated for"
                                    + " %d minutes",
                            snapshot.getSourceConfidence(),
                            monitoring.getMinSourceConfidence(),
                            unpaced.toMinutes()));
        }
        return snapshot;
    }

    /** Last successful evaluation in this period, else when pacing of the campaign began */
    private static LocalDateTime lastPacedAt(PacingState state, LocalDateTime periodStart) {
        LocalDateTime reference =
                state.getLastEvaluatedAt() != null
                        ? state.getLastEvaluatedAt()
                        : state.getUpdatedAt();
        if (reference == null || reference.isBefore(periodStart)) {
            return periodStart;
        }
        return reference;
    }

    /** Skips the cycle; only data stale for more than two cycles is worth an alert */
    private EvaluationOutcome onStaleData(StaleDataException e) {
        Duration alertAfter = properties.getMonitoring().getInterval().multipliedBy(2);
        log.warn(
                "Skipping evaluation on stale data: campaignId={}, age={}, reason={}",
                e.getCampaignId(),
                e.getAge(),
                e.getMessage());
        if (e.getAge() != null && e.getAge().compareTo(alertAfter) > 0) {
            alertGenerator.raise(
                    AlertRequest.builder()
                            .campaignId(e.getCampaignId())
                            .type(AlertType.STALE_DATA)
                            .severity(AlertSeverity.MEDIUM)
                            .message(e.getMessage())
                            .recommendedAction(
                                    "Check the spend feed; pacing is suspended until fresh data"
                                            + " arrives")
                            .build());
        }
        return EvaluationOutcome.STALE_DATA;
    }

    private EvaluationOutcome onInvariantViolation(
            String campaignId, InvariantViolationException e) {
        log.error("Invariant violated: campaignId={}, error={}", campaignId, e.getMessage());
        try {
            lifecycleController.forceReview(campaignId, e.getMessage());
        } catch (RuntimeException reviewFailure) {
            log.error(
                    "Could not force manual review: campaignId={}, error={}",
                    campaignId,
                    reviewFailure.getMessage(),
                    reviewFailure);
        }
        alertGenerator.raise(
                AlertRequest.builder()
                        .campaignId(campaignId)
                        .type(AlertType.INVARIANT_VIOLATION)
                        .severity(AlertSeverity.CRITICAL)
                        .message(e.getMessage())
                        .recommendedAction(
                                "Fix the budget plan or spend data, then override the phase")
                        .build());
        return EvaluationOutcome.INVARIANT_VIOLATION;
    }

    /** Earlier evaluated ratios of the same plan, newest first */
    private List<Double> ratioHistory(String campaignId, BudgetPlan plan) {
        int window = properties.getPolicy().getAdaptiveWindow();
        return evaluationRepository
                .findByCampaignIdAndOutcomeOrderByEvaluationBucketDesc(
                        campaignId, EvaluationOutcome.EVALUATED, PageRequest.of(0, window))
                .stream()
                .filter(e -> Objects.equals(e.getPlanId(), plan.getId()))
                .map(PacingEvaluation::getPacingRatio)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    long evaluationBucket(LocalDateTime at) {
        long interval = properties.getMonitoring().getInterval().getSeconds();
        return Math.floorDiv(at.toEpochSecond(ZoneOffset.UTC), interval);
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= 500) {
            return detail;
        }
        return detail.substring(0, 500);
    }
}
