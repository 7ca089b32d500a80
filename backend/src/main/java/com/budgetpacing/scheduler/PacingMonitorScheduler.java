package com.budgetpacing.scheduler;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.entity.AlertSeverity;
import com.budgetpacing.entity.AlertType;
import com.budgetpacing.entity.BudgetPlan;
import com.budgetpacing.entity.EvaluationOutcome;
import com.budgetpacing.monitoring.PacingMetrics;
import com.budgetpacing.repository.jpa.BudgetPlanRepository;
import com.budgetpacing.service.alert.AlertGenerator;
import com.budgetpacing.service.alert.AlertRequest;
import com.budgetpacing.service.evaluation.CampaignEvaluationService;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Monitoring cycle trigger. Fans out one independent evaluation per campaign with a current plan;
 * a campaign that fails or times out is reported through an alert and never affects the others.
 */
@Slf4j
@Component
@ConditionalOnProperty(
        name = "app.pacing.monitoring.enabled",
        havingValue = "true",
        matchIfMissing = true)
public class PacingMonitorScheduler {

    private final BudgetPlanRepository planRepository;
    private final CampaignEvaluationService evaluationService;
    private final AlertGenerator alertGenerator;
    private final PacingMetrics metrics;
    private final PacingProperties properties;
    private final ExecutorService evaluationExecutor;
    private final ScheduledExecutorService watchdog;

    public PacingMonitorScheduler(
            BudgetPlanRepository planRepository,
            CampaignEvaluationService evaluationService,
            AlertGenerator alertGenerator,
            PacingMetrics metrics,
            PacingProperties properties) {
        this.planRepository = planRepository;
        this.evaluationService = evaluationService;
        this.alertGenerator = alertGenerator;
        this.metrics = metrics;
        this.properties = properties;
        AtomicInteger threadCount = new AtomicInteger();
        this.evaluationExecutor =
                Executors.newFixedThreadPool(
                        properties.getMonitoring().getWorkerThreads(),
                        r -> {
                            Thread t =
                                    new Thread(
                                            r, "pacing-evaluator-" + threadCount.incrementAndGet());
                            t.setDaemon(true);
                            return t;
                        });
        this.watchdog =
                Executors.newSingleThreadScheduledExecutor(
                        r -> {
                            Thread t = new Thread(r, "pacing-evaluation-watchdog");
                            t.setDaemon(true);
                            return t;
                        });
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down pacing evaluation executor");
        watchdog.shutdownNow();
        evaluationExecutor.shutdown();
        try {
            if (!evaluationExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Evaluation executor did not terminate in 30 seconds, forcing shutdown");
                evaluationExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            evaluationExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Scheduled(
            fixedRateString = "${app.pacing.monitoring.interval:PT2H}",
            initialDelayString = "${app.pacing.monitoring.initial-delay:PT1M}")
    public void runMonitoringCycle() {
        try {
            runCycle();
        } catch (Exception e) {
            log.error("Monitoring cycle aborted: {}", e.getMessage(), e);
        }
    }

    /** Evaluates every campaign once and waits for all of them; returns the outcome counts */
    public Map<EvaluationOutcome, Integer> runCycle() {
        Timer.Sample sample = metrics.startTimer();
        List<String> campaignIds =
                planRepository.findByCurrentTrue().stream()
                        .map(BudgetPlan::getCampaignId)
                        .distinct()
                        .collect(Collectors.toList());
        log.info("Starting monitoring cycle for {} campaigns", campaignIds.size());

        Duration limit = properties.getMonitoring().getMaxEvaluationDuration();
        List<CompletableFuture<EvaluationOutcome>> futures =
                campaignIds.stream()
                        .map(campaignId -> submit(campaignId, limit))
                        .collect(Collectors.toList());

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<EvaluationOutcome, Integer> outcomes = new EnumMap<>(EvaluationOutcome.class);
        futures.forEach(f -> outcomes.merge(f.join(), 1, Integer::sum));
        metrics.recordCycleTime(sample);
        log.info(
                "Monitoring cycle finished: campaigns={}, outcomes={}",
                campaignIds.size(),
                outcomes);
        return outcomes;
    }

    private CompletableFuture<EvaluationOutcome> submit(String campaignId, Duration limit) {
        EvaluationTask task = new EvaluationTask(campaignId, limit);
        try {
            evaluationExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            task.result.completeExceptionally(e);
        }
        return task.result.exceptionally(e -> onFailure(campaignId, e));
    }

    private EvaluationOutcome onFailure(String campaignId, Throwable error) {
        Throwable cause =
                error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
        String message =
                cause instanceof TimeoutException
                        ? "Evaluation did not finish within "
                                + properties.getMonitoring().getMaxEvaluationDuration()
                        : "Evaluation failed: " + cause.getMessage();
        log.error(
                "Campaign evaluation failed: campaignId={}, error={}", campaignId, message, cause);
        try {
            alertGenerator.raise(
                    AlertRequest.of(
                            campaignId, AlertType.EVALUATION_FAILURE, AlertSeverity.HIGH, message));
        } catch (RuntimeException alertFailure) {
            log.error(
                    "Could not raise evaluation failure alert: campaignId={}, error={}",
                    campaignId,
                    alertFailure.getMessage());
        }
        metrics.recordEvaluation(EvaluationOutcome.FAILED);
        return EvaluationOutcome.FAILED;
    }

    /**
     * One campaign's evaluation. The time limit starts when a worker picks the task up; when it
     * runs out the result fails with a timeout and the worker is interrupted so it stops before
     * recording anything.
     */
    private final class EvaluationTask implements Runnable {

        private final String campaignId;
        private final Duration limit;
        private final CompletableFuture<EvaluationOutcome> result = new CompletableFuture<>();
        private final Object guard = new Object();
        private boolean finished;

        private EvaluationTask(String campaignId, Duration limit) {
            this.campaignId = campaignId;
            this.limit = limit;
        }

        @Override
        public void run() {
            Thread worker = Thread.currentThread();
            ScheduledFuture<?> deadline =
                    watchdog.schedule(
                            () -> expire(worker), limit.toMillis(), TimeUnit.MILLISECONDS);
            try {
                result.complete(evaluationService.evaluate(campaignId));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            } finally {
                synchronized (guard) {
                    finished = true;
                }
                deadline.cancel(false);
                // an expiry that raced the end of the evaluation must not leak into the next task
                Thread.interrupted();
            }
        }

        private void expire(Thread worker) {
            synchronized (guard) {
                if (finished) {
                    return;
                }
                TimeoutException timeout =
                        new TimeoutException("Evaluation of " + campaignId + " exceeded " + limit);
                if (result.completeExceptionally(timeout)) {
                    log.warn(
                            "Evaluation timed out, interrupting worker: campaignId={}, worker={}",
                            campaignId,
                            worker.getName());
                    worker.interrupt();
                }
            }
        }
    }
}
