package com.budgetpacing.monitoring;

import com.budgetpacing.entity.AdjustmentStatus;
import com.budgetpacing.entity.AlertType;
import com.budgetpacing.entity.EvaluationOutcome;
import com.budgetpacing.entity.PacingPhase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/** Counters and timers for the monitoring cycle */
@Component
public class PacingMetrics {

    private final MeterRegistry meterRegistry;

    private final Timer evaluationTimer;
    private final Timer cycleTimer;
    private final Timer platformCallTimer;

    public PacingMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.evaluationTimer =
                Timer.builder("pacing.evaluation.duration")
                        .description("Time taken to evaluate one campaign")
                        .register(meterRegistry);

        this.cycleTimer =
                Timer.builder("pacing.cycle.duration")
                        .description("Time taken for a full monitoring cycle")
                        .register(meterRegistry);

        this.platformCallTimer =
                Timer.builder("pacing.platform.call.duration")
                        .description("Time taken for budget-change calls to the ad platform")
                        .register(meterRegistry);
    }

    public void recordEvaluation(EvaluationOutcome outcome) {
        Counter.builder("pacing.evaluations")
                .description("Campaign evaluations by outcome")
                .tag("outcome", outcome.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordAdjustment(AdjustmentStatus status) {
        Counter.builder("pacing.adjustments")
                .description("Budget adjustments by resulting status")
                .tag("status", status.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordAlert(AlertType type) {
        Counter.builder("pacing.alerts")
                .description("Alerts raised by type")
                .tag("type", type.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordTransition(PacingPhase from, PacingPhase to) {
        Counter.builder("pacing.phase.transitions")
                .tag("from", String.valueOf(from))
                .tag("to", to.name())
                .register(meterRegistry)
                .increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordEvaluationTime(Timer.Sample sample) {
        sample.stop(evaluationTimer);
    }

    public void recordCycleTime(Timer.Sample sample) {
        sample.stop(cycleTimer);
    }

    public void recordPlatformCallTime(Timer.Sample sample) {
        sample.stop(platformCallTimer);
    }
}
