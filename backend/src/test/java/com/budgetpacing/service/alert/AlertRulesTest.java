package com.budgetpacing.service.alert;

import static org.junit.jupiter.api.Assertions.*;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.entity.AlertSeverity;
import com.budgetpacing.entity.AlertType;
import com.budgetpacing.entity.BudgetStatus;
import com.budgetpacing.service.pacing.PacingResult;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AlertRulesTest {

    private AlertRules rules;

    @BeforeEach
    void setUp() {
        rules = new AlertRules(new PacingProperties());
    }

    private static PacingResult pacing(BudgetStatus status, boolean exhausted) {
        return PacingResult.builder()
                .evaluable(true)
                .monthlyBudget(new BigDecimal("3000.00"))
                .spendToDate(new BigDecimal("1800.00"))
                .projectedSpend(new BigDecimal("5400.00"))
                .targetDailySpend(new BigDecimal("57.14"))
                .budgetStatus(status)
                .exhausted(exhausted)
                .build();
    }

    private static CycleSignals.CycleSignalsBuilder signals(PacingResult pacing) {
        return CycleSignals.builder().campaignId("camp-1").pacing(pacing).effectiveRatio(1.0);
    }

    private static Optional<AlertRequest> find(AlertDecisions decisions, AlertType type) {
        return decisions.toRaise().stream().filter(r -> r.getType() == type).findFirst();
    }

    @Test
    void evaluate_Overspending_RaisesHighProjectedOverspendWithTarget() {
        AlertDecisions decisions =
                rules.evaluate(signals(pacing(BudgetStatus.OVERSPENDING, false)).build());

        AlertRequest alert = find(decisions, AlertType.PROJECTED_OVERSPEND).orElseThrow();
        assertEquals(AlertSeverity.HIGH, alert.getSeverity());
        assertEquals("Reduce daily budget to $57.14", alert.getRecommendedAction());
        assertEquals(0, new BigDecimal("5400.00").compareTo(alert.getProjectedSpend()));
        assertTrue(decisions.toResolve().contains(AlertType.UNDERSPENDING));
    }

    @Test
    void evaluate_AtRisk_RaisesMediumProjectedOverspend() {
        AlertDecisions decisions =
                rules.evaluate(signals(pacing(BudgetStatus.AT_RISK, false)).build());

        assertEquals(
                AlertSeverity.MEDIUM,
                find(decisions, AlertType.PROJECTED_OVERSPEND).orElseThrow().getSeverity());
    }

    @Test
    void evaluate_Exhausted_RaisesCriticalAndSuppressesZeroSpend() {
        AlertDecisions decisions =
                rules.evaluate(
                        signals(pacing(BudgetStatus.EXHAUSTED, true))
                                .zeroSpendDuration(Duration.ofHours(12))
                                .build());

        assertEquals(
                AlertSeverity.CRITICAL,
                find(decisions, AlertType.BUDGET_EXHAUSTED).orElseThrow().getSeverity());
        assertTrue(find(decisions, AlertType.ZERO_SPEND).isEmpty());
        assertFalse(decisions.toResolve().contains(AlertType.PROJECTED_OVERSPEND));
    }

    @Test
    void evaluate_OnTrack_ResolvesClearedConditions() {
        AlertDecisions decisions =
                rules.evaluate(signals(pacing(BudgetStatus.ON_TRACK, false)).build());

        assertTrue(decisions.toRaise().isEmpty());
        assertTrue(decisions.toResolve().contains(AlertType.PROJECTED_OVERSPEND));
        assertTrue(decisions.toResolve().contains(AlertType.UNDERSPENDING));
        assertTrue(decisions.toResolve().contains(AlertType.PACING_OUT_OF_BAND));
        assertTrue(decisions.toResolve().contains(AlertType.ZERO_SPEND));
    }

    @Test
    void evaluate_OutOfBandLongerThanThreshold_RaisesPacingAlert() {
        PacingResult onTrack = pacing(BudgetStatus.ON_TRACK, false);

        AlertDecisions atThreshold =
                rules.evaluate(
                        signals(onTrack).outsideBand(true).consecutiveOutOfBandCycles(3).build());
        AlertDecisions beyond =
                rules.evaluate(
                        signals(onTrack).outsideBand(true).consecutiveOutOfBandCycles(4).build());

        assertTrue(find(atThreshold, AlertType.PACING_OUT_OF_BAND).isEmpty());
        assertFalse(atThreshold.toResolve().contains(AlertType.PACING_OUT_OF_BAND));
        assertTrue(find(beyond, AlertType.PACING_OUT_OF_BAND).isPresent());
    }

    @Test
    void evaluate_NoSpendForSevenHours_RaisesZeroSpend() {
        AlertDecisions decisions =
                rules.evaluate(
                        signals(pacing(BudgetStatus.UNDERSPENDING, false))
                                .zeroSpendDuration(Duration.ofHours(7))
                                .build());

        assertTrue(find(decisions, AlertType.ZERO_SPEND).isPresent());
        assertTrue(find(decisions, AlertType.UNDERSPENDING).isPresent());
    }
}
