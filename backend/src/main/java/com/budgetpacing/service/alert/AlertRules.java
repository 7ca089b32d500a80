package com.budgetpacing.service.alert;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.entity.AlertSeverity;
import com.budgetpacing.entity.AlertType;
import com.budgetpacing.entity.BudgetStatus;
import com.budgetpacing.service.pacing.PacingResult;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Threshold rules evaluated once per cycle. Every condition either raises its alert type or, when
 * it no longer holds, marks that type for auto-resolution.
 */
@Component
public class AlertRules {

    private final PacingProperties.Alerts thresholds;

    public AlertRules(PacingProperties properties) {
        this.thresholds = properties.getAlerts();
    }

    public AlertDecisions evaluate(CycleSignals signals) {
        List<AlertRequest> raise = new ArrayList<>();
        Set<AlertType> resolve = EnumSet.noneOf(AlertType.class);
        PacingResult pacing = signals.getPacing();
        String campaignId = signals.getCampaignId();

        if (pacing.isExhausted()) {
            raise.add(
                    withFigures(AlertRequest.builder(), pacing)
                            .campaignId(campaignId)
                            .type(AlertType.BUDGET_EXHAUSTED)
                            .severity(AlertSeverity.CRITICAL)
                            .message("Campaign has exhausted its monthly budget")
                            .recommendedAction("Pause campaign or increase budget immediately")
                            .build());
        }

        BudgetStatus status = pacing.getBudgetStatus();
        if (status == BudgetStatus.OVERSPENDING || status == BudgetStatus.AT_RISK) {
            boolean critical = status == BudgetStatus.OVERSPENDING;
            raise.add(
                    withFigures(AlertRequest.builder(), pacing)
                            .campaignId(campaignId)
                            .type(AlertType.PROJECTED_OVERSPEND)
                            .severity(critical ? AlertSeverity.HIGH : AlertSeverity.MEDIUM)
                            .message(
                                    critical
                                            ? "Campaign is overspending"
                                            : "Campaign is at risk of overspending")
                            .recommendedAction(
                                    critical
                                            ? String.format(
                                                    "Reduce daily budget to $%s",
                                                    pacing.getTargetDailySpend().toPlainString())
                                            : "Monitor closely and consider budget adjustment")
                            .build());
        } else if (status != BudgetStatus.EXHAUSTED) {
            resolve.add(AlertType.PROJECTED_OVERSPEND);
        }

        if (status == BudgetStatus.UNDERSPENDING) {
            raise.add(
                    withFigures(AlertRequest.builder(), pacing)
                            .campaignId(campaignId)
                            .type(AlertType.UNDERSPENDING)
                            .severity(AlertSeverity.MEDIUM)
                            .message("Campaign is underspending")
                            .recommendedAction(
                                    String.format(
                                            "Increase daily budget to $%s or adjust targeting",
                                            pacing.getTargetDailySpend().toPlainString()))
                            .build());
        } else {
            resolve.add(AlertType.UNDERSPENDING);
        }

        if (signals.getConsecutiveOutOfBandCycles() > thresholds.getOutOfBandCycles()) {
            raise.add(
                    withFigures(AlertRequest.builder(), pacing)
                            .campaignId(campaignId)
                            .type(AlertType.PACING_OUT_OF_BAND)
                            .severity(AlertSeverity.MEDIUM)
                            .message(
                                    String.format(
                                            "Pacing ratio %.3f outside normal band for %d"
                                                    + " consecutive cycles",
                                            signals.getEffectiveRatio(),
                                            signals.getConsecutiveOutOfBandCycles()))
                            .recommendedAction("Review pacing strategy and recent adjustments")
                            .build());
        } else if (!signals.isOutsideBand()) {
            resolve.add(AlertType.PACING_OUT_OF_BAND);
        }

        Duration zeroSpend = signals.getZeroSpendDuration();
        if (!pacing.isExhausted()
                && zeroSpend != null
                && zeroSpend.compareTo(Duration.ofHours(thresholds.getZeroSpendHours())) > 0) {
            raise.add(
                    withFigures(AlertRequest.builder(), pacing)
                            .campaignId(campaignId)
                            .type(AlertType.ZERO_SPEND)
                            .severity(AlertSeverity.MEDIUM)
                            .message(
                                    String.format(
                                            "No spend recorded for %d hours",
                                            zeroSpend.toHours()))
                            .recommendedAction(
                                    "Check campaign delivery, approvals and targeting on the"
                                            + " platform")
                            .build());
        } else {
            resolve.add(AlertType.ZERO_SPEND);
        }

        return new AlertDecisions(raise, resolve);
    }

    private static AlertRequest.AlertRequestBuilder withFigures(
            AlertRequest.AlertRequestBuilder builder, PacingResult pacing) {
        BigDecimal spend = pacing.getSpendToDate();
        return builder.currentSpend(spend)
                .budgetLimit(pacing.getMonthlyBudget())
                .projectedSpend(pacing.getProjectedSpend());
    }
}
