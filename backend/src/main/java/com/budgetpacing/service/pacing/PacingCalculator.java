package com.budgetpacing.service.pacing;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.entity.BudgetStatus;
import com.budgetpacing.exception.InvariantViolationException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Reconciles month-to-date spend with the even-distribution ideal.
 *
 * <p>Deterministic and free of I/O: everything it needs arrives in the {@link PacingInput}, and
 * the thresholds are read once from configuration.
 */
@Component
public class PacingCalculator {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final int MONEY_SCALE = 2;

    /** Days of data after which the projection is fully trusted */
    private static final double FULL_CONFIDENCE_DAYS = 7.0;

    private static final double OVERSPEND_CRITICAL = 1.0;

    private final BigDecimal ratioEpsilon;
    private final double overspendWarning;
    private final double underspendWarning;

    public PacingCalculator(PacingProperties properties) {
        this.ratioEpsilon = BigDecimal.valueOf(properties.getPolicy().getRatioEpsilon());
        this.overspendWarning = properties.getAlerts().getOverspendWarning();
        this.underspendWarning = properties.getAlerts().getUnderspendWarning();
    }

    public PacingResult calculate(PacingInput input) {
        int d = input.dayOfPeriod();
        int days = input.daysInPeriod();
        if (d <= 0 || days <= 0 || d > days) {
            return PacingResult.noop();
        }

        BigDecimal budget = input.monthlyBudget();
        BigDecimal spend = input.spendToDate();
        if (budget == null || budget.signum() < 0) {
            throw new InvariantViolationException(
                    input.campaignId(), "Monthly budget must be non-negative, was " + budget);
        }
        if (spend == null || spend.signum() < 0) {
            throw new InvariantViolationException(
                    input.campaignId(), "Month-to-date spend must be non-negative, was " + spend);
        }

        BigDecimal ideal =
                budget.multiply(BigDecimal.valueOf(d))
                        .divide(BigDecimal.valueOf(days), MC);
        double ratio = spend.divide(ideal.max(ratioEpsilon), MC).doubleValue();

        BigDecimal remaining = budget.subtract(spend);
        int remainingDays = days - d + 1;
        boolean exhausted = remaining.signum() <= 0;
        BigDecimal target =
                exhausted
                        ? BigDecimal.ZERO.setScale(MONEY_SCALE)
                        : remaining.divide(
                                BigDecimal.valueOf(remainingDays),
                                MONEY_SCALE,
                                RoundingMode.DOWN);

        BigDecimal projected = projectSpend(spend, d, days);

        return PacingResult.builder()
                .evaluable(true)
                .monthlyBudget(budget)
                .spendToDate(spend)
                .idealSpendToDate(ideal.setScale(MONEY_SCALE, RoundingMode.HALF_UP))
                .pacingRatio(ratio)
                .remainingBudget(remaining)
                .remainingDays(remainingDays)
                .targetDailySpend(target)
                .exhausted(exhausted)
                .projectedSpend(projected)
                .budgetStatus(classify(budget, spend, projected, d, days, exhausted))
                .confidenceScore(confidence(budget, spend, d, days))
                .build();
    }

    /** Run-rate projection: S + (S/d)(D - d) */
    BigDecimal projectSpend(BigDecimal spend, int d, int days) {
        BigDecimal dailyAverage = spend.divide(BigDecimal.valueOf(d), MC);
        return spend.add(dailyAverage.multiply(BigDecimal.valueOf(days - d)))
                .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    BudgetStatus classify(
            BigDecimal budget,
            BigDecimal spend,
            BigDecimal projected,
            int d,
            int days,
            boolean exhausted) {
        if (exhausted) {
            return BudgetStatus.EXHAUSTED;
        }
        if (projected.compareTo(budget.multiply(BigDecimal.valueOf(OVERSPEND_CRITICAL))) > 0) {
            return BudgetStatus.OVERSPENDING;
        }
        if (projected.compareTo(budget.multiply(BigDecimal.valueOf(overspendWarning))) > 0) {
            return BudgetStatus.AT_RISK;
        }
        double actualShare = spend.divide(budget, MC).doubleValue();
        double expectedShare = (double) d / days;
        if (actualShare < expectedShare * underspendWarning) {
            return BudgetStatus.UNDERSPENDING;
        }
        return BudgetStatus.ON_TRACK;
    }

    /** 0.7 weight on how many days of data exist, 0.3 on how close the run rate is to plan */
    double confidence(BigDecimal budget, BigDecimal spend, int d, int days) {
        double dataConfidence = Math.min(d / FULL_CONFIDENCE_DAYS, 1.0);

        double expectedDaily = budget.doubleValue() / days;
        double consistency;
        if (expectedDaily > 0) {
            double dailyAverage = spend.doubleValue() / d;
            consistency = 1.0 - Math.abs(dailyAverage - expectedDaily) / expectedDaily;
            consistency = Math.max(0.0, Math.min(1.0, consistency));
        } else {
            consistency = 0.5;
        }
        return dataConfidence * 0.7 + consistency * 0.3;
    }
}
