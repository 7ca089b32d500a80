package com.budgetpacing.service.policy;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.entity.AdjustmentKind;
import com.budgetpacing.entity.PacingPhase;
import com.budgetpacing.entity.PacingStrategy;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns a pacing ratio into a bounded daily-budget proposal.
 *
 * <p>Decision table, applied to the strategy's effective ratio:
 *
 * <ul>
 *   <li>below the band: increase by the deficit, at most {@code stepCap}
 *   <li>inside the band: nothing
 *   <li>above the band: decrease by the excess, at most {@code stepCap}
 *   <li>above the emergency ratio: reduce straight to the run-rate-neutral budget, ignoring the
 *       step cap, and always require approval
 * </ul>
 *
 * Pure: callers supply history and current budget, the engine never reads state.
 */
@Component
public class AdjustmentPolicyEngine {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final int MONEY_SCALE = 2;

    private final PacingProperties.Policy policy;

    public AdjustmentPolicyEngine(PacingProperties properties) {
        this.policy = properties.getPolicy();
    }

    public PolicyDecision decide(PolicyInput input) {
        double effectiveRatio = effectiveRatio(input);
        double lowerBound = lowerBound(input);
        PacingBand band = classify(effectiveRatio, lowerBound);
        BigDecimal current = currentBudget(input);

        PolicyDecision.PolicyDecisionBuilder decision =
                PolicyDecision.builder()
                        .effectiveRatio(effectiveRatio)
                        .lowerBound(lowerBound)
                        .band(band)
                        .previousAmount(current);

        if (input.getPhase() != null && input.getPhase().isDormant()) {
            return decision.build();
        }

        if (input.isExhausted()) {
            return decision.kind(AdjustmentKind.EXHAUSTION_PAUSE)
                    .proposedAmount(BigDecimal.ZERO.setScale(MONEY_SCALE))
                    .requiresApproval(false)
                    .reason("Monthly budget exhausted; pausing campaign")
                    .build();
        }

        // auto-adjustments stay suspended until the blocking approval is resolved
        if (input.getPhase() == PacingPhase.AWAITING_APPROVAL) {
            return decision.build();
        }

        if (effectiveRatio > policy.getEmergencyRatio()) {
            return emergency(decision, input, current, effectiveRatio);
        }

        if (band == PacingBand.NORMAL || current.signum() <= 0) {
            return decision.build();
        }

        double fraction;
        BigDecimal proposed;
        AdjustmentKind kind;
        if (band == PacingBand.BELOW) {
            fraction = Math.min(1.0 - effectiveRatio, policy.getStepCap());
            proposed = scale(current, 1.0 + fraction, RoundingMode.FLOOR);
            kind = AdjustmentKind.INCREASE;
        } else {
            fraction = Math.min(effectiveRatio - 1.0, policy.getStepCap());
            proposed = scale(current, 1.0 - fraction, RoundingMode.CEILING);
            kind = AdjustmentKind.DECREASE;
        }
        if (proposed.compareTo(current) == 0) {
            return decision.build();
        }

        return decision.kind(kind)
                .proposedAmount(proposed)
                .requiresApproval(exceedsApprovalThresholds(current, proposed, input))
                .reason(
                        String.format(
                                "%s strategy ratio %.3f outside band [%.2f, %.2f]; %s daily"
                                        + " budget by %.1f%%",
                                input.getStrategy(),
                                effectiveRatio,
                                lowerBound,
                                policy.getUpperBand(),
                                kind == AdjustmentKind.INCREASE ? "increasing" : "decreasing",
                                fraction * 100))
                .build();
    }

    private PolicyDecision emergency(
            PolicyDecision.PolicyDecisionBuilder decision,
            PolicyInput input,
            BigDecimal current,
            double effectiveRatio) {
        BigDecimal runRateNeutral =
                current.divide(BigDecimal.valueOf(effectiveRatio), MONEY_SCALE, RoundingMode.FLOOR);
        BigDecimal proposed = runRateNeutral;
        if (input.getTargetDailySpend() != null
                && input.getTargetDailySpend().compareTo(proposed) < 0) {
            proposed = input.getTargetDailySpend().setScale(MONEY_SCALE, RoundingMode.FLOOR);
        }
        if (proposed.compareTo(current) >= 0) {
            return decision.build();
        }
        return decision.kind(AdjustmentKind.EMERGENCY_REDUCTION)
                .proposedAmount(proposed)
                .requiresApproval(true)
                .reason(
                        String.format(
                                "Emergency: ratio %.3f above %.2f; reducing daily budget from %s to"
                                        + " %s without step cap",
                                effectiveRatio,
                                policy.getEmergencyRatio(),
                                current.toPlainString(),
                                proposed.toPlainString()))
                .build();
    }

    /**
     * Adaptive pacing smooths the current ratio with an exponentially weighted moving average over
     * the configured window; the other strategies use the raw ratio.
     */
    double effectiveRatio(PolicyInput input) {
        if (input.getStrategy() != PacingStrategy.ADAPTIVE) {
            return input.getPacingRatio();
        }
        int earlier = Math.min(policy.getAdaptiveWindow() - 1, input.getRatioHistory().size());
        List<Double> window = new ArrayList<>(input.getRatioHistory().subList(0, earlier));
        Collections.reverse(window);
        window.add(input.getPacingRatio());

        double alpha = policy.getAdaptiveSmoothing();
        double smoothed = window.get(0);
        for (int i = 1; i < window.size(); i++) {
            smoothed = alpha * window.get(i) + (1 - alpha) * smoothed;
        }
        return smoothed;
    }

    /** Front-loaded pacing tolerates underspend during the first third of the period */
    double lowerBound(PolicyInput input) {
        if (input.getStrategy() == PacingStrategy.FRONT_LOADED
                && input.getDayOfPeriod() * 3 <= input.getDaysInPeriod()) {
            return policy.getLowerBand() - policy.getFrontLoadedTolerance();
        }
        return policy.getLowerBand();
    }

    PacingBand classify(double ratio, double lowerBound) {
        if (ratio < lowerBound) {
            return PacingBand.BELOW;
        }
        if (ratio > policy.getUpperBand()) {
            return PacingBand.ABOVE;
        }
        return PacingBand.NORMAL;
    }

    private BigDecimal currentBudget(PolicyInput input) {
        BigDecimal current =
                input.getCurrentDailyBudget() != null
                        ? input.getCurrentDailyBudget()
                        : input.getBaselineDailyBudget();
        return current == null ? BigDecimal.ZERO.setScale(MONEY_SCALE) : current;
    }

    boolean exceedsApprovalThresholds(BigDecimal current, BigDecimal proposed, PolicyInput input) {
        if (proposed.subtract(current).abs().compareTo(policy.getAbsoluteApprovalThreshold())
                > 0) {
            return true;
        }
        BigDecimal baseline = input.getBaselineDailyBudget();
        if (baseline == null || baseline.signum() <= 0) {
            return false;
        }
        double deviation =
                proposed.subtract(baseline).abs().divide(baseline, MC).doubleValue();
        return deviation > policy.getBaselineDeviationThreshold();
    }

    private static BigDecimal scale(BigDecimal amount, double factor, RoundingMode rounding) {
        return amount.multiply(BigDecimal.valueOf(factor), MC).setScale(MONEY_SCALE, rounding);
    }
}
