package com.budgetpacing.service.policy;

import com.budgetpacing.entity.AdjustmentKind;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PolicyDecision {

    /** Ratio the decision table was applied to, smoothed for the adaptive strategy */
    double effectiveRatio;

    double lowerBound;
    PacingBand band;

    /** Null when no change is proposed */
    AdjustmentKind kind;

    BigDecimal previousAmount;
    BigDecimal proposedAmount;
    boolean requiresApproval;
    String reason;

    public boolean hasProposal() {
        return kind != null;
    }

    public boolean isEmergency() {
        return kind == AdjustmentKind.EMERGENCY_REDUCTION;
    }

    public BigDecimal delta() {
        return proposedAmount.subtract(previousAmount);
    }
}
