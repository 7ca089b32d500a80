package com.budgetpacing.exception;

import com.budgetpacing.entity.PacingPhase;
import lombok.Getter;

@Getter
public class IllegalPhaseTransitionException extends PacingException {

    private final PacingPhase from;
    private final PacingPhase to;

    public IllegalPhaseTransitionException(String campaignId, PacingPhase from, PacingPhase to) {
        super(
                "ILLEGAL_PHASE_TRANSITION",
                campaignId,
                String.format(
                        "Invalid phase transition from %s to %s for campaign %s",
                        from, to, campaignId));
        this.from = from;
        this.to = to;
    }
}
