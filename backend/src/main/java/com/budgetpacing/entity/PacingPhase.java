package com.budgetpacing.entity;

/** Operational state of a campaign's budget pacing. */
public enum PacingPhase {
    ACTIVE,
    THROTTLED,
    EXHAUSTED,
    PAUSED,
    AWAITING_APPROVAL;

    /** Phases in which the pacing band drives the phase automatically */
    public boolean isBandDriven() {
        return this == ACTIVE || this == THROTTLED;
    }

    /** Phases that only a period rollover can bring back to {@link #ACTIVE} */
    public boolean isDormant() {
        return this == EXHAUSTED || this == PAUSED;
    }
}
