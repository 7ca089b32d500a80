package com.budgetpacing.entity;

public enum AdjustmentKind {
    INCREASE,
    DECREASE,
    EMERGENCY_REDUCTION,
    EXHAUSTION_PAUSE,
    /** Restarts delivery at the start of a period after an exhaustion pause */
    RESUME;

    public boolean isSpendIncreasing() {
        return this == INCREASE;
    }
}
