package com.budgetpacing.entity;

public enum TransitionTrigger {
    PACING_BAND,
    BUDGET_EXHAUSTED,
    APPROVAL_REQUIRED,
    APPROVAL_RESOLVED,
    EXTERNAL_PAUSE,
    PERIOD_ROLLOVER,
    INVARIANT_VIOLATION,
    MANUAL_OVERRIDE
}
