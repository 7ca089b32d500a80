package com.budgetpacing.entity;

/** Budget health classification attached to every pacing result */
public enum BudgetStatus {
    ON_TRACK,
    UNDERSPENDING,
    OVERSPENDING,
    AT_RISK,
    EXHAUSTED
}
