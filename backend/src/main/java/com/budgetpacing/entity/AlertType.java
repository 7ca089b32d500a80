package com.budgetpacing.entity;

public enum AlertType {
    ZERO_SPEND,
    PACING_OUT_OF_BAND,
    PROJECTED_OVERSPEND,
    UNDERSPENDING,
    BUDGET_EXHAUSTED,
    APPROVAL_EXPIRED,
    COMMIT_FAILURE,
    ADJUSTMENT_CANCELLED,
    INVARIANT_VIOLATION,
    STALE_DATA,
    INGESTION_FAILURE,
    CONCURRENT_MODIFICATION,
    MISSING_PLAN,
    EVALUATION_FAILURE
}
