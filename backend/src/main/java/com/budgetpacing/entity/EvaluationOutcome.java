package com.budgetpacing.entity;

public enum EvaluationOutcome {
    EVALUATED,
    NO_OP,
    DUPLICATE,
    LEASE_HELD,
    INACTIVE,
    EXTERNALLY_PAUSED,
    NO_PLAN,
    STALE_DATA,
    INGESTION_FAILED,
    INVARIANT_VIOLATION,
    CONFLICT,
    FAILED
}
