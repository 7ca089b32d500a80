package com.budgetpacing.service.commit;

public enum CommitOutcome {
    APPLIED,
    /** Applied by an earlier delivery; nothing was sent to the platform */
    ALREADY_APPLIED,
    /** Not in a committable status (pending, rejected or failed) */
    SKIPPED,
    /** Another worker holds a fresh claim on the adjustment */
    IN_PROGRESS,
    /** No longer valid when re-checked just before applying */
    CANCELLED,
    FAILED
}
