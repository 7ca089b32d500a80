package com.budgetpacing.entity;

public enum AdjustmentStatus {
    PENDING,
    APPROVED,
    REJECTED,
    APPLIED,
    FAILED;

    public boolean isTerminal() {
        return this == REJECTED || this == APPLIED || this == FAILED;
    }
}
