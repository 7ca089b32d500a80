package com.budgetpacing.entity;

public enum AuditAction {
    CREATED,
    AUTO_APPROVED,
    APPROVAL_REQUESTED,
    APPROVED,
    REJECTED,
    EXPIRED,
    CANCELLED,
    APPLIED,
    FAILED
}
