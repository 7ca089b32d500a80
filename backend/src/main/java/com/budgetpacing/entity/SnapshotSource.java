package com.budgetpacing.entity;

public enum SnapshotSource {
    PULL,
    PUSH
}
