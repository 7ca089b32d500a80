package com.budgetpacing.entity;

public enum PacingStrategy {
    EVEN,
    FRONT_LOADED,
    ADAPTIVE
}
