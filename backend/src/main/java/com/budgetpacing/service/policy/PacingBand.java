package com.budgetpacing.service.policy;

/** Position of the (effective) pacing ratio relative to the normal band. */
public enum PacingBand {
    BELOW,
    NORMAL,
    ABOVE;

    public boolean isOutside() {
        return this != NORMAL;
    }
}
