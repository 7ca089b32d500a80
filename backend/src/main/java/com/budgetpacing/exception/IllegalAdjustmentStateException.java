package com.budgetpacing.exception;

import com.budgetpacing.entity.AdjustmentStatus;

public class IllegalAdjustmentStateException extends PacingException {

    public IllegalAdjustmentStateException(
            String campaignId, Long adjustmentId, AdjustmentStatus status, String operation) {
        super(
                "ILLEGAL_ADJUSTMENT_STATE",
                campaignId,
                String.format(
                        "Cannot %s adjustment %d in status %s", operation, adjustmentId, status));
    }
}
