package com.budgetpacing.exception;

import lombok.Getter;

@Getter
public class ApprovalTimeoutException extends PacingException {

    private final Long adjustmentId;

    public ApprovalTimeoutException(String campaignId, Long adjustmentId) {
        super(
                "APPROVAL_TIMEOUT",
                campaignId,
                String.format("Approval window for adjustment %d has expired", adjustmentId));
        this.adjustmentId = adjustmentId;
    }
}
