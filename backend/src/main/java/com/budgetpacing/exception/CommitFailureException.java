package com.budgetpacing.exception;

import lombok.Getter;

/** Budget change could not be applied to the platform after all retries. */
@Getter
public class CommitFailureException extends PacingException {

    private final Long adjustmentId;
    private final int attempts;

    public CommitFailureException(
            String campaignId, Long adjustmentId, int attempts, String message, Throwable cause) {
        super("COMMIT_FAILURE", campaignId, message, cause);
        this.adjustmentId = adjustmentId;
        this.attempts = attempts;
    }
}
