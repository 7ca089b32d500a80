package com.budgetpacing.exception;

/** Another writer changed the pacing state between read and write. */
public class ConcurrentStateModificationException extends PacingException {

    public ConcurrentStateModificationException(String campaignId, String message) {
        super("CONCURRENT_MODIFICATION", campaignId, message);
    }

    public ConcurrentStateModificationException(
            String campaignId, String message, Throwable cause) {
        super("CONCURRENT_MODIFICATION", campaignId, message, cause);
    }
}
