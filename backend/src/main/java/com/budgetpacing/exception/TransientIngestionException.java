package com.budgetpacing.exception;

/** Spend feed unavailable; the cycle is skipped and retried on the next one. */
public class TransientIngestionException extends PacingException {

    public TransientIngestionException(String campaignId, String message, Throwable cause) {
        super("TRANSIENT_INGESTION", campaignId, message, cause);
    }

    public TransientIngestionException(String campaignId, String message) {
        super("TRANSIENT_INGESTION", campaignId, message);
    }
}
