package com.budgetpacing.exception;

/** Base of every pacing failure; carries the campaign it happened to, when there is one. */
public class PacingException extends RuntimeException {

    private final String campaignId;
    private final String errorCode;

    public PacingException(String errorCode, String campaignId, String message) {
        super(message);
        this.errorCode = errorCode;
        this.campaignId = campaignId;
    }

    public PacingException(String errorCode, String campaignId, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.campaignId = campaignId;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
