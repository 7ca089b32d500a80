package com.budgetpacing.exception;

import java.time.Duration;
import lombok.Getter;

@Getter
public class StaleDataException extends PacingException {

    /** How long the campaign has gone without usable spend data */
    private final Duration age;

    public StaleDataException(String campaignId, Duration age, String message) {
        super("STALE_DATA", campaignId, message);
        this.age = age;
    }
}
