package com.budgetpacing.exception;

/**
 * Data that can never be valid, such as a negative budget or a plan whose period ends before it
 * starts. Fatal for the current cycle of that campaign only.
 */
public class InvariantViolationException extends PacingException {

    public InvariantViolationException(String campaignId, String message) {
        super("INVARIANT_VIOLATION", campaignId, message);
    }
}
