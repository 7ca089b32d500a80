package com.budgetpacing.exception;

public class ResourceNotFoundException extends PacingException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                "NOT_FOUND",
                null,
                String.format("%s with identifier '%s' not found", resourceType, identifier));
    }

    public ResourceNotFoundException(String resourceType, Long id) {
        super("NOT_FOUND", null, String.format("%s with ID %d not found", resourceType, id));
    }
}
