package com.budgetpacing.exception;

import com.budgetpacing.dto.response.ErrorResponse;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps pacing failures to structured error responses for the operator API. */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex, WebRequest request) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult()
                .getAllErrors()
                .forEach(
                        error -> {
                            String fieldName =
                                    error instanceof FieldError fieldError
                                            ? fieldError.getField()
                                            : error.getObjectName();
                            errors.put(fieldName, error.getDefaultMessage());
                        });

        ErrorResponse errorResponse =
                createErrorResponse(
                        HttpStatus.BAD_REQUEST,
                        "VALIDATION_ERROR",
                        "Validation failed for one or more fields",
                        request);
        errorResponse.setValidationErrors(errors);

        log.warn("Validation error: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, WebRequest request) {
        Map<String, String> errors = new HashMap<>();
        for (ConstraintViolation<?> violation : ex.getConstraintViolations()) {
            errors.put(violation.getPropertyPath().toString(), violation.getMessage());
        }

        ErrorResponse errorResponse =
                createErrorResponse(
                        HttpStatus.BAD_REQUEST,
                        "CONSTRAINT_VIOLATION",
                        "Constraint validation failed",
                        request);
        errorResponse.setValidationErrors(errors);

        log.warn("Constraint violation: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            ResourceNotFoundException ex, WebRequest request) {
        log.debug("Resource not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(
                        createErrorResponse(
                                HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), request));
    }

    /** State transition and lost compare-and-swap errors */
    @ExceptionHandler({
        IllegalPhaseTransitionException.class,
        IllegalAdjustmentStateException.class,
        ConcurrentStateModificationException.class,
        ApprovalTimeoutException.class
    })
    public ResponseEntity<ErrorResponse> handleConflict(PacingException ex, WebRequest request) {
        log.warn(
                "Conflict: campaignId={}, errorCode={}, message={}",
                ex.getCampaignId(),
                ex.getErrorCode(),
                ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(
                        createErrorResponse(
                                HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage(), request));
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(
            ObjectOptimisticLockingFailureException ex, WebRequest request) {
        log.warn("Optimistic lock failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(
                        createErrorResponse(
                                HttpStatus.CONFLICT,
                                "CONCURRENT_MODIFICATION",
                                "The resource was modified concurrently. Reload and retry.",
                                request));
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolation(
            InvariantViolationException ex, WebRequest request) {
        log.warn("Invariant violation: campaignId={}, {}", ex.getCampaignId(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(
                        createErrorResponse(
                                HttpStatus.UNPROCESSABLE_ENTITY,
                                ex.getErrorCode(),
                                ex.getMessage(),
                                request));
    }

    @ExceptionHandler({AdPlatformException.class, CommitFailureException.class})
    public ResponseEntity<ErrorResponse> handlePlatformError(
            RuntimeException ex, WebRequest request) {
        log.error("External collaborator error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(
                        createErrorResponse(
                                HttpStatus.SERVICE_UNAVAILABLE,
                                "EXTERNAL_SERVICE_ERROR",
                                "External service temporarily unavailable. Please try again later.",
                                request));
    }

    @ExceptionHandler(PacingException.class)
    public ResponseEntity<ErrorResponse> handlePacingException(
            PacingException ex, WebRequest request) {
        log.warn(
                "Pacing error: campaignId={}, errorCode={}, message={}",
                ex.getCampaignId(),
                ex.getErrorCode(),
                ex.getMessage());
        return ResponseEntity.badRequest()
                .body(
                        createErrorResponse(
                                HttpStatus.BAD_REQUEST,
                                ex.getErrorCode(),
                                ex.getMessage(),
                                request));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, WebRequest request) {
        log.warn("Missing parameter: {}", ex.getParameterName());
        return ResponseEntity.badRequest()
                .body(
                        createErrorResponse(
                                HttpStatus.BAD_REQUEST,
                                "MISSING_PARAMETER",
                                "Missing required parameter: " + ex.getParameterName(),
                                request));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, WebRequest request) {
        log.warn("Type mismatch for parameter {}: {}", ex.getName(), ex.getMessage());
        return ResponseEntity.badRequest()
                .body(
                        createErrorResponse(
                                HttpStatus.BAD_REQUEST,
                                "TYPE_MISMATCH",
                                "Invalid parameter type for: " + ex.getName(),
                                request));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMalformedJson(
            HttpMessageNotReadableException ex, WebRequest request) {
        log.warn("Malformed JSON: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(
                        createErrorResponse(
                                HttpStatus.BAD_REQUEST,
                                "MALFORMED_JSON",
                                "Invalid JSON format in request body",
                                request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, WebRequest request) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(
                        createErrorResponse(
                                HttpStatus.INTERNAL_SERVER_ERROR,
                                "INTERNAL_ERROR",
                                "An unexpected error occurred. Please try again later.",
                                request));
    }

    private ErrorResponse createErrorResponse(
            HttpStatus status, String errorCode, String message, WebRequest request) {
        return ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorCode(errorCode)
                .message(message)
                .path(extractPath(request))
                .requestId(UUID.randomUUID().toString())
                .build();
    }

    private String extractPath(WebRequest request) {
        String description = request.getDescription(false);
        return description != null ? description.replace("uri=", "") : "unknown";
    }
}
