package com.budgetpacing.exception;

import org.springframework.http.HttpStatusCode;

/** Error returned by, or while reaching, an external collaborator. */
public class AdPlatformException extends RuntimeException {

    private final HttpStatusCode httpStatus;
    private final String endpoint;

    public AdPlatformException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = null;
        this.endpoint = null;
    }

    public AdPlatformException(String message, HttpStatusCode httpStatus, String endpoint) {
        super(message);
        this.httpStatus = httpStatus;
        this.endpoint = endpoint;
    }

    public AdPlatformException(
            String message, HttpStatusCode httpStatus, String endpoint, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
        this.endpoint = endpoint;
    }

    public HttpStatusCode getHttpStatus() {
        return httpStatus;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public boolean isRetryable() {
        // no status means the call never completed: timeout or connection failure
        if (httpStatus == null) return true;

        if (httpStatus.is4xxClientError()) {
            return httpStatus.value() == 429 || httpStatus.value() == 408;
        }
        return httpStatus.is5xxServerError();
    }
}
