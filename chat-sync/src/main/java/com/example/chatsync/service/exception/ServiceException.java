package com.example.chatsync.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Base of the service error taxonomy. Each subtype fixes the HTTP status and a stable error code
 * that {@code RestExceptionHandler} renders.
 */
public abstract class ServiceException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    protected ServiceException(HttpStatus status, String message, String errorCode) {
        this(status, message, errorCode, null);
    }

    protected ServiceException(HttpStatus status, String message, String errorCode, Throwable cause) {
        super(message, cause, false, status.is5xxServerError());
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
