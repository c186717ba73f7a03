package com.example.chatsync.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Request rejected before any change is tracked.
 */
public class ValidationException extends ServiceException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message, "validation_error");
    }
}
