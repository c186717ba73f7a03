package com.example.chatsync.service.exception;

import org.springframework.http.HttpStatus;

/**
 * A change set could not be flushed. Nothing of it was committed.
 */
public class PersistenceFailureException extends ServiceException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, "persistence_failure", cause);
    }
}
