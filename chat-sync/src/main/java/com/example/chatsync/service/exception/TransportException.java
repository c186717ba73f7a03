package com.example.chatsync.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Pub/sub failure. Confined to the notification path, never rolls back a committed write.
 */
public class TransportException extends ServiceException {

    public TransportException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, "transport_failure", cause);
    }
}
