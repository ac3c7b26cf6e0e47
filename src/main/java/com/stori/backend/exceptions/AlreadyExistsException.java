package com.stori.backend.exceptions;

/**
 * Create-time key collision. Not retried automatically.
 */
public class AlreadyExistsException extends ConflictException {

    public AlreadyExistsException(String message) {
        super(message);
    }
}
