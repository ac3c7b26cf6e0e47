package com.stori.backend.exceptions;

/**
 * Store failure on a single-item path, wrapped with the operation that caused it.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
