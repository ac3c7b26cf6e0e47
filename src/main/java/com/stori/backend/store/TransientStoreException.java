package com.stori.backend.store;

/**
 * Throttling, timeouts and other failures that may succeed when retried.
 */
public class TransientStoreException extends StoreException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
