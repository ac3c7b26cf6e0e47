package com.stori.backend.store;

public class ConditionalCheckFailedStoreException extends StoreException {

    public ConditionalCheckFailedStoreException(String message) {
        super(message);
    }

    public ConditionalCheckFailedStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
