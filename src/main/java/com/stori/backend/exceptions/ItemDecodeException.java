package com.stori.backend.exceptions;

public class ItemDecodeException extends RuntimeException {

    private final String field;

    public ItemDecodeException(String field, String message) {
        super("Invalid stored item field '" + field + "': " + message);
        this.field = field;
    }

    public ItemDecodeException(String field, String message, Throwable cause) {
        super("Invalid stored item field '" + field + "': " + message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
