package com.stori.backend.enums;

import java.util.Locale;

public enum TransactionType {

    INCOME("income"),
    EXPENSE("expense");

    private final String value;

    TransactionType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parses the lowercase wire value, returning {@code null} for anything else.
     */
    public static TransactionType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TransactionType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
