package com.stori.backend.store;

import java.util.Objects;

public record SortKeyCondition(Operator operator, String value) {

    public enum Operator {
        BEGINS_WITH,
        EQUALS
    }

    public SortKeyCondition {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
    }

    public static SortKeyCondition beginsWith(String prefix) {
        return new SortKeyCondition(Operator.BEGINS_WITH, prefix);
    }

    public static SortKeyCondition equalTo(String value) {
        return new SortKeyCondition(Operator.EQUALS, value);
    }

    public boolean matches(String sortKey) {
        if (sortKey == null) {
            return false;
        }
        return operator == Operator.EQUALS ? sortKey.equals(value) : sortKey.startsWith(value);
    }
}
