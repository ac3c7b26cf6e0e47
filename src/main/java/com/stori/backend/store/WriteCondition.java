package com.stori.backend.store;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Guard evaluated atomically by the store against the item currently stored under the same primary key.
 */
public final class WriteCondition {

    public enum Kind {
        NONE,
        ITEM_EXISTS,
        ITEM_NOT_EXISTS,
        ATTRIBUTE_EQUALS
    }

    private static final WriteCondition NONE = new WriteCondition(Kind.NONE, null, null);
    private static final WriteCondition EXISTS = new WriteCondition(Kind.ITEM_EXISTS, null, null);
    private static final WriteCondition NOT_EXISTS = new WriteCondition(Kind.ITEM_NOT_EXISTS, null, null);

    private final Kind kind;
    private final String attribute;
    private final Object expected;

    private WriteCondition(Kind kind, String attribute, Object expected) {
        this.kind = kind;
        this.attribute = attribute;
        this.expected = expected;
    }

    public static WriteCondition none() {
        return NONE;
    }

    public static WriteCondition itemExists() {
        return EXISTS;
    }

    public static WriteCondition itemNotExists() {
        return NOT_EXISTS;
    }

    public static WriteCondition attributeEquals(String attribute, long expected) {
        return new WriteCondition(Kind.ATTRIBUTE_EQUALS, Objects.requireNonNull(attribute), BigDecimal.valueOf(expected));
    }

    public static WriteCondition attributeEquals(String attribute, String expected) {
        return new WriteCondition(Kind.ATTRIBUTE_EQUALS, Objects.requireNonNull(attribute), Objects.requireNonNull(expected));
    }

    public Kind kind() {
        return kind;
    }

    public String attribute() {
        return attribute;
    }

    public Object expected() {
        return expected;
    }

    /**
     * Evaluates the condition against the stored item, {@code null} meaning absent.
     */
    public boolean isSatisfiedBy(Item current) {
        return switch (kind) {
            case NONE -> true;
            case ITEM_EXISTS -> current != null;
            case ITEM_NOT_EXISTS -> current == null;
            case ATTRIBUTE_EQUALS -> current != null && valueEquals(current.get(attribute));
        };
    }

    private boolean valueEquals(Object actual) {
        if (actual instanceof BigDecimal a && expected instanceof BigDecimal e) {
            return a.compareTo(e) == 0;
        }
        return Objects.equals(actual, expected);
    }

    @Override
    public String toString() {
        return kind == Kind.ATTRIBUTE_EQUALS ? kind + "(" + attribute + "=" + expected + ")" : kind.name();
    }
}
