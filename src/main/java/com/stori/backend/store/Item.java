package com.stori.backend.store;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Generic attribute bag persisted by a {@link DocumentStore}.
 *
 * Values are limited to {@link String}, {@link BigDecimal} and flat {@code Map<String, String>}.
 * Instances are immutable; use {@link #builder()} or {@link #toBuilder()} to derive new ones.
 */
public final class Item {

    private final Map<String, Object> attributes;

    private Item(Map<String, Object> attributes) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Item of(Map<String, ?> attributes) {
        Builder builder = builder();
        attributes.forEach(builder::attribute);
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(attributes);
        return builder;
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    public Object get(String name) {
        return attributes.get(name);
    }

    public String getString(String name) {
        Object value = attributes.get(name);
        return value instanceof String s ? s : null;
    }

    public BigDecimal getNumber(String name) {
        Object value = attributes.get(name);
        return value instanceof BigDecimal n ? n : null;
    }

    public PrimaryKey primaryKey() {
        return new PrimaryKey(getString(TableIndex.PRIMARY.partitionAttribute()), getString(TableIndex.PRIMARY.sortAttribute()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Item other)) return false;
        return attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes);
    }

    @Override
    public String toString() {
        return "Item" + attributes;
    }

    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder string(String name, String value) {
            if (value != null) {
                values.put(name, value);
            }
            return this;
        }

        public Builder number(String name, BigDecimal value) {
            if (value != null) {
                values.put(name, value);
            }
            return this;
        }

        public Builder number(String name, long value) {
            values.put(name, BigDecimal.valueOf(value));
            return this;
        }

        public Builder map(String name, Map<String, String> value) {
            if (value != null) {
                values.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(value)));
            }
            return this;
        }

        /**
         * Accepts any supported value, normalizing integral and floating numbers to {@link BigDecimal}.
         */
        @SuppressWarnings("unchecked")
        public Builder attribute(String name, Object value) {
            if (value == null) {
                return this;
            }
            if (value instanceof String s) {
                return string(name, s);
            }
            if (value instanceof BigDecimal n) {
                return number(name, n);
            }
            if (value instanceof Integer || value instanceof Long) {
                return number(name, ((Number) value).longValue());
            }
            if (value instanceof Number n) {
                return number(name, new BigDecimal(n.toString()));
            }
            if (value instanceof Map<?, ?> m) {
                return map(name, (Map<String, String>) m);
            }
            throw new IllegalArgumentException("Unsupported attribute type for '" + name + "': " + value.getClass().getName());
        }

        public Builder remove(String name) {
            values.remove(name);
            return this;
        }

        public Item build() {
            return new Item(values);
        }
    }
}
