package com.stori.backend.mappers;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import com.stori.backend.exceptions.ItemDecodeException;
import com.stori.backend.store.Item;

/**
 * Field-level readers shared by the item mappers. Every failure names the offending attribute.
 */
final class ItemAttributes {

    static final String ID = "id";
    static final String USER_ID = "user_id";
    static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";

    private static final int DATE_ONLY_LENGTH = "yyyy-MM-dd".length();

    private ItemAttributes() {
    }

    static String requireString(Item item, String field) {
        Object raw = item.get(field);
        if (raw == null) {
            throw new ItemDecodeException(field, "missing");
        }
        if (!(raw instanceof String value)) {
            throw new ItemDecodeException(field, "expected a string but was " + raw.getClass().getSimpleName());
        }
        if (value.isBlank()) {
            throw new ItemDecodeException(field, "empty");
        }
        return value;
    }

    static String optionalString(Item item, String field, String fallback) {
        Object raw = item.get(field);
        if (raw == null) {
            return fallback;
        }
        if (!(raw instanceof String value)) {
            throw new ItemDecodeException(field, "expected a string but was " + raw.getClass().getSimpleName());
        }
        return value;
    }

    static BigDecimal requireNumber(Item item, String field) {
        Object raw = item.get(field);
        if (raw == null) {
            throw new ItemDecodeException(field, "missing");
        }
        if (!(raw instanceof BigDecimal value)) {
            throw new ItemDecodeException(field, "expected a number but was " + raw.getClass().getSimpleName());
        }
        return value;
    }

    static long optionalLong(Item item, String field, long fallback) {
        Object raw = item.get(field);
        if (raw == null) {
            return fallback;
        }
        if (!(raw instanceof BigDecimal value)) {
            throw new ItemDecodeException(field, "expected a number but was " + raw.getClass().getSimpleName());
        }
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new ItemDecodeException(field, "expected an integer but was " + value.toPlainString(), e);
        }
    }

    /**
     * Reads an RFC 3339 timestamp or a date-only {@code YYYY-MM-DD} value (midnight UTC).
     * An absent attribute yields {@code now}.
     */
    static Instant timestamp(Item item, String field, Instant now) {
        Object raw = item.get(field);
        if (raw == null) {
            return now;
        }
        if (!(raw instanceof String value) || value.isBlank()) {
            throw new ItemDecodeException(field, "expected an RFC 3339 timestamp or YYYY-MM-DD date");
        }
        return parseTimestamp(field, value.trim());
    }

    static Instant parseTimestamp(String field, String value) {
        try {
            if (value.length() > DATE_ONLY_LENGTH) {
                return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
            }
            return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new ItemDecodeException(field, "unparseable date '" + value + "'", e);
        }
    }

    static String formatTimestamp(Instant instant) {
        return instant == null ? null : DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
