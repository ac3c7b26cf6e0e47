package com.stori.backend.keys;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Locale;

import com.stori.backend.store.PrimaryKey;

/**
 * Derives the single-table keys from entity fields. Pure and deterministic.
 *
 * <pre>
 * Transaction  PK  USER#{userId}                     SK  TX#{epochSeconds}#{id}
 *              GSI1 MONTH#{YYYY-MM}#{userId}          TX#{epochSeconds}
 *              GSI2 CATEGORY#{UPPER(category)}#{userId} TX#{epochSeconds}
 *              GSI3 ID#{id}                           USER#{userId}
 * Budget       PK  USER#{userId}                     SK  BUDGET#{YYYY-MM}#{UPPER(category)}
 * User         PK  USER#{userId}                     SK  PROFILE
 * </pre>
 *
 * Epoch seconds are zero-padded to a fixed width so that lexical sort-key order is chronological.
 * Dates before the epoch are not representable and are rejected by entity validation.
 */
public final class KeyBuilder {

    public static final String USER_PREFIX = "USER#";
    public static final String TRANSACTION_PREFIX = "TX#";
    public static final String MONTH_PREFIX = "MONTH#";
    public static final String CATEGORY_PREFIX = "CATEGORY#";
    public static final String ID_PREFIX = "ID#";
    public static final String BUDGET_PREFIX = "BUDGET#";
    public static final String PROFILE_SORT_KEY = "PROFILE";

    private static final String SEPARATOR = "#";
    private static final String EPOCH_FORMAT = "%012d";

    private KeyBuilder() {
    }

    public static TransactionKeys transactionKeys(String userId, String id, Instant date, String category) {
        String encodedDate = encodeDate(date);
        return new TransactionKeys(
                userPartition(userId),
                TRANSACTION_PREFIX + encodedDate + SEPARATOR + id,
                monthPartition(userId, monthOf(date)),
                TRANSACTION_PREFIX + encodedDate,
                categoryPartition(userId, category),
                TRANSACTION_PREFIX + encodedDate,
                idPartition(id),
                userPartition(userId)
        );
    }

    public static PrimaryKey budgetKey(String userId, String month, String category) {
        return new PrimaryKey(userPartition(userId), budgetMonthPrefix(month) + normalizeCategory(category));
    }

    public static PrimaryKey userKey(String userId) {
        return new PrimaryKey(userPartition(userId), PROFILE_SORT_KEY);
    }

    public static String userPartition(String userId) {
        return USER_PREFIX + userId;
    }

    public static String monthPartition(String userId, YearMonth month) {
        return MONTH_PREFIX + month + SEPARATOR + userId;
    }

    public static String categoryPartition(String userId, String category) {
        return CATEGORY_PREFIX + normalizeCategory(category) + SEPARATOR + userId;
    }

    public static String idPartition(String id) {
        return ID_PREFIX + id;
    }

    /** Sort-key prefix shared by all budgets of one month. */
    public static String budgetMonthPrefix(String month) {
        return BUDGET_PREFIX + month + SEPARATOR;
    }

    public static String encodeDate(Instant date) {
        return String.format(Locale.ROOT, EPOCH_FORMAT, date.getEpochSecond());
    }

    public static YearMonth monthOf(Instant date) {
        return YearMonth.from(date.atZone(ZoneOffset.UTC));
    }

    public static String normalizeCategory(String category) {
        return category == null ? "" : category.trim().toUpperCase(Locale.ROOT);
    }
}
