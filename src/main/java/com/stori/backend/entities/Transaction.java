package com.stori.backend.entities;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import com.stori.backend.enums.TransactionType;
import com.stori.backend.exceptions.BadRequestException;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single income or expense entry.
 *
 * Expenses are usually stored with a negative amount; aggregation always uses the absolute
 * value so either sign is accepted. Key attributes are not part of the entity: they are derived
 * from {@code userId}, {@code date}, {@code category} and {@code id} on every write.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {

    private String id;
    private String userId;

    /** Point in time of the transaction, interpreted in UTC for month bucketing. */
    private Instant date;

    private BigDecimal amount;
    private String description;
    private String category;
    private TransactionType type;

    private Instant createdAt;
    private Instant updatedAt;

    /** Optimistic-concurrency stamp, 1 on creation. 0 means "unknown" on update requests. */
    private long version;

    /**
     * Validated constructor for a brand-new transaction: fresh id, timestamps set, version 1.
     */
    public static Transaction newTransaction(String userId, TransactionType type, String category,
                                             String description, BigDecimal amount, Instant date) {
        Instant now = Instant.now();
        Transaction transaction = Transaction.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .type(type)
                .category(category)
                .description(description)
                .amount(amount)
                .date(date)
                .createdAt(now)
                .updatedAt(now)
                .version(1)
                .build();
        transaction.validate();
        return transaction;
    }

    /**
     * @throws BadRequestException naming the first invalid field
     */
    public void validate() {
        if (isBlank(id)) throw new BadRequestException("id is required");
        if (isBlank(userId)) throw new BadRequestException("user_id is required");
        if (amount == null || amount.signum() == 0) throw new BadRequestException("amount must be non-zero");
        if (type == null) throw new BadRequestException("type must be either income or expense");
        if (isBlank(category)) throw new BadRequestException("category is required");
        if (isBlank(description)) throw new BadRequestException("description is required");
        if (date == null) throw new BadRequestException("date is required");
        if (date.isBefore(Instant.EPOCH)) throw new BadRequestException("date must not be before 1970-01-01");
    }

    public boolean isIncome() {
        return type == TransactionType.INCOME;
    }

    public boolean isExpense() {
        return type == TransactionType.EXPENSE;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
