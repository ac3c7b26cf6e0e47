package com.stori.backend.repositories;

import java.time.YearMonth;
import java.util.List;

import com.stori.backend.entities.Transaction;

/**
 * Transaction access over the single table. Listings are newest first and capped by the
 * configured query limit.
 */
public interface TransactionRepository {

    /**
     * @throws com.stori.backend.exceptions.AlreadyExistsException when the primary key is taken
     */
    Transaction create(Transaction transaction);

    /**
     * @throws com.stori.backend.exceptions.ResourceNotFoundException when no transaction has this id
     */
    Transaction get(String userId, String id);

    /**
     * Read-modify-write guarded by the stored version. A non-zero {@code version} on the argument
     * must match the stored one.
     *
     * @throws com.stori.backend.exceptions.VersionConflictException when another writer got there first
     */
    Transaction update(Transaction transaction);

    void delete(String userId, String id);

    CursorPage<Transaction> findByUser(String userId, int limit, String cursor);

    CursorPage<Transaction> findByMonth(String userId, YearMonth month, int limit, String cursor);

    CursorPage<Transaction> findByCategory(String userId, String category, int limit, String cursor);

    /** Whole user history, newest first, up to the query limit. */
    List<Transaction> listByUser(String userId);

    /** Whole month, newest first, up to the query limit. */
    List<Transaction> listByMonth(String userId, YearMonth month);

    /**
     * At-least-once bulk load with blind overwrite semantics. Not atomic across chunks.
     *
     * @throws com.stori.backend.exceptions.BatchWriteFailedException when a chunk exhausts its retries
     */
    void batchCreate(List<Transaction> transactions);
}
