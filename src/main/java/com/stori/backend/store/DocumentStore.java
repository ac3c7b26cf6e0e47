package com.stori.backend.store;

import java.util.List;
import java.util.Optional;

/**
 * Narrow view of a wide-column key/value store with one table and named secondary indexes.
 *
 * Implementations must evaluate {@link WriteCondition}s atomically with the write, return query
 * results ordered by the index sort key, and be safe for concurrent use.
 */
public interface DocumentStore {

    /**
     * @throws ConditionalCheckFailedStoreException when the condition does not hold
     */
    void put(Item item, WriteCondition condition);

    Optional<Item> get(PrimaryKey key);

    /**
     * @throws ConditionalCheckFailedStoreException when the condition does not hold
     */
    void delete(PrimaryKey key, WriteCondition condition);

    QueryPage query(QuerySpec spec);

    /**
     * Blind puts of up to one store batch. Returns the items the store did not process;
     * an empty list means everything was written.
     */
    List<Item> batchWrite(List<Item> items);
}
