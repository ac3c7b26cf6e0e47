package com.stori.backend.store.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.stori.backend.store.ConditionalCheckFailedStoreException;
import com.stori.backend.store.DocumentStore;
import com.stori.backend.store.Item;
import com.stori.backend.store.PrimaryKey;
import com.stori.backend.store.QueryPage;
import com.stori.backend.store.QuerySpec;
import com.stori.backend.store.TableIndex;
import com.stori.backend.store.WriteCondition;

import lombok.extern.slf4j.Slf4j;

/**
 * Heap-backed {@link DocumentStore} with the same condition, index and pagination rules as the
 * DynamoDB adapter. Secondary indexes are sparse: items lacking an index's key attributes are
 * not visible through that index.
 */
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

    private static final String PK = TableIndex.PRIMARY.partitionAttribute();
    private static final String SK = TableIndex.PRIMARY.sortAttribute();

    private final Map<PrimaryKey, Item> items = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void put(Item item, WriteCondition condition) {
        PrimaryKey key = requireKey(item);
        lock.writeLock().lock();
        try {
            Item current = items.get(key);
            if (!condition.isSatisfiedBy(current)) {
                throw new ConditionalCheckFailedStoreException("Condition " + condition + " failed for " + key);
            }
            items.put(key, item);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Item> get(PrimaryKey key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(items.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void delete(PrimaryKey key, WriteCondition condition) {
        lock.writeLock().lock();
        try {
            Item current = items.get(key);
            if (!condition.isSatisfiedBy(current)) {
                throw new ConditionalCheckFailedStoreException("Condition " + condition + " failed for " + key);
            }
            items.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public QueryPage query(QuerySpec spec) {
        TableIndex index = spec.getIndex();
        List<Item> matching = new ArrayList<>();

        lock.readLock().lock();
        try {
            for (Item item : items.values()) {
                if (!spec.getPartitionKey().equals(item.getString(index.partitionAttribute()))) {
                    continue;
                }
                String sortKey = item.getString(index.sortAttribute());
                if (sortKey == null) {
                    continue;
                }
                if (spec.getSortKeyCondition() != null && !spec.getSortKeyCondition().matches(sortKey)) {
                    continue;
                }
                matching.add(item);
            }
        } finally {
            lock.readLock().unlock();
        }

        Comparator<Item> order = ordering(index);
        if (!spec.isScanForward()) {
            order = order.reversed();
        }
        matching.sort(order);

        int start = 0;
        if (spec.getExclusiveStartKey() != null && !spec.getExclusiveStartKey().isEmpty()) {
            Item startItem = Item.of(spec.getExclusiveStartKey());
            while (start < matching.size() && order.compare(matching.get(start), startItem) <= 0) {
                start++;
            }
        }

        int limit = spec.getLimit() > 0 ? spec.getLimit() : Integer.MAX_VALUE;
        int end = (int) Math.min((long) start + limit, matching.size());
        List<Item> page = List.copyOf(matching.subList(start, end));

        Map<String, String> lastEvaluatedKey = null;
        if (end < matching.size() && !page.isEmpty()) {
            lastEvaluatedKey = keyOf(page.get(page.size() - 1), index);
        }
        return new QueryPage(page, lastEvaluatedKey);
    }

    @Override
    public List<Item> batchWrite(List<Item> batch) {
        lock.writeLock().lock();
        try {
            for (Item item : batch) {
                items.put(requireKey(item), item);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Batch wrote {} items", batch.size());
        return List.of();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return items.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static PrimaryKey requireKey(Item item) {
        Objects.requireNonNull(item, "item");
        String pk = item.getString(PK);
        String sk = item.getString(SK);
        if (pk == null || sk == null) {
            throw new IllegalArgumentException("Item is missing its primary key attributes: " + item);
        }
        return new PrimaryKey(pk, sk);
    }

    // Ties on the index sort key fall back to the primary key so paging stays deterministic.
    private static Comparator<Item> ordering(TableIndex index) {
        Comparator<Item> bySortKey = Comparator.comparing(i -> i.getString(index.sortAttribute()));
        if (index.isPrimary()) {
            return bySortKey;
        }
        return bySortKey
                .thenComparing(i -> i.getString(PK))
                .thenComparing(i -> i.getString(SK));
    }

    private static Map<String, String> keyOf(Item item, TableIndex index) {
        Map<String, String> key = new LinkedHashMap<>();
        key.put(PK, item.getString(PK));
        key.put(SK, item.getString(SK));
        if (!index.isPrimary()) {
            key.put(index.partitionAttribute(), item.getString(index.partitionAttribute()));
            key.put(index.sortAttribute(), item.getString(index.sortAttribute()));
        }
        return key;
    }
}
