package com.stori.backend.repositories.store;

import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Repository;

import com.stori.backend.config.StoreProperties;
import com.stori.backend.entities.Transaction;
import com.stori.backend.exceptions.AlreadyExistsException;
import com.stori.backend.exceptions.ItemDecodeException;
import com.stori.backend.exceptions.RepositoryException;
import com.stori.backend.exceptions.ResourceNotFoundException;
import com.stori.backend.exceptions.VersionConflictException;
import com.stori.backend.keys.KeyBuilder;
import com.stori.backend.keys.TransactionKeys;
import com.stori.backend.mappers.TransactionItemMapper;
import com.stori.backend.repositories.CursorPage;
import com.stori.backend.repositories.TransactionRepository;
import com.stori.backend.store.ConditionalCheckFailedStoreException;
import com.stori.backend.store.DocumentStore;
import com.stori.backend.store.Item;
import com.stori.backend.store.PrimaryKey;
import com.stori.backend.store.QueryPage;
import com.stori.backend.store.QuerySpec;
import com.stori.backend.store.SortKeyCondition;
import com.stori.backend.store.StoreException;
import com.stori.backend.store.TableIndex;
import com.stori.backend.store.WriteCondition;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link TransactionRepository} over a {@link DocumentStore}.
 *
 * This class is the only writer of transaction keys: every put derives all key attributes from
 * the entity's current fields through {@link KeyBuilder}. Keys read back from storage are used
 * only to locate the physical record.
 */
@Slf4j
@Repository
public class StoreTransactionRepository implements TransactionRepository {

    private final DocumentStore store;
    private final PageCursorCodec cursorCodec;
    private final BatchItemWriter batchWriter;
    private final StoreProperties properties;

    public StoreTransactionRepository(DocumentStore store,
                                      PageCursorCodec cursorCodec,
                                      BatchItemWriter batchWriter,
                                      StoreProperties properties) {
        this.store = store;
        this.cursorCodec = cursorCodec;
        this.batchWriter = batchWriter;
        this.properties = properties;
    }

    @Override
    public Transaction create(Transaction transaction) {
        transaction.validate();

        Instant now = Instant.now();
        Transaction toCreate = transaction.toBuilder()
                .createdAt(transaction.getCreatedAt() != null ? transaction.getCreatedAt() : now)
                .updatedAt(transaction.getUpdatedAt() != null ? transaction.getUpdatedAt() : now)
                .version(1)
                .build();

        Item item = TransactionItemMapper.toItem(toCreate, keysOf(toCreate));
        try {
            store.put(item, WriteCondition.itemNotExists());
        } catch (ConditionalCheckFailedStoreException e) {
            throw new AlreadyExistsException("Transaction " + toCreate.getId() + " already exists");
        } catch (StoreException e) {
            throw new RepositoryException("Failed to create transaction " + toCreate.getId(), e);
        }

        log.info("Transaction created: {} for user {}", toCreate.getId(), toCreate.getUserId());
        return toCreate;
    }

    @Override
    public Transaction get(String userId, String id) {
        return locate(userId, id).transaction();
    }

    @Override
    public Transaction update(Transaction transaction) {
        transaction.validate();

        StoredTransaction current = locate(transaction.getUserId(), transaction.getId());
        Transaction existing = current.transaction();
        long storedVersion = existing.getVersion();

        if (transaction.getVersion() > 0 && transaction.getVersion() != storedVersion) {
            throw new VersionConflictException(transaction.getId());
        }

        Transaction updated = transaction.toBuilder()
                .createdAt(existing.getCreatedAt())
                .updatedAt(Instant.now())
                .version(storedVersion + 1)
                .build();

        TransactionKeys keys = keysOf(updated);
        Item item = TransactionItemMapper.toItem(updated, keys);

        if (keys.primaryKey().equals(current.key())) {
            try {
                store.put(item, WriteCondition.attributeEquals(TransactionItemMapper.VERSION, storedVersion));
            } catch (ConditionalCheckFailedStoreException e) {
                throw new VersionConflictException(updated.getId());
            } catch (StoreException e) {
                throw new RepositoryException("Failed to update transaction " + updated.getId(), e);
            }
        } else {
            move(current, item, keys.primaryKey(), storedVersion, updated);
        }

        log.info("Transaction updated: {} for user {} (version {})", updated.getId(), updated.getUserId(), updated.getVersion());
        return updated;
    }

    @Override
    public void delete(String userId, String id) {
        StoredTransaction current = locate(userId, id);
        try {
            store.delete(current.key(), WriteCondition.itemExists());
        } catch (ConditionalCheckFailedStoreException e) {
            throw new ResourceNotFoundException("Transaction not found");
        } catch (StoreException e) {
            throw new RepositoryException("Failed to delete transaction " + id, e);
        }
        log.info("Transaction deleted: {} for user {}", id, userId);
    }

    @Override
    public CursorPage<Transaction> findByUser(String userId, int limit, String cursor) {
        return page(QuerySpec.builder()
                .index(TableIndex.PRIMARY)
                .partitionKey(KeyBuilder.userPartition(userId))
                .sortKeyCondition(SortKeyCondition.beginsWith(KeyBuilder.TRANSACTION_PREFIX))
                .consistentRead(true), limit, cursor, "user");
    }

    @Override
    public CursorPage<Transaction> findByMonth(String userId, YearMonth month, int limit, String cursor) {
        return page(QuerySpec.builder()
                .index(TableIndex.BY_MONTH)
                .partitionKey(KeyBuilder.monthPartition(userId, month)), limit, cursor, "month");
    }

    @Override
    public CursorPage<Transaction> findByCategory(String userId, String category, int limit, String cursor) {
        return page(QuerySpec.builder()
                .index(TableIndex.BY_CATEGORY)
                .partitionKey(KeyBuilder.categoryPartition(userId, category)), limit, cursor, "category");
    }

    @Override
    public List<Transaction> listByUser(String userId) {
        return collect(QuerySpec.builder()
                .index(TableIndex.PRIMARY)
                .partitionKey(KeyBuilder.userPartition(userId))
                .sortKeyCondition(SortKeyCondition.beginsWith(KeyBuilder.TRANSACTION_PREFIX))
                .consistentRead(true), "user");
    }

    @Override
    public List<Transaction> listByMonth(String userId, YearMonth month) {
        return collect(QuerySpec.builder()
                .index(TableIndex.BY_MONTH)
                .partitionKey(KeyBuilder.monthPartition(userId, month)), "month");
    }

    @Override
    public void batchCreate(List<Transaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return;
        }

        Instant now = Instant.now();
        List<Item> items = new ArrayList<>(transactions.size());
        for (Transaction transaction : transactions) {
            transaction.validate();
            Transaction prepared = transaction.toBuilder()
                    .createdAt(transaction.getCreatedAt() != null ? transaction.getCreatedAt() : now)
                    .updatedAt(now)
                    .version(transaction.getVersion() > 0 ? transaction.getVersion() : 1)
                    .build();
            items.add(TransactionItemMapper.toItem(prepared, keysOf(prepared)));
        }

        int written = batchWriter.writeAll(items);
        log.info("Batch created {} transactions", written);
    }

    private StoredTransaction locate(String userId, String id) {
        Optional<StoredTransaction> found = findThroughIdIndex(userId, id);
        if (found.isEmpty() && Boolean.TRUE.equals(properties.legacyIdScan())) {
            found = scanUserPartition(userId, id);
        }
        return found.orElseThrow(() -> new ResourceNotFoundException("Transaction not found"));
    }

    private Optional<StoredTransaction> findThroughIdIndex(String userId, String id) {
        QueryPage page = query(QuerySpec.builder()
                .index(TableIndex.BY_ID)
                .partitionKey(KeyBuilder.idPartition(id))
                .sortKeyCondition(SortKeyCondition.equalTo(KeyBuilder.userPartition(userId)))
                .limit(1)
                .build(), "id");

        for (Item item : page.getItems()) {
            Optional<StoredTransaction> decoded = decodeStored(item);
            if (decoded.isPresent()) {
                return decoded;
            }
        }
        return Optional.empty();
    }

    // Records written before the id index existed: bounded scan of the user partition.
    private Optional<StoredTransaction> scanUserPartition(String userId, String id) {
        int budget = properties.maxQueryLimit();
        Map<String, String> startKey = null;

        while (budget > 0) {
            QueryPage page = query(QuerySpec.builder()
                    .index(TableIndex.PRIMARY)
                    .partitionKey(KeyBuilder.userPartition(userId))
                    .sortKeyCondition(SortKeyCondition.beginsWith(KeyBuilder.TRANSACTION_PREFIX))
                    .consistentRead(true)
                    .limit(budget)
                    .exclusiveStartKey(startKey)
                    .scanForward(false)
                    .build(), "user");

            budget -= page.getItems().size();
            for (Item item : page.getItems()) {
                if (!id.equals(item.getString("id"))) {
                    continue;
                }
                Optional<StoredTransaction> decoded = decodeStored(item);
                if (decoded.isPresent()) {
                    return decoded;
                }
            }
            if (!page.hasMore() || page.getItems().isEmpty()) {
                break;
            }
            startKey = page.getLastEvaluatedKey();
        }
        return Optional.empty();
    }

    private void move(StoredTransaction current, Item item, PrimaryKey newKey, long storedVersion, Transaction updated) {
        try {
            store.put(item, WriteCondition.itemNotExists());
        } catch (ConditionalCheckFailedStoreException e) {
            throw new VersionConflictException(updated.getId());
        } catch (StoreException e) {
            throw new RepositoryException("Failed to update transaction " + updated.getId(), e);
        }

        try {
            store.delete(current.key(), WriteCondition.attributeEquals(TransactionItemMapper.VERSION, storedVersion));
        } catch (StoreException e) {
            undoMove(newKey, updated, e);
            if (e instanceof ConditionalCheckFailedStoreException) {
                throw new VersionConflictException(updated.getId());
            }
            throw new RepositoryException("Failed to update transaction " + updated.getId(), e);
        }
    }

    private void undoMove(PrimaryKey newKey, Transaction updated, StoreException cause) {
        try {
            store.delete(newKey, WriteCondition.attributeEquals(TransactionItemMapper.VERSION, updated.getVersion()));
        } catch (StoreException e) {
            log.error("Could not remove moved copy {} of transaction {} after failed update", newKey, updated.getId(), e);
            cause.addSuppressed(e);
        }
    }

    private CursorPage<Transaction> page(QuerySpec.QuerySpecBuilder spec, int limit, String cursor, String accessPattern) {
        QueryPage page = query(spec
                .limit(clampLimit(limit))
                .exclusiveStartKey(cursorCodec.decode(cursor))
                .scanForward(false)
                .build(), accessPattern);

        return new CursorPage<>(decodeAll(page.getItems()), cursorCodec.encode(page.getLastEvaluatedKey()));
    }

    private List<Transaction> collect(QuerySpec.QuerySpecBuilder spec, String accessPattern) {
        List<Transaction> out = new ArrayList<>();
        int remaining = properties.maxQueryLimit();
        Map<String, String> startKey = null;

        while (remaining > 0) {
            QueryPage page = query(spec
                    .limit(remaining)
                    .exclusiveStartKey(startKey)
                    .scanForward(false)
                    .build(), accessPattern);

            remaining -= page.getItems().size();
            out.addAll(decodeAll(page.getItems()));
            if (!page.hasMore() || page.getItems().isEmpty()) {
                break;
            }
            startKey = page.getLastEvaluatedKey();
        }
        return out;
    }

    private QueryPage query(QuerySpec spec, String accessPattern) {
        try {
            return store.query(spec);
        } catch (StoreException e) {
            throw new RepositoryException("Failed to query transactions by " + accessPattern, e);
        }
    }

    private int clampLimit(int limit) {
        if (limit <= 0) {
            return properties.defaultPageSize();
        }
        return Math.min(limit, properties.maxQueryLimit());
    }

    private List<Transaction> decodeAll(List<Item> items) {
        List<Transaction> out = new ArrayList<>(items.size());
        for (Item item : items) {
            decodeStored(item).ifPresent(stored -> out.add(stored.transaction()));
        }
        return out;
    }

    private Optional<StoredTransaction> decodeStored(Item item) {
        try {
            return Optional.of(new StoredTransaction(TransactionItemMapper.fromItem(item), item.primaryKey()));
        } catch (ItemDecodeException e) {
            log.warn("Skipping undecodable transaction item {}: {}", item.get("SK"), e.getMessage());
            return Optional.empty();
        }
    }

    private static TransactionKeys keysOf(Transaction transaction) {
        return KeyBuilder.transactionKeys(
                transaction.getUserId(),
                transaction.getId(),
                transaction.getDate(),
                transaction.getCategory());
    }

    private record StoredTransaction(Transaction transaction, PrimaryKey key) {
    }
}
