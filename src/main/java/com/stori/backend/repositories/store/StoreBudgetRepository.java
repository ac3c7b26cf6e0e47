package com.stori.backend.repositories.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.springframework.stereotype.Repository;

import com.stori.backend.entities.Budget;
import com.stori.backend.exceptions.ItemDecodeException;
import com.stori.backend.exceptions.RepositoryException;
import com.stori.backend.exceptions.ResourceNotFoundException;
import com.stori.backend.keys.KeyBuilder;
import com.stori.backend.mappers.BudgetItemMapper;
import com.stori.backend.repositories.BudgetRepository;
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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Repository
@RequiredArgsConstructor
public class StoreBudgetRepository implements BudgetRepository {

    private final DocumentStore store;

    @Override
    public Budget upsert(Budget budget) {
        Instant now = Instant.now();
        Budget toSave = budget.toBuilder()
                .id(budget.getId() != null ? budget.getId() : UUID.randomUUID().toString())
                .createdAt(budget.getCreatedAt() != null ? budget.getCreatedAt() : now)
                .updatedAt(now)
                .build();

        PrimaryKey key = KeyBuilder.budgetKey(toSave.getUserId(), toSave.getMonth(), toSave.getCategory());
        try {
            store.put(BudgetItemMapper.toItem(toSave, key), WriteCondition.none());
        } catch (StoreException e) {
            throw new RepositoryException("Failed to save budget " + key.sortKey(), e);
        }

        log.info("Budget saved: {} {} for user {}", toSave.getMonth(), toSave.getCategory(), toSave.getUserId());
        return toSave;
    }

    @Override
    public List<Budget> findByMonth(String userId, String month) {
        List<Budget> budgets = new ArrayList<>();
        Map<String, String> startKey = null;

        do {
            QueryPage page;
            try {
                page = store.query(QuerySpec.builder()
                        .index(TableIndex.PRIMARY)
                        .partitionKey(KeyBuilder.userPartition(userId))
                        .sortKeyCondition(SortKeyCondition.beginsWith(KeyBuilder.budgetMonthPrefix(month)))
                        .consistentRead(true)
                        .exclusiveStartKey(startKey)
                        .build());
            } catch (StoreException e) {
                throw new RepositoryException("Failed to query budgets for " + month, e);
            }

            for (Item item : page.getItems()) {
                try {
                    budgets.add(BudgetItemMapper.fromItem(item));
                } catch (ItemDecodeException e) {
                    log.warn("Skipping undecodable budget item {}: {}", item.get("SK"), e.getMessage());
                }
            }
            startKey = page.hasMore() && !page.getItems().isEmpty() ? page.getLastEvaluatedKey() : null;
        } while (startKey != null);

        return budgets;
    }

    @Override
    public Budget get(String userId, String month, String category) {
        PrimaryKey key = KeyBuilder.budgetKey(userId, month, category);
        Item item;
        try {
            item = store.get(key).orElseThrow(() -> new ResourceNotFoundException("Budget not found"));
        } catch (StoreException e) {
            throw new RepositoryException("Failed to read budget " + key.sortKey(), e);
        }
        return BudgetItemMapper.fromItem(item);
    }

    @Override
    public void delete(String userId, String month, String category) {
        PrimaryKey key = KeyBuilder.budgetKey(userId, month, category);
        try {
            store.delete(key, WriteCondition.itemExists());
        } catch (ConditionalCheckFailedStoreException e) {
            throw new ResourceNotFoundException("Budget not found");
        } catch (StoreException e) {
            throw new RepositoryException("Failed to delete budget " + key.sortKey(), e);
        }
        log.info("Budget deleted: {} {} for user {}", month, category, userId);
    }
}
