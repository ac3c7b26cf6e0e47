package com.stori.backend.mappers;

import java.time.Instant;

import com.stori.backend.entities.Budget;
import com.stori.backend.store.Item;
import com.stori.backend.store.PrimaryKey;
import com.stori.backend.store.TableIndex;

public class BudgetItemMapper {

    static final String MONTH = "month";
    static final String CATEGORY = "category";
    static final String AMOUNT = "amount";

    private BudgetItemMapper() {}

    public static Item toItem(Budget budget, PrimaryKey key) {
        return Item.builder()
                .string(TableIndex.PRIMARY.partitionAttribute(), key.partitionKey())
                .string(TableIndex.PRIMARY.sortAttribute(), key.sortKey())
                .string(ItemAttributes.ID, budget.getId())
                .string(ItemAttributes.USER_ID, budget.getUserId())
                .string(MONTH, budget.getMonth())
                .string(CATEGORY, budget.getCategory())
                .number(AMOUNT, budget.getAmount())
                .string(ItemAttributes.CREATED_AT, ItemAttributes.formatTimestamp(budget.getCreatedAt()))
                .string(ItemAttributes.UPDATED_AT, ItemAttributes.formatTimestamp(budget.getUpdatedAt()))
                .build();
    }

    public static Budget fromItem(Item item) {
        Instant now = Instant.now();
        return Budget.builder()
                .id(ItemAttributes.optionalString(item, ItemAttributes.ID, null))
                .userId(ItemAttributes.requireString(item, ItemAttributes.USER_ID))
                .month(ItemAttributes.requireString(item, MONTH))
                .category(ItemAttributes.requireString(item, CATEGORY))
                .amount(ItemAttributes.requireNumber(item, AMOUNT))
                .createdAt(ItemAttributes.timestamp(item, ItemAttributes.CREATED_AT, now))
                .updatedAt(ItemAttributes.timestamp(item, ItemAttributes.UPDATED_AT, now))
                .build();
    }
}
