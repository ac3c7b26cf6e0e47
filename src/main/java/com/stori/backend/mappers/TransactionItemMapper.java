package com.stori.backend.mappers;

import java.time.Instant;

import com.stori.backend.entities.Transaction;
import com.stori.backend.enums.TransactionType;
import com.stori.backend.exceptions.ItemDecodeException;
import com.stori.backend.keys.TransactionKeys;
import com.stori.backend.store.Item;
import com.stori.backend.store.TableIndex;

public class TransactionItemMapper {

    static final String DATE = "date";
    static final String AMOUNT = "amount";
    static final String DESCRIPTION = "description";
    static final String CATEGORY = "category";
    static final String TYPE = "type";
    public static final String VERSION = "version";

    private TransactionItemMapper() {}

    /**
     * Builds the stored item. Keys are supplied by the caller, freshly derived from the entity's current fields.
     */
    public static Item toItem(Transaction transaction, TransactionKeys keys) {
        return Item.builder()
                .string(TableIndex.PRIMARY.partitionAttribute(), keys.pk())
                .string(TableIndex.PRIMARY.sortAttribute(), keys.sk())
                .string(TableIndex.BY_MONTH.partitionAttribute(), keys.monthPk())
                .string(TableIndex.BY_MONTH.sortAttribute(), keys.monthSk())
                .string(TableIndex.BY_CATEGORY.partitionAttribute(), keys.categoryPk())
                .string(TableIndex.BY_CATEGORY.sortAttribute(), keys.categorySk())
                .string(TableIndex.BY_ID.partitionAttribute(), keys.idPk())
                .string(TableIndex.BY_ID.sortAttribute(), keys.idSk())
                .string(ItemAttributes.ID, transaction.getId())
                .string(ItemAttributes.USER_ID, transaction.getUserId())
                .string(DATE, ItemAttributes.formatTimestamp(transaction.getDate()))
                .number(AMOUNT, transaction.getAmount())
                .string(DESCRIPTION, transaction.getDescription())
                .string(CATEGORY, transaction.getCategory())
                .string(TYPE, transaction.getType() != null ? transaction.getType().getValue() : null)
                .string(ItemAttributes.CREATED_AT, ItemAttributes.formatTimestamp(transaction.getCreatedAt()))
                .string(ItemAttributes.UPDATED_AT, ItemAttributes.formatTimestamp(transaction.getUpdatedAt()))
                .number(VERSION, transaction.getVersion())
                .build();
    }

    public static Transaction fromItem(Item item) {
        Instant now = Instant.now();

        String rawType = ItemAttributes.requireString(item, TYPE);
        TransactionType type = TransactionType.fromValue(rawType);
        if (type == null) {
            throw new ItemDecodeException(TYPE, "unknown transaction type '" + rawType + "'");
        }

        return Transaction.builder()
                .id(ItemAttributes.requireString(item, ItemAttributes.ID))
                .userId(ItemAttributes.requireString(item, ItemAttributes.USER_ID))
                .date(ItemAttributes.timestamp(item, DATE, now))
                .amount(ItemAttributes.requireNumber(item, AMOUNT))
                .description(ItemAttributes.optionalString(item, DESCRIPTION, ""))
                .category(ItemAttributes.requireString(item, CATEGORY))
                .type(type)
                .createdAt(ItemAttributes.timestamp(item, ItemAttributes.CREATED_AT, now))
                .updatedAt(ItemAttributes.timestamp(item, ItemAttributes.UPDATED_AT, now))
                .version(ItemAttributes.optionalLong(item, VERSION, 1L))
                .build();
    }
}
