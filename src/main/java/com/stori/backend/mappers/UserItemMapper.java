package com.stori.backend.mappers;

import java.time.Instant;

import com.stori.backend.entities.User;
import com.stori.backend.store.Item;
import com.stori.backend.store.PrimaryKey;
import com.stori.backend.store.TableIndex;

public class UserItemMapper {

    static final String EMAIL = "email";
    static final String NAME = "name";

    private UserItemMapper() {}

    public static Item toItem(User user, PrimaryKey key) {
        return Item.builder()
                .string(TableIndex.PRIMARY.partitionAttribute(), key.partitionKey())
                .string(TableIndex.PRIMARY.sortAttribute(), key.sortKey())
                .string(ItemAttributes.ID, user.getId())
                .string(EMAIL, user.getEmail())
                .string(NAME, user.getName())
                .string(ItemAttributes.CREATED_AT, ItemAttributes.formatTimestamp(user.getCreatedAt()))
                .string(ItemAttributes.UPDATED_AT, ItemAttributes.formatTimestamp(user.getUpdatedAt()))
                .build();
    }

    public static User fromItem(Item item) {
        Instant now = Instant.now();
        return User.builder()
                .id(ItemAttributes.requireString(item, ItemAttributes.ID))
                .email(ItemAttributes.requireString(item, EMAIL))
                .name(ItemAttributes.optionalString(item, NAME, ""))
                .createdAt(ItemAttributes.timestamp(item, ItemAttributes.CREATED_AT, now))
                .updatedAt(ItemAttributes.timestamp(item, ItemAttributes.UPDATED_AT, now))
                .build();
    }
}
