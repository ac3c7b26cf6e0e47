package com.stori.backend.repositories.store;

import java.time.Instant;

import org.springframework.stereotype.Repository;

import com.stori.backend.entities.User;
import com.stori.backend.exceptions.AlreadyExistsException;
import com.stori.backend.exceptions.RepositoryException;
import com.stori.backend.exceptions.ResourceNotFoundException;
import com.stori.backend.keys.KeyBuilder;
import com.stori.backend.mappers.UserItemMapper;
import com.stori.backend.repositories.UserRepository;
import com.stori.backend.store.ConditionalCheckFailedStoreException;
import com.stori.backend.store.DocumentStore;
import com.stori.backend.store.Item;
import com.stori.backend.store.PrimaryKey;
import com.stori.backend.store.StoreException;
import com.stori.backend.store.WriteCondition;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Repository
@RequiredArgsConstructor
public class StoreUserRepository implements UserRepository {

    private final DocumentStore store;

    @Override
    public User create(User user) {
        Instant now = Instant.now();
        User toCreate = user.toBuilder()
                .createdAt(user.getCreatedAt() != null ? user.getCreatedAt() : now)
                .updatedAt(now)
                .build();

        PrimaryKey key = KeyBuilder.userKey(toCreate.getId());
        try {
            store.put(UserItemMapper.toItem(toCreate, key), WriteCondition.itemNotExists());
        } catch (ConditionalCheckFailedStoreException e) {
            throw new AlreadyExistsException("User " + toCreate.getId() + " already exists");
        } catch (StoreException e) {
            throw new RepositoryException("Failed to create user " + toCreate.getId(), e);
        }

        log.info("User created: {}", toCreate.getId());
        return toCreate;
    }

    @Override
    public User get(String userId) {
        Item item;
        try {
            item = store.get(KeyBuilder.userKey(userId))
                    .orElseThrow(() -> new ResourceNotFoundException("User not found"));
        } catch (StoreException e) {
            throw new RepositoryException("Failed to read user " + userId, e);
        }
        return UserItemMapper.fromItem(item);
    }
}
