package com.stori.backend.repositories.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.stori.backend.entities.User;
import com.stori.backend.exceptions.AlreadyExistsException;
import com.stori.backend.exceptions.ResourceNotFoundException;
import com.stori.backend.store.memory.InMemoryDocumentStore;

class StoreUserRepositoryTest {

    private StoreUserRepository repository;

    @BeforeEach
    void setUp() {
        repository = new StoreUserRepository(new InMemoryDocumentStore());
    }

    @Test
    void create_thenGet() {
        repository.create(User.builder().id("u1").email("ana@example.com").name("Ana").build());

        User user = repository.get("u1");

        assertEquals("ana@example.com", user.getEmail());
        assertEquals("Ana", user.getName());
    }

    @Test
    void create_twice_isAlreadyExists() {
        User user = User.builder().id("u1").email("ana@example.com").name("Ana").build();
        repository.create(user);

        assertThrows(AlreadyExistsException.class, () -> repository.create(user));
    }

    @Test
    void get_missing_isNotFound() {
        assertThrows(ResourceNotFoundException.class, () -> repository.get("nobody"));
    }
}
