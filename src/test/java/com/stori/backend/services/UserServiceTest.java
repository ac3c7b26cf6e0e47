package com.stori.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.stori.backend.entities.User;
import com.stori.backend.exceptions.BadRequestException;
import com.stori.backend.repositories.UserRepository;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private UserService userService;

    @Test
    void register_withoutId_generatesOne() {
        when(userRepository.create(any(User.class))).thenAnswer(inv -> inv.getArgument(0));

        User user = userService.register(null, " ana@example.com ", "Ana");

        assertNotNull(user.getId());
        assertEquals("ana@example.com", user.getEmail());
    }

    @Test
    void register_invalidEmail_isBadRequest() {
        assertThrows(BadRequestException.class, () -> userService.register("u1", "not-an-email", "Ana"));
        assertThrows(BadRequestException.class, () -> userService.register("u1", "ana@example.com", ""));
        verifyNoInteractions(userRepository);
    }
}
