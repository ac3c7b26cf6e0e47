package com.stori.backend.services;

import java.util.UUID;

import org.springframework.stereotype.Service;

import com.stori.backend.entities.User;
import com.stori.backend.exceptions.BadRequestException;
import com.stori.backend.repositories.UserRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;

    public User register(String userId, String email, String name) {
        if (email == null || email.isBlank()) throw new BadRequestException("email is required");
        if (!email.contains("@")) throw new BadRequestException("email is invalid");
        if (name == null || name.isBlank()) throw new BadRequestException("name is required");

        User user = User.builder()
                .id(userId == null || userId.isBlank() ? UUID.randomUUID().toString() : userId.trim())
                .email(email.trim())
                .name(name.trim())
                .build();
        return userRepository.create(user);
    }

    public User getUser(String userId) {
        if (userId == null || userId.isBlank()) throw new BadRequestException("userId is required");
        return userRepository.get(userId);
    }
}
