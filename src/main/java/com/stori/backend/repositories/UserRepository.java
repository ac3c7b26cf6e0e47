package com.stori.backend.repositories;

import com.stori.backend.entities.User;

public interface UserRepository {

    User create(User user);

    User get(String userId);
}
