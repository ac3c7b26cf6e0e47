package com.stori.backend.entities;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class User {

    private String id;
    private String email;
    private String name;

    private Instant createdAt;
    private Instant updatedAt;
}
