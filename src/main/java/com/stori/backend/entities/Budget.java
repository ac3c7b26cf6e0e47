package com.stori.backend.entities;

import java.math.BigDecimal;
import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Spending limit for one category in one month. One per (user, month, category); writes overwrite.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Budget {

    private String id;
    private String userId;

    /** {@code YYYY-MM} */
    private String month;

    private String category;
    private BigDecimal amount;

    private Instant createdAt;
    private Instant updatedAt;
}
