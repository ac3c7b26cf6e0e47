package com.stori.backend.repositories;

import java.util.List;

import com.stori.backend.entities.Budget;

public interface BudgetRepository {

    /** Last write wins for the same (user, month, category). */
    Budget upsert(Budget budget);

    List<Budget> findByMonth(String userId, String month);

    Budget get(String userId, String month, String category);

    void delete(String userId, String month, String category);
}
