package com.stori.backend.services.insights;

import java.time.YearMonth;
import java.util.List;

import com.stori.backend.entities.Budget;
import com.stori.backend.entities.Transaction;

/**
 * Everything the insight providers read for one user and month, loaded once per request.
 */
public record MonthlyInsightData(String userId, YearMonth month, List<Transaction> transactions, List<Budget> budgets) {

    public MonthlyInsightData {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        budgets = budgets == null ? List.of() : List.copyOf(budgets);
    }
}
