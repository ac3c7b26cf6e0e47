package com.stori.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.List;

import org.springframework.stereotype.Service;

import com.stori.backend.dto.analytics.BudgetUtilizationDTO;
import com.stori.backend.entities.Budget;
import com.stori.backend.entities.Transaction;
import com.stori.backend.exceptions.BadRequestException;
import com.stori.backend.repositories.BudgetRepository;
import com.stori.backend.repositories.TransactionRepository;
import com.stori.backend.services.analytics.TransactionAggregator;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class BudgetService {

    private static final int MONEY_SCALE = 2;

    private final BudgetRepository budgetRepository;
    private final TransactionRepository transactionRepository;

    public Budget createOrUpdateBudget(String userId, String month, String category, BigDecimal amount) {
        requireText(userId, "userId");
        requireText(category, "category");
        if (amount == null) throw new BadRequestException("amount is required");
        if (amount.signum() < 0) throw new BadRequestException("budget amount cannot be negative");
        YearMonth ym = Months.parse(month);

        Budget budget = Budget.builder()
                .userId(userId)
                .month(ym.toString())
                .category(category.trim())
                .amount(amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP))
                .build();
        return budgetRepository.upsert(budget);
    }

    public List<Budget> getBudgetsByMonth(String userId, String month) {
        requireText(userId, "userId");
        return budgetRepository.findByMonth(userId, Months.parse(month).toString());
    }

    public Budget getBudget(String userId, String month, String category) {
        requireText(userId, "userId");
        requireText(category, "category");
        return budgetRepository.get(userId, Months.parse(month).toString(), category);
    }

    public void deleteBudget(String userId, String month, String category) {
        requireText(userId, "userId");
        requireText(category, "category");
        budgetRepository.delete(userId, Months.parse(month).toString(), category);
    }

    /**
     * Month budgets against the same month's expenses.
     */
    public List<BudgetUtilizationDTO> getBudgetUtilization(String userId, String month) {
        requireText(userId, "userId");
        YearMonth ym = Months.parse(month);

        List<Budget> budgets = budgetRepository.findByMonth(userId, ym.toString());
        if (budgets.isEmpty()) {
            return List.of();
        }
        List<Transaction> transactions = transactionRepository.listByMonth(userId, ym);
        return TransactionAggregator.budgetUtilization(transactions, budgets);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new BadRequestException(field + " is required");
        }
    }
}
