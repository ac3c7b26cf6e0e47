package com.stori.backend.services;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import org.springframework.stereotype.Service;

import com.stori.backend.dto.InsightDTO;
import com.stori.backend.dto.analytics.CategoryBreakdownDTO;
import com.stori.backend.dto.analytics.CategoryOptionDTO;
import com.stori.backend.dto.analytics.FinancialSummaryDTO;
import com.stori.backend.dto.analytics.MonthlyAnalyticsDTO;
import com.stori.backend.dto.analytics.MonthlyAnalyticsWithBudgetDTO;
import com.stori.backend.entities.Budget;
import com.stori.backend.entities.Transaction;
import com.stori.backend.exceptions.BadRequestException;
import com.stori.backend.keys.KeyBuilder;
import com.stori.backend.repositories.BudgetRepository;
import com.stori.backend.repositories.TransactionRepository;
import com.stori.backend.services.analytics.TransactionAggregator;

import lombok.RequiredArgsConstructor;

/**
 * Read-only dashboards. User-wide figures cover the history returned by a single bounded listing.
 */
@Service
@RequiredArgsConstructor
public class AnalyticsService {

    private final TransactionRepository transactionRepository;
    private final BudgetRepository budgetRepository;
    private final FinancialInsightsService financialInsightsService;

    public MonthlyAnalyticsDTO getMonthlyAnalytics(String userId, String month) {
        requireUser(userId);
        YearMonth ym = Months.parse(month);
        return TransactionAggregator.monthlyAnalytics(ym, transactionRepository.listByMonth(userId, ym));
    }

    /** All-time totals. */
    public FinancialSummaryDTO getFinancialSummary(String userId) {
        requireUser(userId);
        return TransactionAggregator.summarize(transactionRepository.listByUser(userId));
    }

    public FinancialSummaryDTO getMonthlySummary(String userId, String month) {
        requireUser(userId);
        YearMonth ym = Months.parse(month);
        return TransactionAggregator.summarize(transactionRepository.listByMonth(userId, ym));
    }

    public MonthlyAnalyticsWithBudgetDTO getFinancialSummaryWithBudgets(String userId, String month) {
        requireUser(userId);
        YearMonth ym = Months.parse(month);
        List<Transaction> transactions = transactionRepository.listByMonth(userId, ym);
        List<Budget> budgets = budgetRepository.findByMonth(userId, ym.toString());
        return TransactionAggregator.budgetBreakdown(ym, transactions, budgets);
    }

    /** Expense categories of the month, sorted by name. */
    public List<CategoryBreakdownDTO> getCategoryBreakdown(String userId, String month) {
        return getMonthlySummary(userId, month).getCategoryBreakdown();
    }

    /** Distinct categories, case-insensitive, sorted. */
    public List<String> getUniqueCategories(String userId) {
        requireUser(userId);
        Map<String, String> categories = new TreeMap<>();
        for (Transaction tx : transactionRepository.listByUser(userId)) {
            if (tx.getCategory() == null || tx.getCategory().isBlank()) {
                continue;
            }
            String name = tx.getCategory().trim();
            categories.merge(KeyBuilder.normalizeCategory(name), name, (a, b) -> a.compareTo(b) <= 0 ? a : b);
        }
        List<String> out = new ArrayList<>(categories.values());
        out.sort(Comparator.naturalOrder());
        return out;
    }

    public List<CategoryOptionDTO> getCategoryOptions(String userId) {
        return getUniqueCategories(userId).stream()
                .map(category -> CategoryOptionDTO.builder()
                        .label(capitalize(category))
                        .value(category)
                        .build())
                .toList();
    }

    /** {@code YYYY-MM} values, newest first. */
    public List<String> getMonthsWithTransactions(String userId) {
        requireUser(userId);
        TreeSet<YearMonth> months = new TreeSet<>(Comparator.reverseOrder());
        for (Transaction tx : transactionRepository.listByUser(userId)) {
            if (tx.getDate() != null) {
                months.add(KeyBuilder.monthOf(tx.getDate()));
            }
        }
        return months.stream().map(YearMonth::toString).toList();
    }

    public List<InsightDTO> getFinancialInsights(String userId, String month) {
        requireUser(userId);
        return financialInsightsService.getInsights(userId, Months.parse(month));
    }

    private static String capitalize(String value) {
        if (value.isEmpty()) {
            return value;
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new BadRequestException("userId is required");
        }
    }
}
