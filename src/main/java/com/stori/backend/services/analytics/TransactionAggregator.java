package com.stori.backend.services.analytics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.stori.backend.dto.analytics.BudgetUtilizationDTO;
import com.stori.backend.dto.analytics.CategoryBreakdownDTO;
import com.stori.backend.dto.analytics.CategoryBudgetBreakdownDTO;
import com.stori.backend.dto.analytics.FinancialSummaryDTO;
import com.stori.backend.dto.analytics.MonthlyAnalyticsDTO;
import com.stori.backend.dto.analytics.MonthlyAnalyticsWithBudgetDTO;
import com.stori.backend.entities.Budget;
import com.stori.backend.entities.Transaction;
import com.stori.backend.keys.KeyBuilder;

/**
 * Pure folds over transactions and budgets. Results do not depend on input order.
 *
 * Expenses always count by absolute value whatever sign they were stored with. Categories are
 * grouped case-insensitively; when several spellings exist the lexically smallest one is shown.
 */
public final class TransactionAggregator {

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
    private static final int MONEY_SCALE = 2;
    private static final int PERCENT_SCALE = 2;
    private static final int DIVISION_SCALE = 6;

    private TransactionAggregator() {
    }

    public static FinancialSummaryDTO summarize(List<Transaction> transactions) {
        Totals totals = Totals.of(transactions);
        Map<String, CategoryTotal> byCategory = expensesByCategory(transactions);

        List<CategoryBreakdownDTO> breakdown = new ArrayList<>(byCategory.size());
        for (CategoryTotal category : byCategory.values()) {
            breakdown.add(CategoryBreakdownDTO.builder()
                    .category(category.displayName)
                    .amount(money(category.amount))
                    .percentage(percentageOf(category.amount, totals.expense))
                    .transactionCount(category.count)
                    .build());
        }
        breakdown.sort(Comparator.comparing(CategoryBreakdownDTO::getCategory));

        BigDecimal balance = totals.income.subtract(totals.expense);
        return FinancialSummaryDTO.builder()
                .totalIncome(money(totals.income))
                .totalExpenses(money(totals.expense))
                .balance(money(balance))
                .savingsRate(percentageOf(balance, totals.income))
                .categoryBreakdown(breakdown)
                .transactionCount(totals.count)
                .generatedAt(Instant.now())
                .build();
    }

    public static MonthlyAnalyticsDTO monthlyAnalytics(YearMonth month, List<Transaction> transactions) {
        Totals totals = Totals.of(transactions);

        Map<String, CategoryTotal> net = new TreeMap<>();
        for (Transaction tx : nonNull(transactions)) {
            BigDecimal signed = tx.isExpense() ? abs(tx).negate() : abs(tx);
            net.computeIfAbsent(KeyBuilder.normalizeCategory(tx.getCategory()), k -> new CategoryTotal())
                    .add(tx.getCategory(), signed);
        }

        Map<String, BigDecimal> breakdown = new TreeMap<>();
        net.values().forEach(category -> breakdown.put(category.displayName, money(category.amount)));

        return MonthlyAnalyticsDTO.builder()
                .month(month.toString())
                .totalIncome(money(totals.income))
                .totalExpense(money(totals.expense))
                .balance(money(totals.income.subtract(totals.expense)))
                .categoryBreakdown(breakdown)
                .transactionCount(totals.count)
                .build();
    }

    /**
     * Joins month spending with month budgets. Every category that has either spending or a budget
     * appears once, sorted by name.
     */
    public static MonthlyAnalyticsWithBudgetDTO budgetBreakdown(YearMonth month, List<Transaction> transactions, List<Budget> budgets) {
        Totals totals = Totals.of(transactions);
        Map<String, CategoryTotal> spent = expensesByCategory(transactions);
        Map<String, Budget> budgetByCategory = budgetsByCategory(budgets);

        Map<String, String> names = new TreeMap<>();
        spent.forEach((key, total) -> names.put(key, total.displayName));
        budgetByCategory.forEach((key, budget) -> names.put(key, budget.getCategory().trim()));

        List<CategoryBudgetBreakdownDTO> breakdown = new ArrayList<>(names.size());
        names.forEach((key, name) -> {
            BigDecimal spentAmount = spent.containsKey(key) ? spent.get(key).amount : BigDecimal.ZERO;
            BigDecimal budgetAmount = budgetAmount(budgetByCategory.get(key));
            breakdown.add(CategoryBudgetBreakdownDTO.builder()
                    .category(name)
                    .spent(money(spentAmount))
                    .budget(money(budgetAmount))
                    .remaining(money(budgetAmount.subtract(spentAmount)))
                    .build());
        });
        breakdown.sort(Comparator.comparing(CategoryBudgetBreakdownDTO::getCategory));

        return MonthlyAnalyticsWithBudgetDTO.builder()
                .month(month.toString())
                .totalIncome(money(totals.income))
                .totalExpense(money(totals.expense))
                .balance(money(totals.income.subtract(totals.expense)))
                .categoryBreakdown(breakdown)
                .transactionCount(totals.count)
                .build();
    }

    /**
     * One entry per budget, sorted by category. Percentage is spent over budget, 0 for a zero budget.
     */
    public static List<BudgetUtilizationDTO> budgetUtilization(List<Transaction> transactions, List<Budget> budgets) {
        Map<String, CategoryTotal> spent = expensesByCategory(transactions);

        List<BudgetUtilizationDTO> out = new ArrayList<>();
        for (Budget budget : budgetsByCategory(budgets).values()) {
            String key = KeyBuilder.normalizeCategory(budget.getCategory());
            BigDecimal spentAmount = spent.containsKey(key) ? spent.get(key).amount : BigDecimal.ZERO;
            BigDecimal budgetAmount = budgetAmount(budget);
            out.add(BudgetUtilizationDTO.builder()
                    .category(budget.getCategory())
                    .budgetAmount(money(budgetAmount))
                    .spentAmount(money(spentAmount))
                    .remaining(money(budgetAmount.subtract(spentAmount)))
                    .percentage(percentageOf(spentAmount, budgetAmount))
                    .build());
        }
        out.sort(Comparator.comparing(BudgetUtilizationDTO::getCategory));
        return out;
    }

    /** part / total * 100 at scale 2, or 0 when total is not positive. */
    public static BigDecimal percentageOf(BigDecimal part, BigDecimal total) {
        if (total == null || total.signum() <= 0) {
            return BigDecimal.ZERO.setScale(PERCENT_SCALE);
        }
        return part
                .divide(total, DIVISION_SCALE, RoundingMode.HALF_UP)
                .multiply(ONE_HUNDRED)
                .setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private static Map<String, CategoryTotal> expensesByCategory(List<Transaction> transactions) {
        Map<String, CategoryTotal> out = new LinkedHashMap<>();
        for (Transaction tx : nonNull(transactions)) {
            if (tx.isExpense()) {
                out.computeIfAbsent(KeyBuilder.normalizeCategory(tx.getCategory()), k -> new CategoryTotal())
                        .add(tx.getCategory(), abs(tx));
            }
        }
        return out;
    }

    // Duplicate spellings of one category in the same month cannot coexist in storage; keep the last.
    private static Map<String, Budget> budgetsByCategory(List<Budget> budgets) {
        Map<String, Budget> out = new TreeMap<>();
        if (budgets != null) {
            budgets.stream()
                    .filter(Objects::nonNull)
                    .filter(b -> b.getCategory() != null && !b.getCategory().isBlank())
                    .forEach(b -> out.put(KeyBuilder.normalizeCategory(b.getCategory()), b));
        }
        return out;
    }

    private static BigDecimal budgetAmount(Budget budget) {
        return budget == null || budget.getAmount() == null ? BigDecimal.ZERO : budget.getAmount();
    }

    private static BigDecimal abs(Transaction tx) {
        return tx.getAmount() == null ? BigDecimal.ZERO : tx.getAmount().abs();
    }

    private static List<Transaction> nonNull(List<Transaction> transactions) {
        if (transactions == null) {
            return List.of();
        }
        return transactions.stream().filter(Objects::nonNull).toList();
    }

    private record Totals(BigDecimal income, BigDecimal expense, int count) {

        static Totals of(List<Transaction> transactions) {
            BigDecimal income = BigDecimal.ZERO;
            BigDecimal expense = BigDecimal.ZERO;
            int count = 0;
            for (Transaction tx : nonNull(transactions)) {
                count++;
                if (tx.isIncome()) {
                    income = income.add(abs(tx));
                } else if (tx.isExpense()) {
                    expense = expense.add(abs(tx));
                }
            }
            return new Totals(income, expense, count);
        }
    }

    private static final class CategoryTotal {

        private String displayName;
        private BigDecimal amount = BigDecimal.ZERO;
        private int count;

        void add(String category, BigDecimal value) {
            String name = category == null ? "" : category.trim();
            if (displayName == null || name.compareTo(displayName) < 0) {
                displayName = name;
            }
            amount = amount.add(value);
            count++;
        }
    }
}
