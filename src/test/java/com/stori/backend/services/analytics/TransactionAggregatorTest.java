package com.stori.backend.services.analytics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.stori.backend.dto.analytics.BudgetUtilizationDTO;
import com.stori.backend.dto.analytics.CategoryBreakdownDTO;
import com.stori.backend.dto.analytics.CategoryBudgetBreakdownDTO;
import com.stori.backend.dto.analytics.FinancialSummaryDTO;
import com.stori.backend.dto.analytics.MonthlyAnalyticsDTO;
import com.stori.backend.dto.analytics.MonthlyAnalyticsWithBudgetDTO;
import com.stori.backend.entities.Budget;
import com.stori.backend.entities.Transaction;
import com.stori.backend.enums.TransactionType;

class TransactionAggregatorTest {

    private static Transaction tx(String date, String amount, String category, TransactionType type) {
        return Transaction.builder()
                .id(category + date)
                .userId("u1")
                .date(Instant.parse(date))
                .amount(new BigDecimal(amount))
                .category(category)
                .description(category)
                .type(type)
                .version(1)
                .build();
    }

    private static List<Transaction> workedExample() {
        return List.of(
                tx("2024-01-15T00:00:00Z", "-50", "food", TransactionType.EXPENSE),
                tx("2024-01-20T00:00:00Z", "2000", "salary", TransactionType.INCOME),
                tx("2024-02-01T00:00:00Z", "-30", "food", TransactionType.EXPENSE));
    }

    private static Budget budget(String category, String amount) {
        return Budget.builder().userId("u1").month("2024-01").category(category).amount(new BigDecimal(amount)).build();
    }

    @Test
    void summarize_workedExample() {
        FinancialSummaryDTO summary = TransactionAggregator.summarize(workedExample());

        assertEquals(new BigDecimal("2000.00"), summary.getTotalIncome());
        assertEquals(new BigDecimal("80.00"), summary.getTotalExpenses());
        assertEquals(new BigDecimal("1920.00"), summary.getBalance());
        assertEquals(new BigDecimal("96.00"), summary.getSavingsRate());
        assertEquals(3, summary.getTransactionCount());

        assertEquals(1, summary.getCategoryBreakdown().size());
        CategoryBreakdownDTO food = summary.getCategoryBreakdown().get(0);
        assertEquals("food", food.getCategory());
        assertEquals(new BigDecimal("80.00"), food.getAmount());
        assertEquals(new BigDecimal("100.00"), food.getPercentage());
        assertEquals(2, food.getTransactionCount());
    }

    @Test
    void summarize_positiveExpenseAmounts_countTheSame() {
        List<Transaction> positive = List.of(
                tx("2024-01-15T00:00:00Z", "50", "food", TransactionType.EXPENSE),
                tx("2024-01-20T00:00:00Z", "2000", "salary", TransactionType.INCOME),
                tx("2024-02-01T00:00:00Z", "30", "food", TransactionType.EXPENSE));

        assertEquals(TransactionAggregator.summarize(workedExample()).getBalance(),
                TransactionAggregator.summarize(positive).getBalance());
    }

    @Test
    void summarize_percentagesSumToHundred() {
        List<Transaction> txs = List.of(
                tx("2024-01-01T00:00:00Z", "-10", "a", TransactionType.EXPENSE),
                tx("2024-01-02T00:00:00Z", "-10", "b", TransactionType.EXPENSE),
                tx("2024-01-03T00:00:00Z", "-10", "c", TransactionType.EXPENSE));

        BigDecimal total = TransactionAggregator.summarize(txs).getCategoryBreakdown().stream()
                .map(CategoryBreakdownDTO::getPercentage)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        assertTrue(total.subtract(new BigDecimal("100")).abs().compareTo(new BigDecimal("0.05")) <= 0, total.toPlainString());
    }

    @Test
    void summarize_noExpenses_zeroPercentagesAndNoDivision() {
        FinancialSummaryDTO summary = TransactionAggregator.summarize(List.of());

        assertEquals(0, summary.getSavingsRate().signum());
        assertTrue(summary.getCategoryBreakdown().isEmpty());
        assertEquals(0, summary.getTransactionCount());
    }

    @Test
    void summarize_isOrderIndependent() {
        List<Transaction> shuffled = new ArrayList<>(workedExample());
        Collections.reverse(shuffled);

        FinancialSummaryDTO a = TransactionAggregator.summarize(workedExample());
        FinancialSummaryDTO b = TransactionAggregator.summarize(shuffled);

        assertEquals(a.getBalance(), b.getBalance());
        assertEquals(a.getCategoryBreakdown(), b.getCategoryBreakdown());
    }

    @Test
    void summarize_groupsCategoriesIgnoringCase_sortedByName() {
        List<Transaction> txs = List.of(
                tx("2024-01-01T00:00:00Z", "-10", "Rent", TransactionType.EXPENSE),
                tx("2024-01-02T00:00:00Z", "-10", "food", TransactionType.EXPENSE),
                tx("2024-01-03T00:00:00Z", "-10", "FOOD", TransactionType.EXPENSE));

        List<CategoryBreakdownDTO> breakdown = TransactionAggregator.summarize(txs).getCategoryBreakdown();

        assertEquals(List.of("FOOD", "Rent"), breakdown.stream().map(CategoryBreakdownDTO::getCategory).toList());
        assertEquals(2, breakdown.get(0).getTransactionCount());
    }

    @Test
    void monthlyAnalytics_netPerCategory() {
        List<Transaction> january = workedExample().subList(0, 2);

        MonthlyAnalyticsDTO analytics = TransactionAggregator.monthlyAnalytics(YearMonth.of(2024, 1), january);

        assertEquals("2024-01", analytics.getMonth());
        assertEquals(new BigDecimal("1950.00"), analytics.getBalance());
        assertEquals(new BigDecimal("-50.00"), analytics.getCategoryBreakdown().get("food"));
        assertEquals(new BigDecimal("2000.00"), analytics.getCategoryBreakdown().get("salary"));
        assertEquals(2, analytics.getTransactionCount());
    }

    @Test
    void budgetBreakdown_unionOfSpendingAndBudgets() {
        List<Transaction> january = workedExample().subList(0, 2);

        MonthlyAnalyticsWithBudgetDTO result = TransactionAggregator.budgetBreakdown(
                YearMonth.of(2024, 1), january, List.of(budget("Food", "40"), budget("rent", "1000")));

        List<CategoryBudgetBreakdownDTO> rows = result.getCategoryBreakdown();
        assertEquals(List.of("Food", "rent"), rows.stream().map(CategoryBudgetBreakdownDTO::getCategory).toList());
        assertEquals(new BigDecimal("50.00"), rows.get(0).getSpent());
        assertEquals(new BigDecimal("-10.00"), rows.get(0).getRemaining());
        assertEquals(new BigDecimal("0.00"), rows.get(1).getSpent());
        assertEquals(new BigDecimal("1000.00"), rows.get(1).getRemaining());
    }

    @Test
    void budgetUtilization_percentageOfBudget_zeroBudgetIsZero() {
        List<Transaction> january = workedExample().subList(0, 2);

        List<BudgetUtilizationDTO> rows = TransactionAggregator.budgetUtilization(
                january, List.of(budget("food", "200"), budget("travel", "0")));

        assertEquals(2, rows.size());
        assertEquals(new BigDecimal("25.00"), rows.get(0).getPercentage());
        assertEquals(new BigDecimal("150.00"), rows.get(0).getRemaining());
        assertEquals(0, rows.get(1).getPercentage().signum());
    }
}
