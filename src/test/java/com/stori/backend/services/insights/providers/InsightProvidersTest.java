package com.stori.backend.services.insights.providers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.stori.backend.dto.InsightDTO;
import com.stori.backend.entities.Budget;
import com.stori.backend.entities.Transaction;
import com.stori.backend.enums.TransactionType;
import com.stori.backend.services.insights.MonthlyInsightData;

class InsightProvidersTest {

    private static final YearMonth JANUARY = YearMonth.of(2024, 1);

    private static Transaction tx(String amount, String category, TransactionType type) {
        return Transaction.builder()
                .id(category + amount)
                .userId("u1")
                .date(Instant.parse("2024-01-10T00:00:00Z"))
                .amount(new BigDecimal(amount))
                .category(category)
                .description(category)
                .type(type)
                .build();
    }

    private static MonthlyInsightData data(List<Transaction> txs, List<Budget> budgets) {
        return new MonthlyInsightData("u1", JANUARY, txs, budgets);
    }

    @Test
    void balance_positive_isSuccess() {
        List<InsightDTO> out = new BalanceInsightProvider().generate(data(List.of(
                tx("2000", "salary", TransactionType.INCOME),
                tx("-50", "food", TransactionType.EXPENSE)), List.of()));

        assertEquals(1, out.size());
        assertEquals("success", out.get(0).getType());
        assertEquals("Great! You saved $1,950.00 this month", out.get(0).getMessage());
    }

    @Test
    void balance_negative_isWarning() {
        List<InsightDTO> out = new BalanceInsightProvider().generate(data(List.of(
                tx("100", "salary", TransactionType.INCOME),
                tx("-150", "food", TransactionType.EXPENSE)), List.of()));

        assertEquals("warning", out.get(0).getType());
        assertEquals("You spent $50.00 more than you earned this month", out.get(0).getMessage());
    }

    @Test
    void balance_noTransactions_nothing() {
        assertTrue(new BalanceInsightProvider().generate(data(List.of(), List.of())).isEmpty());
    }

    @Test
    void topCategory_picksLargestExpense() {
        List<InsightDTO> out = new TopCategoryInsightProvider().generate(data(List.of(
                tx("-30", "food", TransactionType.EXPENSE),
                tx("-90", "rent", TransactionType.EXPENSE),
                tx("500", "salary", TransactionType.INCOME)), List.of()));

        assertEquals("Your highest spending category was rent with $90.00 (75% of expenses)", out.get(0).getMessage());
    }

    @Test
    void budgetOverrun_onlyOverspentBudgets() {
        List<Budget> budgets = List.of(
                Budget.builder().userId("u1").month("2024-01").category("Food").amount(new BigDecimal("20")).build(),
                Budget.builder().userId("u1").month("2024-01").category("rent").amount(new BigDecimal("1000")).build());

        List<InsightDTO> out = new BudgetOverrunInsightProvider().generate(data(List.of(
                tx("-30", "food", TransactionType.EXPENSE),
                tx("-90", "rent", TransactionType.EXPENSE)), budgets));

        assertEquals(1, out.size());
        assertEquals("alert", out.get(0).getType());
        assertEquals("You spent $30.00 on Food, but the budget was $20.00 (over by $10.00)", out.get(0).getMessage());
    }

    @Test
    void savingsRate_healthyAndLow() {
        List<InsightDTO> healthy = new SavingsRateInsightProvider().generate(data(List.of(
                tx("1000", "salary", TransactionType.INCOME),
                tx("-500", "rent", TransactionType.EXPENSE)), List.of()));
        List<InsightDTO> low = new SavingsRateInsightProvider().generate(data(List.of(
                tx("1000", "salary", TransactionType.INCOME),
                tx("-950", "rent", TransactionType.EXPENSE)), List.of()));

        assertEquals("You kept 50% of your income this month", healthy.get(0).getMessage());
        assertEquals("You saved 5% of your income, below the 20% target", low.get(0).getMessage());
    }

    @Test
    void savingsRate_noIncome_nothing() {
        assertTrue(new SavingsRateInsightProvider().generate(data(List.of(
                tx("-10", "food", TransactionType.EXPENSE)), List.of())).isEmpty());
    }
}
