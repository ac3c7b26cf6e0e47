package com.stori.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.stori.backend.dto.InsightDTO;
import com.stori.backend.dto.analytics.CategoryOptionDTO;
import com.stori.backend.dto.analytics.FinancialSummaryDTO;
import com.stori.backend.dto.analytics.MonthlyAnalyticsWithBudgetDTO;
import com.stori.backend.entities.Budget;
import com.stori.backend.entities.Transaction;
import com.stori.backend.enums.TransactionType;
import com.stori.backend.exceptions.BadRequestException;
import com.stori.backend.repositories.BudgetRepository;
import com.stori.backend.repositories.TransactionRepository;

@ExtendWith(MockitoExtension.class)
class AnalyticsServiceTest {

    private static final YearMonth JANUARY = YearMonth.of(2024, 1);

    @Mock
    private TransactionRepository transactionRepository;

    @Mock
    private BudgetRepository budgetRepository;

    @Mock
    private FinancialInsightsService financialInsightsService;

    @InjectMocks
    private AnalyticsService analyticsService;

    private static Transaction tx(String id, String date, String amount, String category, TransactionType type) {
        return Transaction.builder()
                .id(id)
                .userId("u1")
                .date(Instant.parse(date))
                .amount(new BigDecimal(amount))
                .category(category)
                .description(id)
                .type(type)
                .version(1)
                .build();
    }

    private static List<Transaction> history() {
        return List.of(
                tx("t3", "2024-02-01T00:00:00Z", "-30", "food", TransactionType.EXPENSE),
                tx("t2", "2024-01-20T00:00:00Z", "2000", "salary", TransactionType.INCOME),
                tx("t1", "2024-01-15T00:00:00Z", "-50", "food", TransactionType.EXPENSE));
    }

    @Test
    void getFinancialSummary_coversWholeHistory() {
        when(transactionRepository.listByUser("u1")).thenReturn(history());

        FinancialSummaryDTO summary = analyticsService.getFinancialSummary("u1");

        assertEquals(new BigDecimal("80.00"), summary.getTotalExpenses());
        assertEquals(new BigDecimal("96.00"), summary.getSavingsRate());
    }

    @Test
    void getMonthlySummary_onlyThatMonth() {
        when(transactionRepository.listByMonth("u1", JANUARY)).thenReturn(history().subList(1, 3));

        FinancialSummaryDTO summary = analyticsService.getMonthlySummary("u1", "2024-01");

        assertEquals(new BigDecimal("50.00"), summary.getTotalExpenses());
        assertEquals(new BigDecimal("1950.00"), summary.getBalance());
    }

    @Test
    void getFinancialSummaryWithBudgets_readsMonthBudgets() {
        when(transactionRepository.listByMonth("u1", JANUARY)).thenReturn(history().subList(1, 3));
        when(budgetRepository.findByMonth("u1", "2024-01")).thenReturn(List.of(
                Budget.builder().userId("u1").month("2024-01").category("food").amount(new BigDecimal("100")).build()));

        MonthlyAnalyticsWithBudgetDTO result = analyticsService.getFinancialSummaryWithBudgets("u1", "2024-01");

        assertEquals(1, result.getCategoryBreakdown().size());
        assertEquals(new BigDecimal("50.00"), result.getCategoryBreakdown().get(0).getRemaining());
    }

    @Test
    void getUniqueCategories_andOptions() {
        when(transactionRepository.listByUser("u1")).thenReturn(List.of(
                tx("a", "2024-01-01T00:00:00Z", "-1", "food", TransactionType.EXPENSE),
                tx("b", "2024-01-02T00:00:00Z", "-1", "Food", TransactionType.EXPENSE),
                tx("c", "2024-01-03T00:00:00Z", "10", "salary", TransactionType.INCOME)));

        List<CategoryOptionDTO> options = analyticsService.getCategoryOptions("u1");

        assertEquals(2, options.size());
        assertEquals("Food", options.get(0).getLabel());
        assertEquals("Food", options.get(0).getValue());
        assertEquals("Salary", options.get(1).getLabel());
        assertEquals("salary", options.get(1).getValue());
    }

    @Test
    void getMonthsWithTransactions_newestFirst() {
        when(transactionRepository.listByUser("u1")).thenReturn(history());

        assertEquals(List.of("2024-02", "2024-01"), analyticsService.getMonthsWithTransactions("u1"));
    }

    @Test
    void getFinancialInsights_delegatesWithParsedMonth() {
        List<InsightDTO> insights = List.of(InsightDTO.builder().type("info").message("hi").category("Balance").build());
        when(financialInsightsService.getInsights("u1", JANUARY)).thenReturn(insights);

        assertEquals(insights, analyticsService.getFinancialInsights("u1", "2024-01"));
        verify(financialInsightsService).getInsights("u1", JANUARY);
    }

    @Test
    void missingUser_isBadRequest() {
        assertThrows(BadRequestException.class, () -> analyticsService.getFinancialSummary(" "));
        verifyNoInteractions(transactionRepository);
    }
}
