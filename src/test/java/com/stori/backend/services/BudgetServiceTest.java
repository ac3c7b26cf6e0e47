package com.stori.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
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

import com.stori.backend.dto.analytics.BudgetUtilizationDTO;
import com.stori.backend.entities.Budget;
import com.stori.backend.entities.Transaction;
import com.stori.backend.enums.TransactionType;
import com.stori.backend.exceptions.BadRequestException;
import com.stori.backend.repositories.BudgetRepository;
import com.stori.backend.repositories.TransactionRepository;

@ExtendWith(MockitoExtension.class)
class BudgetServiceTest {

    @Mock
    private BudgetRepository budgetRepository;

    @Mock
    private TransactionRepository transactionRepository;

    @InjectMocks
    private BudgetService budgetService;

    @Test
    void createOrUpdateBudget_validValues_roundsAmount() {
        when(budgetRepository.upsert(any(Budget.class))).thenAnswer(inv -> inv.getArgument(0));

        Budget saved = budgetService.createOrUpdateBudget("u1", "2024-01", " food ", new BigDecimal("300.456"));

        assertEquals(new BigDecimal("300.46"), saved.getAmount());
        assertEquals("food", saved.getCategory());
        assertEquals("2024-01", saved.getMonth());
    }

    @Test
    void createOrUpdateBudget_negativeAmount_isBadRequest() {
        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> budgetService.createOrUpdateBudget("u1", "2024-01", "food", new BigDecimal("-1")));

        assertEquals("budget amount cannot be negative", ex.getMessage());
        verify(budgetRepository, never()).upsert(any());
    }

    @Test
    void createOrUpdateBudget_badMonth_isBadRequest() {
        assertThrows(BadRequestException.class,
                () -> budgetService.createOrUpdateBudget("u1", "01-2024", "food", BigDecimal.TEN));
        verifyNoInteractions(budgetRepository);
    }

    @Test
    void getBudgetUtilization_joinsMonthBudgetsWithMonthExpenses() {
        YearMonth january = YearMonth.of(2024, 1);
        when(budgetRepository.findByMonth("u1", "2024-01")).thenReturn(List.of(
                Budget.builder().userId("u1").month("2024-01").category("Food").amount(new BigDecimal("100")).build()));
        when(transactionRepository.listByMonth("u1", january)).thenReturn(List.of(
                Transaction.builder().id("t1").userId("u1").category("food").description("x")
                        .amount(new BigDecimal("-120")).type(TransactionType.EXPENSE)
                        .date(Instant.parse("2024-01-10T00:00:00Z")).build()));

        List<BudgetUtilizationDTO> rows = budgetService.getBudgetUtilization("u1", "2024-01");

        assertEquals(1, rows.size());
        assertEquals(new BigDecimal("120.00"), rows.get(0).getSpentAmount());
        assertEquals(new BigDecimal("-20.00"), rows.get(0).getRemaining());
        assertEquals(new BigDecimal("120.00"), rows.get(0).getPercentage());
    }

    @Test
    void getBudgetUtilization_noBudgets_skipsTransactionLookup() {
        when(budgetRepository.findByMonth("u1", "2024-01")).thenReturn(List.of());

        assertTrue(budgetService.getBudgetUtilization("u1", "2024-01").isEmpty());
        verifyNoInteractions(transactionRepository);
    }
}
