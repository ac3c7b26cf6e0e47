package com.stori.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

import java.time.YearMonth;
import java.util.List;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.stori.backend.dto.InsightDTO;
import com.stori.backend.repositories.BudgetRepository;
import com.stori.backend.repositories.TransactionRepository;
import com.stori.backend.services.insights.providers.InsightProvider;

@ExtendWith(MockitoExtension.class)
class FinancialInsightsServiceTest {

    private static final YearMonth JANUARY = YearMonth.of(2024, 1);

    @Mock
    private TransactionRepository transactionRepository;

    @Mock
    private BudgetRepository budgetRepository;

    private static InsightDTO insight(String message) {
        return InsightDTO.builder().type("info").message(message).category("Test").build();
    }

    private void emptyMonth() {
        when(transactionRepository.listByMonth("u1", JANUARY)).thenReturn(List.of());
        when(budgetRepository.findByMonth("u1", "2024-01")).thenReturn(List.of());
    }

    @Test
    void getInsights_failingProviderIsSkipped() {
        emptyMonth();
        InsightProvider broken = data -> {
            throw new IllegalStateException("boom");
        };
        InsightProvider working = data -> List.of(insight("ok"));

        FinancialInsightsService service = new FinancialInsightsService(transactionRepository, budgetRepository, List.of(broken, working));

        assertEquals(List.of("ok"), service.getInsights("u1", JANUARY).stream().map(InsightDTO::getMessage).toList());
    }

    @Test
    void getInsights_keepsProviderOrder_andCapsAtFive() {
        emptyMonth();
        InsightProvider many = data -> IntStream.range(0, 4).mapToObj(i -> insight("first-" + i)).toList();
        InsightProvider more = data -> IntStream.range(0, 4).mapToObj(i -> insight("second-" + i)).toList();

        FinancialInsightsService service = new FinancialInsightsService(transactionRepository, budgetRepository, List.of(many, more));
        List<String> messages = service.getInsights("u1", JANUARY).stream().map(InsightDTO::getMessage).toList();

        assertEquals(List.of("first-0", "first-1", "first-2", "first-3", "second-0"), messages);
    }
}
