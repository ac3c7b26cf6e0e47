package com.stori.backend.services;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.stori.backend.dto.InsightDTO;
import com.stori.backend.entities.Budget;
import com.stori.backend.entities.Transaction;
import com.stori.backend.repositories.BudgetRepository;
import com.stori.backend.repositories.TransactionRepository;
import com.stori.backend.services.insights.MonthlyInsightData;
import com.stori.backend.services.insights.providers.InsightProvider;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the insight providers in order over one month of data. A provider that throws is skipped.
 */
@Slf4j
@Service
public class FinancialInsightsService {

    static final int MAX_INSIGHTS = 5;

    private final TransactionRepository transactionRepository;
    private final BudgetRepository budgetRepository;
    private final List<InsightProvider> providers;

    public FinancialInsightsService(TransactionRepository transactionRepository,
                                    BudgetRepository budgetRepository,
                                    List<InsightProvider> providers) {
        this.transactionRepository = transactionRepository;
        this.budgetRepository = budgetRepository;
        this.providers = providers;
    }

    public List<InsightDTO> getInsights(String userId, YearMonth month) {
        List<Transaction> transactions = transactionRepository.listByMonth(userId, month);
        List<Budget> budgets = budgetRepository.findByMonth(userId, month.toString());
        MonthlyInsightData data = new MonthlyInsightData(userId, month, transactions, budgets);

        List<InsightDTO> insights = new ArrayList<>();
        for (InsightProvider provider : providers) {
            if (insights.size() >= MAX_INSIGHTS) {
                break;
            }
            try {
                List<InsightDTO> generated = provider.generate(data);
                if (generated != null) {
                    insights.addAll(generated);
                }
            } catch (RuntimeException e) {
                log.warn("Insight provider {} failed for user {} month {}: {}",
                        provider.getClass().getSimpleName(), userId, month, e.getMessage());
            }
        }

        return insights.size() > MAX_INSIGHTS ? List.copyOf(insights.subList(0, MAX_INSIGHTS)) : insights;
    }
}
