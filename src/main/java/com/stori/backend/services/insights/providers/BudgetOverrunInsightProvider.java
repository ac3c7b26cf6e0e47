package com.stori.backend.services.insights.providers;

import java.util.List;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.stori.backend.dto.InsightDTO;
import com.stori.backend.dto.analytics.BudgetUtilizationDTO;
import com.stori.backend.services.analytics.TransactionAggregator;
import com.stori.backend.services.insights.InsightUtils;
import com.stori.backend.services.insights.MonthlyInsightData;

@Component
@Order(30)
public class BudgetOverrunInsightProvider implements InsightProvider {

    @Override
    public List<InsightDTO> generate(MonthlyInsightData data) {
        if (data.budgets().isEmpty() || data.transactions().isEmpty()) {
            return List.of();
        }

        return TransactionAggregator.budgetUtilization(data.transactions(), data.budgets()).stream()
                .filter(u -> u.getBudgetAmount().signum() > 0)
                .filter(u -> u.getRemaining().signum() < 0)
                .map(this::toInsight)
                .toList();
    }

    private InsightDTO toInsight(BudgetUtilizationDTO utilization) {
        return InsightDTO.builder()
                .type("alert")
                .message(String.format(
                        "You spent %s on %s, but the budget was %s (over by %s)",
                        InsightUtils.formatCurrency(utilization.getSpentAmount()),
                        utilization.getCategory(),
                        InsightUtils.formatCurrency(utilization.getBudgetAmount()),
                        InsightUtils.formatCurrency(utilization.getRemaining().negate())
                ))
                .category("Budget")
                .build();
    }
}
