package com.stori.backend.services.insights.providers;

import java.math.RoundingMode;
import java.util.List;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.stori.backend.dto.InsightDTO;
import com.stori.backend.dto.analytics.CategoryBreakdownDTO;
import com.stori.backend.dto.analytics.FinancialSummaryDTO;
import com.stori.backend.services.analytics.TransactionAggregator;
import com.stori.backend.services.insights.InsightUtils;
import com.stori.backend.services.insights.MonthlyInsightData;

@Component
@Order(20)
public class TopCategoryInsightProvider implements InsightProvider {

    @Override
    public List<InsightDTO> generate(MonthlyInsightData data) {
        FinancialSummaryDTO summary = TransactionAggregator.summarize(data.transactions());
        if (summary.getCategoryBreakdown().isEmpty()) {
            return List.of();
        }

        // ties go to the first category by name
        CategoryBreakdownDTO top = summary.getCategoryBreakdown().get(0);
        for (CategoryBreakdownDTO candidate : summary.getCategoryBreakdown()) {
            if (candidate.getAmount().compareTo(top.getAmount()) > 0) {
                top = candidate;
            }
        }

        return List.of(InsightDTO.builder()
                .type("info")
                .message(String.format(
                        "Your highest spending category was %s with %s (%s%% of expenses)",
                        top.getCategory(),
                        InsightUtils.formatCurrency(top.getAmount()),
                        top.getPercentage().setScale(0, RoundingMode.HALF_UP).toPlainString()
                ))
                .category("Spending")
                .build());
    }
}
