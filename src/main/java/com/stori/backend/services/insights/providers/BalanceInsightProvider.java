package com.stori.backend.services.insights.providers;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.stori.backend.dto.InsightDTO;
import com.stori.backend.services.insights.InsightUtils;
import com.stori.backend.services.insights.MonthlyInsightData;

@Component
@Order(10)
public class BalanceInsightProvider implements InsightProvider {

    @Override
    public List<InsightDTO> generate(MonthlyInsightData data) {
        if (data.transactions().isEmpty()) {
            return List.of();
        }

        BigDecimal income = InsightUtils.sum(data.transactions(), false);
        BigDecimal expenses = InsightUtils.sum(data.transactions(), true);
        BigDecimal balance = income.subtract(expenses);

        if (balance.signum() > 0) {
            return List.of(InsightDTO.builder()
                    .type("success")
                    .message(String.format("Great! You saved %s this month", InsightUtils.formatCurrency(balance)))
                    .category("Balance")
                    .build());
        }
        if (balance.signum() < 0) {
            return List.of(InsightDTO.builder()
                    .type("warning")
                    .message(String.format("You spent %s more than you earned this month", InsightUtils.formatCurrency(balance.negate())))
                    .category("Balance")
                    .build());
        }
        return List.of(InsightDTO.builder()
                .type("info")
                .message("You broke even this month")
                .category("Balance")
                .build());
    }
}
