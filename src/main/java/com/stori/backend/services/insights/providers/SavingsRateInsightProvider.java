package com.stori.backend.services.insights.providers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.stori.backend.dto.InsightDTO;
import com.stori.backend.services.analytics.TransactionAggregator;
import com.stori.backend.services.insights.InsightUtils;
import com.stori.backend.services.insights.MonthlyInsightData;

@Component
@Order(40)
public class SavingsRateInsightProvider implements InsightProvider {

    private static final BigDecimal HEALTHY_RATE = new BigDecimal("20");

    @Override
    public List<InsightDTO> generate(MonthlyInsightData data) {
        BigDecimal income = InsightUtils.sum(data.transactions(), false);
        if (income.signum() <= 0) {
            return List.of();
        }

        BigDecimal expenses = InsightUtils.sum(data.transactions(), true);
        BigDecimal rate = TransactionAggregator.percentageOf(income.subtract(expenses), income);
        String shown = rate.setScale(0, RoundingMode.HALF_UP).toPlainString();

        if (rate.compareTo(HEALTHY_RATE) >= 0) {
            return List.of(InsightDTO.builder()
                    .type("success")
                    .message(String.format("You kept %s%% of your income this month", shown))
                    .category("Savings")
                    .build());
        }
        if (rate.signum() <= 0) {
            return List.of();
        }
        return List.of(InsightDTO.builder()
                .type("info")
                .message(String.format("You saved %s%% of your income, below the %s%% target", shown, HEALTHY_RATE.toPlainString()))
                .category("Savings")
                .build());
    }
}
