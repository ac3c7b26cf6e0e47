package com.stori.backend.dto.analytics;

import java.math.BigDecimal;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyAnalyticsDTO {

    private String month;
    private BigDecimal totalIncome;
    private BigDecimal totalExpense;
    private BigDecimal balance;

    /** Net amount per category: income positive, expenses negative. */
    private Map<String, BigDecimal> categoryBreakdown;

    private int transactionCount;
}
