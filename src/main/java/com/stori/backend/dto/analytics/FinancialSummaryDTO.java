package com.stori.backend.dto.analytics;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Income and expense totals over a set of transactions. Expenses are reported as a positive amount.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialSummaryDTO {

    private BigDecimal totalIncome;
    private BigDecimal totalExpenses;
    private BigDecimal balance;

    /** Percentage of income kept, 0 when there is no income. */
    private BigDecimal savingsRate;

    /** Expense categories sorted by name. */
    private List<CategoryBreakdownDTO> categoryBreakdown;

    private int transactionCount;
    private Instant generatedAt;
}
