package com.stori.backend.dto.analytics;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryBudgetBreakdownDTO {

    private String category;
    private BigDecimal spent;
    private BigDecimal budget;

    /** budget - spent, negative when overspent */
    private BigDecimal remaining;
}
