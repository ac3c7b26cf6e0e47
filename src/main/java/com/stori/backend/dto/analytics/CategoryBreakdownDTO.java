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
public class CategoryBreakdownDTO {

    private String category;
    private BigDecimal amount;
    private BigDecimal percentage;
    private int transactionCount;
}
