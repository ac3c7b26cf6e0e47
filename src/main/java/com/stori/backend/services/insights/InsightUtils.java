package com.stori.backend.services.insights;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.stori.backend.entities.Transaction;

public final class InsightUtils {

    private InsightUtils() {
    }

    public static BigDecimal safeAmount(Transaction transaction) {
        if (transaction == null || transaction.getAmount() == null) {
            return BigDecimal.ZERO;
        }
        return transaction.getAmount().abs();
    }

    public static boolean isExpense(Transaction transaction) {
        return transaction != null && transaction.isExpense();
    }

    public static boolean isIncome(Transaction transaction) {
        return transaction != null && transaction.isIncome();
    }

    public static BigDecimal sum(List<Transaction> transactions, boolean expenses) {
        if (transactions == null) {
            return BigDecimal.ZERO;
        }
        return transactions.stream()
                .filter(Objects::nonNull)
                .filter(t -> expenses ? isExpense(t) : isIncome(t))
                .map(InsightUtils::safeAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public static String formatCurrency(BigDecimal amount) {
        NumberFormat nf = NumberFormat.getCurrencyInstance(Locale.US);
        BigDecimal safe = amount != null ? amount : BigDecimal.ZERO;
        return nf.format(safe);
    }
}
