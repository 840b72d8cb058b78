package com.penny.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record BudgetStatus(
        String budgetId,
        BigDecimal amount,
        BigDecimal spent,
        BigDecimal remaining,
        int percentage,
        boolean exceeded,
        LocalDate periodStart,
        LocalDate periodEnd,
        BudgetHealth status
) {
}
