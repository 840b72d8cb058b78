package com.penny.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Journal entry input. On update, null fields keep the stored value.
 */
public record OperationDraft(
        OperationType type,
        BigDecimal amount,
        String accountId,
        String categoryId,
        String toAccountId,
        LocalDate date,
        String description,
        BigDecimal exchangeRate,
        BigDecimal destinationAmount,
        String sourceCurrency,
        String destinationCurrency
) {
}
