package com.penny.ledger.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One journal entry. Transfers move {@code amount} out of {@code accountId} and credit
 * {@code destinationAmount} (or {@code amount} for same-currency transfers) to {@code toAccountId}.
 */
public record Operation(
        String id,
        OperationType type,
        BigDecimal amount,
        String accountId,
        String categoryId,
        String toAccountId,
        LocalDate date,
        Instant createdAt,
        String description,
        BigDecimal exchangeRate,
        BigDecimal destinationAmount,
        String sourceCurrency,
        String destinationCurrency
) {

    public boolean isTransfer() {
        return type == OperationType.TRANSFER;
    }

    public BigDecimal creditedAmount() {
        return destinationAmount != null ? destinationAmount : amount;
    }
}
