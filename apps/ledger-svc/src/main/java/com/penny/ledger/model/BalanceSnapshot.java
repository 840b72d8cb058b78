package com.penny.ledger.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * End-of-day balance of one account.
 */
public record BalanceSnapshot(String accountId, LocalDate date, BigDecimal balance, Instant createdAt) {
}
