package com.penny.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * End-of-day balance at a 1-based position within its month.
 */
public record DailyBalance(int day, LocalDate date, BigDecimal balance) {
}
