package com.penny.ledger.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public record Budget(
        String id,
        String categoryId,
        BigDecimal amount,
        String currency,
        PeriodType periodType,
        LocalDate startDate,
        LocalDate endDate,
        boolean recurring,
        boolean rolloverEnabled,
        Instant createdAt,
        Instant updatedAt
) {
}
