package com.penny.ledger.model;

import java.math.BigDecimal;
import java.time.Instant;

public record Account(
        String id,
        String name,
        BigDecimal balance,
        String currency,
        int displayOrder,
        boolean hidden,
        BigDecimal monthlyTarget,
        Instant createdAt,
        Instant updatedAt
) {
}
