package com.penny.ledger.model;

import java.math.BigDecimal;

/**
 * Partial account update; null fields are left unchanged. The balance is not editable here.
 */
public record AccountUpdate(
        String name,
        String currency,
        Boolean hidden,
        BigDecimal monthlyTarget
) {
}
