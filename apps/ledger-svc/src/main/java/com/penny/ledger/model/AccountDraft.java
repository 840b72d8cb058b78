package com.penny.ledger.model;

import java.math.BigDecimal;

/**
 * Input for a new account. Null currency falls back to the configured default and a null
 * balance opens the account at zero.
 */
public record AccountDraft(
        String name,
        String currency,
        BigDecimal balance,
        Boolean hidden,
        BigDecimal monthlyTarget
) {
}
