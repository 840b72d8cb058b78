package com.penny.ledger.model;

import java.math.BigDecimal;

public record AccountBalanceOnDate(String accountId, String name, String currency, BigDecimal balance) {
}
