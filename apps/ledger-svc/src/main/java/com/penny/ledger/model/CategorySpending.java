package com.penny.ledger.model;

import java.math.BigDecimal;

public record CategorySpending(String categoryId, String currency, BigDecimal total) {
}
