package com.penny.ledger.money;

import java.math.BigDecimal;

/**
 * Exact decimal arithmetic for stored money values. Amounts are persisted as text and never
 * pass through a floating type.
 */
public interface MoneyMath {

    BigDecimal add(BigDecimal left, BigDecimal right);

    BigDecimal subtract(BigDecimal left, BigDecimal right);

    BigDecimal parse(String stored);

    String format(BigDecimal amount);
}
