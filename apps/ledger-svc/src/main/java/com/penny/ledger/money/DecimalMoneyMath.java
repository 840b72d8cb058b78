package com.penny.ledger.money;

import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

@Component
public class DecimalMoneyMath implements MoneyMath {

    private static final int MIN_SCALE = 2;
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(MIN_SCALE, RoundingMode.HALF_UP);

    @Override
    public BigDecimal add(BigDecimal left, BigDecimal right) {
        return normalize(orZero(left).add(orZero(right)));
    }

    @Override
    public BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return normalize(orZero(left).subtract(orZero(right)));
    }

    @Override
    public BigDecimal parse(String stored) {
        if (stored == null || stored.isBlank()) {
            return ZERO;
        }
        try {
            return normalize(new BigDecimal(stored.trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid decimal amount: " + stored, ex);
        }
    }

    @Override
    public String format(BigDecimal amount) {
        return normalize(orZero(amount)).toPlainString();
    }

    // keeps at least cents; never rounds away extra precision
    private BigDecimal normalize(BigDecimal value) {
        return value.scale() < MIN_SCALE ? value.setScale(MIN_SCALE, RoundingMode.UNNECESSARY) : value;
    }

    private BigDecimal orZero(BigDecimal value) {
        return value == null ? ZERO : value;
    }
}
