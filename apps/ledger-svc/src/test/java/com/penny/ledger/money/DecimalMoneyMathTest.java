package com.penny.ledger.money;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class DecimalMoneyMathTest {

    private final DecimalMoneyMath money = new DecimalMoneyMath();

    @Test
    void addsWithoutBinaryDrift() {
        assertThat(money.add(new BigDecimal("0.1"), new BigDecimal("0.2")))
                .isEqualByComparingTo("0.3");
        assertThat(money.add(new BigDecimal("999999.99"), new BigDecimal("0.01")).toPlainString())
                .isEqualTo("1000000.00");
    }

    @Test
    void keepsExtraPrecisionInsteadOfRounding() {
        assertThat(money.subtract(new BigDecimal("10"), new BigDecimal("0.005")).toPlainString())
                .isEqualTo("9.995");
    }

    @Test
    void parsesStoredTextAndTreatsBlankAsZero() {
        assertThat(money.parse("42.5").toPlainString()).isEqualTo("42.50");
        assertThat(money.parse(" ")).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(money.format(null)).isEqualTo("0.00");
    }

    @Test
    void rejectsMalformedStoredAmount() {
        assertThatThrownBy(() -> money.parse("12,00"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid decimal amount: 12,00");
    }
}
