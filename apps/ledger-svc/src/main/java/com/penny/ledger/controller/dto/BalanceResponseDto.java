package com.penny.ledger.controller.dto;

import java.math.BigDecimal;

public record BalanceResponseDto(String accountId, BigDecimal balance) {
}
