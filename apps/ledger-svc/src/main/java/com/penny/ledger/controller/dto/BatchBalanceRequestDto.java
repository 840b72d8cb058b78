package com.penny.ledger.controller.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.Map;

public record BatchBalanceRequestDto(@NotNull Map<String, BigDecimal> deltas) {
}
