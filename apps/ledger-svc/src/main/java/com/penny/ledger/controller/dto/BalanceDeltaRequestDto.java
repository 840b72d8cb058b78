package com.penny.ledger.controller.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record BalanceDeltaRequestDto(@NotNull BigDecimal delta) {
}
