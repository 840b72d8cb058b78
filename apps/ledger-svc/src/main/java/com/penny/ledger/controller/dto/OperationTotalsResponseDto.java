package com.penny.ledger.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record OperationTotalsResponseDto(
        String accountId,
        LocalDate from,
        LocalDate to,
        BigDecimal expenses,
        BigDecimal income
) {
}
