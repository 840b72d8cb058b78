package com.penny.ledger.controller.dto;

import jakarta.validation.constraints.NotNull;
import java.util.List;

public record AccountsOrderRequestDto(@NotNull List<String> accountIds) {
}
