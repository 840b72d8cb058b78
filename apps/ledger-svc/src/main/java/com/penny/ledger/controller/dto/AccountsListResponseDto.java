package com.penny.ledger.controller.dto;

import com.penny.ledger.model.Account;
import java.util.List;

public record AccountsListResponseDto(List<Account> accounts, String traceId) {
}
