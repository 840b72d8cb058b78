package com.penny.ledger.model;

import java.time.LocalDate;

/**
 * Budget input as received from a caller. Amount and period type stay raw so validation can
 * report malformed values instead of failing on conversion.
 */
public record BudgetDraft(
        String categoryId,
        String amount,
        String currency,
        String periodType,
        LocalDate startDate,
        LocalDate endDate,
        Boolean recurring,
        Boolean rolloverEnabled
) {
}
