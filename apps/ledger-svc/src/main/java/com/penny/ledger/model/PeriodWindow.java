package com.penny.ledger.model;

import java.time.LocalDate;

/**
 * Calendar period; both ends inclusive.
 */
public record PeriodWindow(LocalDate start, LocalDate end) {

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }
}
