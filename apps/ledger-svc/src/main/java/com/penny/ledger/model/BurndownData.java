package com.penny.ledger.model;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

/**
 * Daily balances of one account for a month, laid out for a burndown chart.
 *
 * <p>{@code previous}, {@code planned} and {@code mean} all hold exactly {@code daysInMonth}
 * values, one per day position. {@code previous} repeats the last day of the previous month
 * when that month is shorter and drops its tail when it is longer.
 */
public record BurndownData(
        String accountId,
        YearMonth month,
        int daysInMonth,
        int currentDay,
        boolean currentMonth,
        List<DailyBalance> currentMonthData,
        List<DailyBalance> previousMonthData,
        List<BigDecimal> previous,
        List<BigDecimal> planned,
        List<BigDecimal> mean
) {
}
