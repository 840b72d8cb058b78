package com.penny.ledger.budget;

import com.penny.ledger.model.PeriodType;
import com.penny.ledger.model.PeriodWindow;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar period arithmetic. Weeks run Sunday through Saturday, months and years follow the
 * calendar. Both ends of a window are inclusive.
 */
public final class BudgetPeriods {

    private BudgetPeriods() {
    }

    public static PeriodWindow getCurrentPeriodDates(String periodType, LocalDate referenceDate) {
        return getCurrentPeriodDates(PeriodType.fromValue(periodType), referenceDate);
    }

    public static PeriodWindow getCurrentPeriodDates(PeriodType periodType, LocalDate referenceDate) {
        return switch (periodType) {
            case WEEKLY -> {
                LocalDate start = referenceDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
                yield new PeriodWindow(start, start.plusDays(6));
            }
            case MONTHLY -> new PeriodWindow(
                    referenceDate.withDayOfMonth(1),
                    referenceDate.with(TemporalAdjusters.lastDayOfMonth()));
            case YEARLY -> new PeriodWindow(
                    referenceDate.with(TemporalAdjusters.firstDayOfYear()),
                    referenceDate.with(TemporalAdjusters.lastDayOfYear()));
        };
    }

    /**
     * The period after the one containing {@code referenceDate}; its start is the current start
     * plus one calendar unit.
     */
    public static PeriodWindow getNextPeriodDates(PeriodType periodType, LocalDate referenceDate) {
        return getCurrentPeriodDates(periodType, shift(periodType, getCurrentPeriodDates(periodType, referenceDate).start(), 1));
    }

    public static PeriodWindow getNextPeriodDates(String periodType, LocalDate referenceDate) {
        return getNextPeriodDates(PeriodType.fromValue(periodType), referenceDate);
    }

    public static PeriodWindow getPreviousPeriodDates(PeriodType periodType, LocalDate referenceDate) {
        return getCurrentPeriodDates(periodType, shift(periodType, getCurrentPeriodDates(periodType, referenceDate).start(), -1));
    }

    public static PeriodWindow getPreviousPeriodDates(String periodType, LocalDate referenceDate) {
        return getPreviousPeriodDates(PeriodType.fromValue(periodType), referenceDate);
    }

    private static LocalDate shift(PeriodType periodType, LocalDate start, int units) {
        return switch (periodType) {
            case WEEKLY -> start.plusWeeks(units);
            case MONTHLY -> start.plusMonths(units);
            case YEARLY -> start.plusYears(units);
        };
    }
}
