package com.penny.ledger.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * The hidden expense/income pair that holds synthetic balance-adjustment entries.
 */
public record ShadowCategories(Category expense, Category income) {

    public static final String EXPENSE_ID = "shadow-adjustment-expense";
    public static final String INCOME_ID = "shadow-adjustment-income";

    public ShadowCategories {
        Objects.requireNonNull(expense, "expense");
        Objects.requireNonNull(income, "income");
    }

    /**
     * Category for an adjustment of the given signed size: income when positive, expense otherwise.
     */
    public Category forDelta(BigDecimal delta) {
        return delta.signum() > 0 ? income : expense;
    }

    public boolean contains(String categoryId) {
        return expense.id().equals(categoryId) || income.id().equals(categoryId);
    }
}
