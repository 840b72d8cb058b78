package com.penny.ledger.event;

/**
 * Refresh hint published after a ledger mutation. Nothing in the ledger depends on delivery.
 */
public record LedgerEvent(Kind kind, String subjectId) {

    public enum Kind {
        OPERATION_CHANGED,
        BALANCES_CHANGED,
        ACCOUNTS_CHANGED,
        CATEGORIES_CHANGED,
        BUDGETS_CHANGED,
        HISTORY_CHANGED
    }

    public static LedgerEvent of(Kind kind) {
        return new LedgerEvent(kind, null);
    }
}
