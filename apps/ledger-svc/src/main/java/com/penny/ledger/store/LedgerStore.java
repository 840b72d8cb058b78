package com.penny.ledger.store;

/**
 * The four storage primitives the ledger is built on: execute, query-all, query-first and
 * run-in-transaction. Transactions do not nest; code that may run while one is open must
 * accept a {@link StoreSession} instead of calling {@link #inTransaction}.
 */
public interface LedgerStore extends StoreSession {

    /**
     * Runs the callback in a new transaction, committing when it returns and rolling back
     * when it throws.
     *
     * @throws com.penny.ledger.error.TransactionConflictException when a transaction is already
     *         open on the calling thread or the store reports a transaction state conflict
     */
    <T> T inTransaction(TransactionCallback<T> callback);

    @FunctionalInterface
    interface TransactionCallback<T> {
        T doInTransaction(StoreSession tx);
    }
}
