package com.penny.ledger.error;

import com.penny.ledger.store.TransactionConflict;

public class TransactionConflictException extends RuntimeException {

    private final TransactionConflict conflict;

    public TransactionConflictException(TransactionConflict conflict, String message) {
        super(message);
        this.conflict = conflict;
    }

    public TransactionConflictException(TransactionConflict conflict, String message, Throwable cause) {
        super(message, cause);
        this.conflict = conflict;
    }

    public TransactionConflict conflict() {
        return conflict;
    }
}
