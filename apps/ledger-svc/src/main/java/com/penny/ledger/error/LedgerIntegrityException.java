package com.penny.ledger.error;

import java.util.OptionalInt;

/**
 * A write that would break a ledger constraint: deleting a referenced row, a category cycle,
 * or a transfer between accounts of different currencies.
 */
public class LedgerIntegrityException extends RuntimeException {

    private final Integer count;

    public LedgerIntegrityException(String message) {
        this(message, null);
    }

    public LedgerIntegrityException(String message, Integer count) {
        super(message);
        this.count = count;
    }

    public OptionalInt count() {
        return count == null ? OptionalInt.empty() : OptionalInt.of(count);
    }
}
