package com.penny.ledger.error;

public class LedgerValidationException extends IllegalArgumentException {

    public LedgerValidationException(String message) {
        super(message);
    }
}
