package com.penny.ledger.error;

public class LedgerNotFoundException extends RuntimeException {

    private final String entity;
    private final String id;

    public LedgerNotFoundException(String entity, String id) {
        super(entity + " " + id + " not found");
        this.entity = entity;
        this.id = id;
    }

    public String entity() {
        return entity;
    }

    public String id() {
        return id;
    }
}
