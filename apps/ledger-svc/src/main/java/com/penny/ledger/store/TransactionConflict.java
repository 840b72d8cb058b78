package com.penny.ledger.store;

import com.penny.ledger.error.TransactionConflictException;
import java.util.Locale;
import java.util.Optional;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.NoTransactionException;

/**
 * Recoverable transaction-state conflicts. These are expected while a schema step or another
 * caller holds the single store connection in a transaction; callers treat them as
 * "try again on the next pass" rather than as failures.
 */
public enum TransactionConflict {
    NESTED_TRANSACTION,
    ROLLBACK_FAILED,
    NO_ACTIVE_TRANSACTION;

    /**
     * Classifies a failure by walking its cause chain. Driver messages are only inspected
     * here; every other component switches on the returned constant. Commit failures such as
     * a locked database are not conflicts and classify as empty.
     */
    public static Optional<TransactionConflict> classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            Optional<TransactionConflict> match = classifyOne(current);
            if (match.isPresent()) {
                return match;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return Optional.empty();
    }

    private static Optional<TransactionConflict> classifyOne(Throwable error) {
        if (error instanceof TransactionConflictException conflict) {
            return Optional.of(conflict.conflict());
        }
        if (error instanceof IllegalTransactionStateException) {
            return Optional.of(NESTED_TRANSACTION);
        }
        if (error instanceof NoTransactionException) {
            return Optional.of(NO_ACTIVE_TRANSACTION);
        }
        String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("transaction within a transaction")) {
            return Optional.of(NESTED_TRANSACTION);
        }
        if (message.contains("no transaction is active")) {
            return Optional.of(NO_ACTIVE_TRANSACTION);
        }
        if (message.contains("cannot rollback")) {
            return Optional.of(ROLLBACK_FAILED);
        }
        return Optional.empty();
    }
}
