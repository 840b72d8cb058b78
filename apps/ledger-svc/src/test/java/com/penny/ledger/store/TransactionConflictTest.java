package com.penny.ledger.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.penny.ledger.error.TransactionConflictException;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.UnexpectedRollbackException;

class TransactionConflictTest {

    @Test
    void classifiesSpringTransactionStateErrors() {
        assertThat(TransactionConflict.classify(new IllegalTransactionStateException("already active")))
                .contains(TransactionConflict.NESTED_TRANSACTION);
    }

    @Test
    void classifiesDriverMessagesAnywhereInTheCauseChain() {
        RuntimeException wrapped = new RuntimeException("batch failed",
                new SQLException("[SQLITE_ERROR] cannot start a transaction within a transaction"));
        assertThat(TransactionConflict.classify(wrapped)).contains(TransactionConflict.NESTED_TRANSACTION);

        assertThat(TransactionConflict.classify(new SQLException("cannot rollback - no transaction is active")))
                .contains(TransactionConflict.NO_ACTIVE_TRANSACTION);
        assertThat(TransactionConflict.classify(new SQLException("cannot rollback transaction")))
                .contains(TransactionConflict.ROLLBACK_FAILED);
    }

    @Test
    void keepsTheConflictCarriedByLedgerException() {
        TransactionConflictException ex = new TransactionConflictException(TransactionConflict.ROLLBACK_FAILED, "boom");
        assertThat(TransactionConflict.classify(ex)).contains(TransactionConflict.ROLLBACK_FAILED);
    }

    @Test
    void ordinaryFailuresAreNotConflicts() {
        assertThat(TransactionConflict.classify(new IllegalStateException("disk I/O error"))).isEmpty();
        assertThat(TransactionConflict.classify(null)).isEmpty();
    }

    @Test
    void commitFailuresAreNotConflicts() {
        TransactionSystemException commit = new TransactionSystemException("Could not commit JDBC transaction",
                new SQLException("[SQLITE_BUSY] The database file is locked (database is locked)"));
        assertThat(TransactionConflict.classify(commit)).isEmpty();
        assertThat(TransactionConflict.classify(
                new UnexpectedRollbackException("Transaction rolled back because it has been marked as rollback-only")))
                .isEmpty();
    }
}
