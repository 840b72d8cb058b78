package com.penny.ledger.store;

import com.penny.ledger.error.TransactionConflictException;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

@Repository
public class JdbcLedgerStore implements LedgerStore {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final StoreSession boundSession = new BoundSession();

    public JdbcLedgerStore(NamedParameterJdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public int execute(String sql, SqlParameterSource params) {
        return jdbcTemplate.update(sql, params);
    }

    @Override
    public <T> List<T> queryAll(String sql, SqlParameterSource params, RowMapper<T> mapper) {
        return jdbcTemplate.query(sql, params, mapper);
    }

    @Override
    public <T> Optional<T> queryFirst(String sql, SqlParameterSource params, RowMapper<T> mapper) {
        List<T> rows = jdbcTemplate.query(sql, params, mapper);
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    @Override
    public boolean transactional() {
        return TransactionSynchronizationManager.isActualTransactionActive();
    }

    @Override
    public <T> T inTransaction(TransactionCallback<T> callback) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new TransactionConflictException(TransactionConflict.NESTED_TRANSACTION,
                    "cannot start a transaction within a transaction");
        }
        try {
            return transactionTemplate.execute(status -> callback.doInTransaction(boundSession));
        } catch (TransactionException ex) {
            TransactionConflict conflict = TransactionConflict.classify(ex).orElse(null);
            if (conflict == null) {
                throw ex;
            }
            throw new TransactionConflictException(conflict, ex.getMessage(), ex);
        }
    }

    /**
     * Statements run on the connection bound to the current transaction by the template.
     */
    private final class BoundSession implements StoreSession {

        @Override
        public int execute(String sql, SqlParameterSource params) {
            return JdbcLedgerStore.this.execute(sql, params);
        }

        @Override
        public <T> List<T> queryAll(String sql, SqlParameterSource params, RowMapper<T> mapper) {
            return JdbcLedgerStore.this.queryAll(sql, params, mapper);
        }

        @Override
        public <T> Optional<T> queryFirst(String sql, SqlParameterSource params, RowMapper<T> mapper) {
            return JdbcLedgerStore.this.queryFirst(sql, params, mapper);
        }

        @Override
        public boolean transactional() {
            return true;
        }
    }
}
