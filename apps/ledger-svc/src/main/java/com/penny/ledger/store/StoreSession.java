package com.penny.ledger.store;

import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

/**
 * Statement-level access to the ledger database. A session handed to a
 * {@link LedgerStore.TransactionCallback} runs every statement inside the caller's open
 * transaction; the store itself runs each statement in auto-commit mode.
 */
public interface StoreSession {

    int execute(String sql, SqlParameterSource params);

    <T> List<T> queryAll(String sql, SqlParameterSource params, RowMapper<T> mapper);

    <T> Optional<T> queryFirst(String sql, SqlParameterSource params, RowMapper<T> mapper);

    /**
     * True when statements issued through this session belong to an open transaction.
     */
    boolean transactional();
}
