package com.penny.ledger.history;

import com.penny.ledger.model.AccountBalanceOnDate;
import com.penny.ledger.model.BalanceSnapshot;
import com.penny.ledger.money.MoneyMath;
import com.penny.ledger.store.StoreSession;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
public class BalanceHistoryRepository {

    private final MoneyMath money;

    public BalanceHistoryRepository(MoneyMath money) {
        this.money = money;
    }

    public List<BalanceSnapshot> findRange(StoreSession session, String accountId, LocalDate from, LocalDate to) {
        return session.queryAll("""
                SELECT account_id, date, balance, created_at
                FROM accounts_balance_history
                WHERE account_id = :accountId AND date >= :from AND date <= :to
                ORDER BY date ASC
                """, new MapSqlParameterSource()
                .addValue("accountId", accountId)
                .addValue("from", from.toString())
                .addValue("to", to.toString()), this::mapSnapshot);
    }

    public List<BalanceSnapshot> findByAccount(StoreSession session, String accountId) {
        return session.queryAll("""
                SELECT account_id, date, balance, created_at
                FROM accounts_balance_history
                WHERE account_id = :accountId
                ORDER BY date ASC
                """, new MapSqlParameterSource("accountId", accountId), this::mapSnapshot);
    }

    public Optional<BigDecimal> findBalance(StoreSession session, String accountId, LocalDate date) {
        return session.queryFirst("""
                SELECT balance
                FROM accounts_balance_history
                WHERE account_id = :accountId AND date = :date
                LIMIT 1
                """, new MapSqlParameterSource()
                .addValue("accountId", accountId)
                .addValue("date", date.toString()), (rs, rowNum) -> money.parse(rs.getString("balance")));
    }

    public Optional<LocalDate> findLastDate(StoreSession session, String accountId) {
        return session.queryFirst("""
                SELECT date
                FROM accounts_balance_history
                WHERE account_id = :accountId
                ORDER BY date DESC
                LIMIT 1
                """, new MapSqlParameterSource("accountId", accountId), (rs, rowNum) -> LocalDate.parse(rs.getString("date")));
    }

    public List<AccountBalanceOnDate> findAllOnDate(StoreSession session, LocalDate date) {
        return session.queryAll("""
                SELECT abh.account_id, a.name, a.currency, abh.balance
                FROM accounts_balance_history abh
                JOIN accounts a ON abh.account_id = a.id
                WHERE abh.date = :date
                ORDER BY a.display_order ASC
                """, new MapSqlParameterSource("date", date.toString()),
                (rs, rowNum) -> new AccountBalanceOnDate(
                        rs.getString("account_id"),
                        rs.getString("name"),
                        rs.getString("currency"),
                        money.parse(rs.getString("balance"))));
    }

    /**
     * Writes the row unless one already exists for the account and day.
     */
    public boolean insertIfAbsent(StoreSession session, String accountId, LocalDate date, BigDecimal balance, Instant createdAt) {
        return session.execute("""
                INSERT OR IGNORE INTO accounts_balance_history (account_id, date, balance, created_at)
                VALUES (:accountId, :date, :balance, :createdAt)
                """, params(accountId, date, balance, createdAt)) > 0;
    }

    public void upsert(StoreSession session, String accountId, LocalDate date, BigDecimal balance, Instant createdAt) {
        session.execute("""
                INSERT INTO accounts_balance_history (account_id, date, balance, created_at)
                VALUES (:accountId, :date, :balance, :createdAt)
                ON CONFLICT (account_id, date)
                DO UPDATE SET balance = excluded.balance
                """, params(accountId, date, balance, createdAt));
    }

    public int delete(StoreSession session, String accountId, LocalDate date) {
        return session.execute("DELETE FROM accounts_balance_history WHERE account_id = :accountId AND date = :date",
                new MapSqlParameterSource()
                        .addValue("accountId", accountId)
                        .addValue("date", date.toString()));
    }

    public int deleteByAccount(StoreSession session, String accountId) {
        return session.execute("DELETE FROM accounts_balance_history WHERE account_id = :accountId",
                new MapSqlParameterSource("accountId", accountId));
    }

    /**
     * Removes every row dated in [from, before) across all accounts.
     */
    public int deleteBetween(StoreSession session, LocalDate from, LocalDate before) {
        return session.execute("DELETE FROM accounts_balance_history WHERE date >= :from AND date < :before",
                new MapSqlParameterSource()
                        .addValue("from", from.toString())
                        .addValue("before", before.toString()));
    }

    private MapSqlParameterSource params(String accountId, LocalDate date, BigDecimal balance, Instant createdAt) {
        return new MapSqlParameterSource()
                .addValue("accountId", accountId)
                .addValue("date", date.toString())
                .addValue("balance", money.format(balance))
                .addValue("createdAt", createdAt.toString());
    }

    private BalanceSnapshot mapSnapshot(ResultSet rs, int rowNum) throws SQLException {
        return new BalanceSnapshot(
                rs.getString("account_id"),
                LocalDate.parse(rs.getString("date")),
                money.parse(rs.getString("balance")),
                Instant.parse(rs.getString("created_at"))
        );
    }
}
