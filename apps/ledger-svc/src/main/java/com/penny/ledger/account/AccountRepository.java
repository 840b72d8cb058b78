package com.penny.ledger.account;

import com.penny.ledger.model.Account;
import com.penny.ledger.money.MoneyMath;
import com.penny.ledger.store.StoreSession;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
public class AccountRepository {

    private static final String COLUMNS = """
            id, name, balance, currency, display_order, hidden, monthly_target, created_at, updated_at
            """;

    private final MoneyMath money;

    public AccountRepository(MoneyMath money) {
        this.money = money;
    }

    public List<Account> findAll(StoreSession session) {
        return session.queryAll("SELECT " + COLUMNS + " FROM accounts ORDER BY display_order ASC, created_at DESC",
                new MapSqlParameterSource(), this::mapAccount);
    }

    public Optional<Account> findById(StoreSession session, String id) {
        return session.queryFirst("SELECT " + COLUMNS + " FROM accounts WHERE id = :id",
                new MapSqlParameterSource("id", id), this::mapAccount);
    }

    public Optional<BigDecimal> findBalance(StoreSession session, String id) {
        return session.queryFirst("SELECT balance FROM accounts WHERE id = :id",
                new MapSqlParameterSource("id", id), (rs, rowNum) -> money.parse(rs.getString("balance")));
    }

    public boolean exists(StoreSession session, String id) {
        return session.queryFirst("SELECT 1 FROM accounts WHERE id = :id",
                new MapSqlParameterSource("id", id), (rs, rowNum) -> Boolean.TRUE).isPresent();
    }

    public int maxDisplayOrder(StoreSession session) {
        return session.queryFirst("SELECT COALESCE(MAX(display_order), -1) FROM accounts",
                new MapSqlParameterSource(), (rs, rowNum) -> rs.getInt(1)).orElse(-1);
    }

    public void insert(StoreSession session, Account account) {
        session.execute("""
                INSERT INTO accounts (id, name, balance, currency, display_order, hidden, monthly_target, created_at, updated_at)
                VALUES (:id, :name, :balance, :currency, :displayOrder, :hidden, :monthlyTarget, :createdAt, :updatedAt)
                """, new MapSqlParameterSource()
                .addValue("id", account.id())
                .addValue("name", account.name())
                .addValue("balance", money.format(account.balance()))
                .addValue("currency", account.currency())
                .addValue("displayOrder", account.displayOrder())
                .addValue("hidden", account.hidden() ? 1 : 0)
                .addValue("monthlyTarget", formatNullable(account.monthlyTarget()), Types.VARCHAR)
                .addValue("createdAt", account.createdAt().toString())
                .addValue("updatedAt", account.updatedAt().toString()));
    }

    public int updateDetails(StoreSession session, Account account) {
        return session.execute("""
                UPDATE accounts
                SET name = :name,
                    currency = :currency,
                    hidden = :hidden,
                    monthly_target = :monthlyTarget,
                    updated_at = :updatedAt
                WHERE id = :id
                """, new MapSqlParameterSource()
                .addValue("id", account.id())
                .addValue("name", account.name())
                .addValue("currency", account.currency())
                .addValue("hidden", account.hidden() ? 1 : 0)
                .addValue("monthlyTarget", formatNullable(account.monthlyTarget()), Types.VARCHAR)
                .addValue("updatedAt", account.updatedAt().toString()));
    }

    public int updateBalance(StoreSession session, String id, BigDecimal balance, Instant updatedAt) {
        return session.execute("UPDATE accounts SET balance = :balance, updated_at = :updatedAt WHERE id = :id",
                new MapSqlParameterSource()
                        .addValue("id", id)
                        .addValue("balance", money.format(balance))
                        .addValue("updatedAt", updatedAt.toString()));
    }

    public int updateDisplayOrder(StoreSession session, String id, int displayOrder, Instant updatedAt) {
        return session.execute("UPDATE accounts SET display_order = :displayOrder, updated_at = :updatedAt WHERE id = :id",
                new MapSqlParameterSource()
                        .addValue("id", id)
                        .addValue("displayOrder", displayOrder)
                        .addValue("updatedAt", updatedAt.toString()));
    }

    public int delete(StoreSession session, String id) {
        return session.execute("DELETE FROM accounts WHERE id = :id", new MapSqlParameterSource("id", id));
    }

    private String formatNullable(BigDecimal value) {
        return value == null ? null : money.format(value);
    }

    private Account mapAccount(ResultSet rs, int rowNum) throws SQLException {
        String monthlyTarget = rs.getString("monthly_target");
        return new Account(
                rs.getString("id"),
                rs.getString("name"),
                money.parse(rs.getString("balance")),
                rs.getString("currency"),
                rs.getInt("display_order"),
                rs.getInt("hidden") == 1,
                monthlyTarget == null ? null : money.parse(monthlyTarget),
                Instant.parse(rs.getString("created_at")),
                Instant.parse(rs.getString("updated_at"))
        );
    }
}
