package com.penny.ledger.account;

import com.penny.ledger.model.Operation;
import com.penny.ledger.model.OperationType;
import com.penny.ledger.money.MoneyMath;
import com.penny.ledger.store.StoreSession;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
public class OperationRepository {

    private static final String COLUMNS = """
            o.id, o.type, o.amount, o.account_id, o.category_id, o.to_account_id, o.date, o.created_at, o.description,
            o.exchange_rate, o.destination_amount, o.source_currency, o.destination_currency
            """;

    private final MoneyMath money;

    public OperationRepository(MoneyMath money) {
        this.money = money;
    }

    public Optional<Operation> findById(StoreSession session, String id) {
        return session.queryFirst("SELECT " + COLUMNS + " FROM operations o WHERE o.id = :id",
                new MapSqlParameterSource("id", id), this::mapOperation);
    }

    /**
     * Entries that touch the account on either side, newest first.
     */
    public List<Operation> findByAccount(StoreSession session, String accountId) {
        return session.queryAll("SELECT " + COLUMNS + """
                 FROM operations o
                WHERE o.account_id = :accountId OR o.to_account_id = :accountId
                ORDER BY o.date DESC, o.created_at DESC
                """, new MapSqlParameterSource("accountId", accountId), this::mapOperation);
    }

    public List<Operation> findByDateRange(StoreSession session, LocalDate from, LocalDate to) {
        return session.queryAll("SELECT " + COLUMNS + """
                 FROM operations o
                WHERE o.date >= :from AND o.date <= :to
                ORDER BY o.date DESC, o.created_at DESC
                """, new MapSqlParameterSource()
                .addValue("from", from.toString())
                .addValue("to", to.toString()), this::mapOperation);
    }

    /**
     * Entries touching the account dated strictly after {@code date}, newest first.
     */
    public List<Operation> findAffectingAccountAfter(StoreSession session, String accountId, LocalDate date) {
        return session.queryAll("SELECT " + COLUMNS + """
                 FROM operations o
                WHERE (o.account_id = :accountId OR o.to_account_id = :accountId)
                  AND o.date > :date
                ORDER BY o.date DESC, o.created_at DESC
                """, new MapSqlParameterSource()
                .addValue("accountId", accountId)
                .addValue("date", date.toString()), this::mapOperation);
    }

    /**
     * Latest adjustment entry for the account on the given day, filed under one of the shadow categories.
     */
    public Optional<Operation> findAdjustment(StoreSession session, String accountId, LocalDate date, Collection<String> shadowCategoryIds) {
        return session.queryFirst("SELECT " + COLUMNS + """
                 FROM operations o
                WHERE o.account_id = :accountId
                  AND o.date = :date
                  AND o.category_id IN (:categoryIds)
                ORDER BY o.created_at DESC
                LIMIT 1
                """, new MapSqlParameterSource()
                .addValue("accountId", accountId)
                .addValue("date", date.toString())
                .addValue("categoryIds", shadowCategoryIds), this::mapOperation);
    }

    /**
     * Expense entries in the category set, dated within [from, to], from accounts held in {@code currency}.
     */
    public List<Operation> findExpenses(StoreSession session, Collection<String> categoryIds, String currency, LocalDate from, LocalDate to) {
        if (categoryIds.isEmpty()) {
            return List.of();
        }
        return session.queryAll("SELECT " + COLUMNS + """
                 FROM operations o
                 JOIN accounts a ON o.account_id = a.id
                WHERE o.type = 'expense'
                  AND a.currency = :currency
                  AND o.category_id IN (:categoryIds)
                  AND o.date >= :from
                  AND o.date <= :to
                """, new MapSqlParameterSource()
                .addValue("currency", currency)
                .addValue("categoryIds", categoryIds)
                .addValue("from", from.toString())
                .addValue("to", to.toString()), this::mapOperation);
    }

    public List<Operation> findByTypeAndCurrency(StoreSession session, OperationType type, String currency, LocalDate from, LocalDate to) {
        return session.queryAll("SELECT " + COLUMNS + """
                 FROM operations o
                 JOIN accounts a ON o.account_id = a.id
                WHERE o.type = :type
                  AND a.currency = :currency
                  AND o.date >= :from
                  AND o.date <= :to
                """, new MapSqlParameterSource()
                .addValue("type", type.value())
                .addValue("currency", currency)
                .addValue("from", from.toString())
                .addValue("to", to.toString()), this::mapOperation);
    }

    /**
     * Entries of one type booked on the account itself, dated within [from, to]. Transfers are
     * never included.
     */
    public List<Operation> findForAccount(StoreSession session, String accountId, OperationType type, LocalDate from, LocalDate to) {
        return session.queryAll("SELECT " + COLUMNS + """
                 FROM operations o
                WHERE o.account_id = :accountId
                  AND o.type = :type
                  AND o.date >= :from
                  AND o.date <= :to
                """, new MapSqlParameterSource()
                .addValue("accountId", accountId)
                .addValue("type", type.value())
                .addValue("from", from.toString())
                .addValue("to", to.toString()), this::mapOperation);
    }

    /**
     * Distinct months that have at least one entry, newest first.
     */
    public List<YearMonth> findMonths(StoreSession session) {
        return session.queryAll("""
                SELECT DISTINCT substr(date, 1, 7) AS month
                  FROM operations
                 ORDER BY month DESC
                """, new MapSqlParameterSource(), (rs, rowNum) -> YearMonth.parse(rs.getString("month")));
    }

    public int countForAccount(StoreSession session, String accountId) {
        return session.queryFirst("SELECT COUNT(*) FROM operations WHERE account_id = :accountId OR to_account_id = :accountId",
                new MapSqlParameterSource("accountId", accountId), (rs, rowNum) -> rs.getInt(1)).orElse(0);
    }

    public int reassignSource(StoreSession session, String fromAccountId, String toAccountId) {
        return session.execute("UPDATE operations SET account_id = :to WHERE account_id = :from",
                new MapSqlParameterSource().addValue("from", fromAccountId).addValue("to", toAccountId));
    }

    public int reassignDestination(StoreSession session, String fromAccountId, String toAccountId) {
        return session.execute("UPDATE operations SET to_account_id = :to WHERE to_account_id = :from",
                new MapSqlParameterSource().addValue("from", fromAccountId).addValue("to", toAccountId));
    }

    public void insert(StoreSession session, Operation operation) {
        session.execute("""
                INSERT INTO operations (id, type, amount, account_id, category_id, to_account_id, date, created_at, description,
                                        exchange_rate, destination_amount, source_currency, destination_currency)
                VALUES (:id, :type, :amount, :accountId, :categoryId, :toAccountId, :date, :createdAt, :description,
                        :exchangeRate, :destinationAmount, :sourceCurrency, :destinationCurrency)
                """, params(operation));
    }

    public int update(StoreSession session, Operation operation) {
        return session.execute("""
                UPDATE operations
                SET type = :type,
                    amount = :amount,
                    account_id = :accountId,
                    category_id = :categoryId,
                    to_account_id = :toAccountId,
                    date = :date,
                    description = :description,
                    exchange_rate = :exchangeRate,
                    destination_amount = :destinationAmount,
                    source_currency = :sourceCurrency,
                    destination_currency = :destinationCurrency
                WHERE id = :id
                """, params(operation));
    }

    public int delete(StoreSession session, String id) {
        return session.execute("DELETE FROM operations WHERE id = :id", new MapSqlParameterSource("id", id));
    }

    private MapSqlParameterSource params(Operation operation) {
        return new MapSqlParameterSource()
                .addValue("id", operation.id())
                .addValue("type", operation.type().value())
                .addValue("amount", money.format(operation.amount()))
                .addValue("accountId", operation.accountId())
                .addValue("categoryId", operation.categoryId(), Types.VARCHAR)
                .addValue("toAccountId", operation.toAccountId(), Types.VARCHAR)
                .addValue("date", operation.date().toString())
                .addValue("createdAt", operation.createdAt().toString())
                .addValue("description", operation.description(), Types.VARCHAR)
                .addValue("exchangeRate", operation.exchangeRate() == null ? null : operation.exchangeRate().toPlainString(), Types.VARCHAR)
                .addValue("destinationAmount", operation.destinationAmount() == null ? null : money.format(operation.destinationAmount()), Types.VARCHAR)
                .addValue("sourceCurrency", operation.sourceCurrency(), Types.VARCHAR)
                .addValue("destinationCurrency", operation.destinationCurrency(), Types.VARCHAR);
    }

    private Operation mapOperation(ResultSet rs, int rowNum) throws SQLException {
        return new Operation(
                rs.getString("id"),
                OperationType.fromValue(rs.getString("type")),
                money.parse(rs.getString("amount")),
                rs.getString("account_id"),
                rs.getString("category_id"),
                rs.getString("to_account_id"),
                LocalDate.parse(rs.getString("date")),
                Instant.parse(rs.getString("created_at")),
                rs.getString("description"),
                decimalOrNull(rs.getString("exchange_rate")),
                decimalOrNull(rs.getString("destination_amount")),
                rs.getString("source_currency"),
                rs.getString("destination_currency")
        );
    }

    private BigDecimal decimalOrNull(String stored) {
        return stored == null || stored.isBlank() ? null : new BigDecimal(stored.trim());
    }
}
