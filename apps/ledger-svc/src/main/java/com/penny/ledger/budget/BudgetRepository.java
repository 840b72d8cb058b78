package com.penny.ledger.budget;

import com.penny.ledger.model.Budget;
import com.penny.ledger.model.PeriodType;
import com.penny.ledger.money.MoneyMath;
import com.penny.ledger.store.StoreSession;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
public class BudgetRepository {

    private static final String COLUMNS = """
            id, category_id, amount, currency, period_type, start_date, end_date, is_recurring, rollover_enabled, created_at, updated_at
            """;

    private final MoneyMath money;

    public BudgetRepository(MoneyMath money) {
        this.money = money;
    }

    public List<Budget> findAll(StoreSession session) {
        return session.queryAll("SELECT " + COLUMNS + " FROM budgets ORDER BY created_at ASC, id ASC",
                new MapSqlParameterSource(), this::mapBudget);
    }

    public Optional<Budget> findById(StoreSession session, String id) {
        return session.queryFirst("SELECT " + COLUMNS + " FROM budgets WHERE id = :id",
                new MapSqlParameterSource("id", id), this::mapBudget);
    }

    public List<Budget> findByCategory(StoreSession session, String categoryId) {
        return session.queryAll("SELECT " + COLUMNS + " FROM budgets WHERE category_id = :categoryId ORDER BY created_at ASC, id ASC",
                new MapSqlParameterSource("categoryId", categoryId), this::mapBudget);
    }

    public List<Budget> findByCurrency(StoreSession session, String currency) {
        return session.queryAll("SELECT " + COLUMNS + " FROM budgets WHERE currency = :currency ORDER BY created_at ASC, id ASC",
                new MapSqlParameterSource("currency", currency), this::mapBudget);
    }

    public List<Budget> findByPeriodType(StoreSession session, PeriodType periodType) {
        return session.queryAll("SELECT " + COLUMNS + " FROM budgets WHERE period_type = :periodType ORDER BY created_at ASC, id ASC",
                new MapSqlParameterSource("periodType", periodType.value()), this::mapBudget);
    }

    /**
     * Budgets whose window covers {@code date}; an open end date never expires.
     */
    public List<Budget> findActive(StoreSession session, LocalDate date) {
        return session.queryAll("SELECT " + COLUMNS + """
                 FROM budgets
                WHERE start_date <= :date
                  AND (end_date IS NULL OR end_date >= :date)
                ORDER BY created_at ASC, id ASC
                """, new MapSqlParameterSource("date", date.toString()), this::mapBudget);
    }

    public boolean existsActiveForCategory(StoreSession session, String categoryId, LocalDate date) {
        return session.queryFirst("""
                SELECT 1 FROM budgets
                WHERE category_id = :categoryId
                  AND start_date <= :date
                  AND (end_date IS NULL OR end_date >= :date)
                LIMIT 1
                """, new MapSqlParameterSource()
                .addValue("categoryId", categoryId)
                .addValue("date", date.toString()), (rs, rowNum) -> Boolean.TRUE).isPresent();
    }

    public List<Budget> findRecurring(StoreSession session) {
        return session.queryAll("SELECT " + COLUMNS + " FROM budgets WHERE is_recurring = 1 ORDER BY created_at ASC, id ASC",
                new MapSqlParameterSource(), this::mapBudget);
    }

    public Optional<Budget> findDuplicate(StoreSession session, String categoryId, String currency, PeriodType periodType, String excludeId) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + """
                 FROM budgets
                WHERE category_id = :categoryId
                  AND currency = :currency
                  AND period_type = :periodType
                """);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("categoryId", categoryId)
                .addValue("currency", currency)
                .addValue("periodType", periodType.value());
        if (excludeId != null) {
            sql.append(" AND id != :excludeId");
            params.addValue("excludeId", excludeId);
        }
        sql.append(" LIMIT 1");
        return session.queryFirst(sql.toString(), params, this::mapBudget);
    }

    public boolean exists(StoreSession session, String id) {
        return session.queryFirst("SELECT 1 FROM budgets WHERE id = :id",
                new MapSqlParameterSource("id", id), (rs, rowNum) -> Boolean.TRUE).isPresent();
    }

    public void insert(StoreSession session, Budget budget) {
        session.execute("""
                INSERT INTO budgets (id, category_id, amount, currency, period_type, start_date, end_date, is_recurring, rollover_enabled, created_at, updated_at)
                VALUES (:id, :categoryId, :amount, :currency, :periodType, :startDate, :endDate, :recurring, :rolloverEnabled, :createdAt, :updatedAt)
                """, params(budget));
    }

    public int update(StoreSession session, Budget budget) {
        return session.execute("""
                UPDATE budgets
                SET category_id = :categoryId,
                    amount = :amount,
                    currency = :currency,
                    period_type = :periodType,
                    start_date = :startDate,
                    end_date = :endDate,
                    is_recurring = :recurring,
                    rollover_enabled = :rolloverEnabled,
                    updated_at = :updatedAt
                WHERE id = :id
                """, params(budget));
    }

    public int delete(StoreSession session, String id) {
        return session.execute("DELETE FROM budgets WHERE id = :id", new MapSqlParameterSource("id", id));
    }

    private MapSqlParameterSource params(Budget budget) {
        return new MapSqlParameterSource()
                .addValue("id", budget.id())
                .addValue("categoryId", budget.categoryId())
                .addValue("amount", money.format(budget.amount()))
                .addValue("currency", budget.currency())
                .addValue("periodType", budget.periodType().value())
                .addValue("startDate", budget.startDate().toString())
                .addValue("endDate", budget.endDate() == null ? null : budget.endDate().toString(), Types.VARCHAR)
                .addValue("recurring", budget.recurring() ? 1 : 0)
                .addValue("rolloverEnabled", budget.rolloverEnabled() ? 1 : 0)
                .addValue("createdAt", budget.createdAt().toString())
                .addValue("updatedAt", budget.updatedAt().toString());
    }

    private Budget mapBudget(ResultSet rs, int rowNum) throws SQLException {
        String endDate = rs.getString("end_date");
        return new Budget(
                rs.getString("id"),
                rs.getString("category_id"),
                money.parse(rs.getString("amount")),
                rs.getString("currency"),
                PeriodType.fromValue(rs.getString("period_type")),
                LocalDate.parse(rs.getString("start_date")),
                endDate == null || endDate.isBlank() ? null : LocalDate.parse(endDate),
                rs.getInt("is_recurring") == 1,
                rs.getInt("rollover_enabled") == 1,
                Instant.parse(rs.getString("created_at")),
                Instant.parse(rs.getString("updated_at"))
        );
    }
}
