package com.penny.ledger.category;

import com.penny.ledger.model.Category;
import com.penny.ledger.model.CategoryKind;
import com.penny.ledger.model.CategoryType;
import com.penny.ledger.store.StoreSession;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
public class CategoryRepository {

    private static final String COLUMNS = """
            id, name, type, category_type, parent_id, icon, color, is_shadow, exclude_from_forecast, created_at, updated_at
            """;

    public List<Category> findAll(StoreSession session, boolean includeShadow) {
        String sql = "SELECT " + COLUMNS + " FROM categories"
                + (includeShadow ? "" : " WHERE is_shadow = 0")
                + " ORDER BY created_at ASC, id ASC";
        return session.queryAll(sql, new MapSqlParameterSource(), this::mapCategory);
    }

    public Optional<Category> findById(StoreSession session, String id) {
        return session.queryFirst("SELECT " + COLUMNS + " FROM categories WHERE id = :id",
                new MapSqlParameterSource("id", id), this::mapCategory);
    }

    public List<Category> findChildren(StoreSession session, String parentId) {
        if (parentId == null) {
            return session.queryAll("SELECT " + COLUMNS + " FROM categories WHERE parent_id IS NULL AND is_shadow = 0 ORDER BY created_at ASC, id ASC",
                    new MapSqlParameterSource(), this::mapCategory);
        }
        return session.queryAll("SELECT " + COLUMNS + " FROM categories WHERE parent_id = :parentId ORDER BY created_at ASC, id ASC",
                new MapSqlParameterSource("parentId", parentId), this::mapCategory);
    }

    /**
     * Child-to-parent links for every category, in creation order. Roots map to {@code null}.
     */
    public Map<String, String> findParentLinks(StoreSession session) {
        Map<String, String> links = new LinkedHashMap<>();
        session.queryAll("SELECT id, parent_id FROM categories ORDER BY created_at ASC, id ASC",
                new MapSqlParameterSource(),
                (rs, rowNum) -> {
                    links.put(rs.getString("id"), rs.getString("parent_id"));
                    return null;
                });
        return links;
    }

    public List<Category> findShadow(StoreSession session) {
        return session.queryAll("SELECT " + COLUMNS + " FROM categories WHERE is_shadow = 1 ORDER BY created_at ASC, id ASC",
                new MapSqlParameterSource(), this::mapCategory);
    }

    public boolean exists(StoreSession session, String id) {
        return session.queryFirst("SELECT 1 FROM categories WHERE id = :id",
                new MapSqlParameterSource("id", id), (rs, rowNum) -> Boolean.TRUE).isPresent();
    }

    public int countChildren(StoreSession session, String id) {
        return session.queryFirst("SELECT COUNT(*) FROM categories WHERE parent_id = :id",
                new MapSqlParameterSource("id", id), (rs, rowNum) -> rs.getInt(1)).orElse(0);
    }

    public int countUsage(StoreSession session, String id) {
        return session.queryFirst("SELECT COUNT(*) FROM operations WHERE category_id = :id",
                new MapSqlParameterSource("id", id), (rs, rowNum) -> rs.getInt(1)).orElse(0);
    }

    public void insert(StoreSession session, Category category) {
        session.execute("""
                INSERT INTO categories (id, name, type, category_type, parent_id, icon, color, is_shadow, exclude_from_forecast, created_at, updated_at)
                VALUES (:id, :name, :type, :categoryType, :parentId, :icon, :color, :shadow, :excludeFromForecast, :createdAt, :updatedAt)
                """, params(category));
    }

    /**
     * Inserts unless a row with the same id exists. Returns whether a row was written.
     */
    public boolean insertIfAbsent(StoreSession session, Category category) {
        return session.execute("""
                INSERT OR IGNORE INTO categories (id, name, type, category_type, parent_id, icon, color, is_shadow, exclude_from_forecast, created_at, updated_at)
                VALUES (:id, :name, :type, :categoryType, :parentId, :icon, :color, :shadow, :excludeFromForecast, :createdAt, :updatedAt)
                """, params(category)) > 0;
    }

    public void update(StoreSession session, Category category) {
        session.execute("""
                UPDATE categories
                SET name = :name,
                    type = :type,
                    category_type = :categoryType,
                    parent_id = :parentId,
                    icon = :icon,
                    color = :color,
                    exclude_from_forecast = :excludeFromForecast,
                    updated_at = :updatedAt
                WHERE id = :id
                """, params(category));
    }

    public int updateParent(StoreSession session, String id, String parentId, Instant updatedAt) {
        return session.execute("UPDATE categories SET parent_id = :parentId, updated_at = :updatedAt WHERE id = :id",
                new MapSqlParameterSource()
                        .addValue("id", id)
                        .addValue("parentId", parentId, Types.VARCHAR)
                        .addValue("updatedAt", updatedAt.toString()));
    }

    public int delete(StoreSession session, String id) {
        return session.execute("DELETE FROM categories WHERE id = :id", new MapSqlParameterSource("id", id));
    }

    private MapSqlParameterSource params(Category category) {
        return new MapSqlParameterSource()
                .addValue("id", category.id())
                .addValue("name", category.name())
                .addValue("type", category.type().value())
                .addValue("categoryType", category.categoryType().value())
                .addValue("parentId", category.parentId(), Types.VARCHAR)
                .addValue("icon", category.icon(), Types.VARCHAR)
                .addValue("color", category.color(), Types.VARCHAR)
                .addValue("shadow", category.shadow() ? 1 : 0)
                .addValue("excludeFromForecast", category.excludeFromForecast() ? 1 : 0)
                .addValue("createdAt", category.createdAt().toString())
                .addValue("updatedAt", category.updatedAt().toString());
    }

    private Category mapCategory(ResultSet rs, int rowNum) throws SQLException {
        return new Category(
                rs.getString("id"),
                rs.getString("name"),
                CategoryKind.fromValue(rs.getString("type")),
                CategoryType.fromValue(rs.getString("category_type")),
                rs.getString("parent_id"),
                rs.getString("icon"),
                rs.getString("color"),
                rs.getInt("is_shadow") == 1,
                rs.getInt("exclude_from_forecast") == 1,
                Instant.parse(rs.getString("created_at")),
                Instant.parse(rs.getString("updated_at"))
        );
    }
}
