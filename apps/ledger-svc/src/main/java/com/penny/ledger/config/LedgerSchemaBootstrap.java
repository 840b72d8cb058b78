package com.penny.ledger.config;

import com.penny.ledger.category.CategoryService;
import com.penny.ledger.model.ShadowCategories;
import jakarta.annotation.PostConstruct;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.stereotype.Component;

/**
 * Applies the idempotent ledger schema and makes sure the shadow category pair exists.
 * Disable with PENNY_DB_BOOTSTRAP=false when the schema is managed elsewhere.
 */
@Component
public class LedgerSchemaBootstrap {
    private static final Logger log = LoggerFactory.getLogger(LedgerSchemaBootstrap.class);

    static final String SCHEMA_LOCATION = "db/schema.sql";

    private final DataSource dataSource;
    private final CategoryService categoryService;
    private final PennyProperties properties;

    public LedgerSchemaBootstrap(DataSource dataSource, CategoryService categoryService, PennyProperties properties) {
        this.dataSource = dataSource;
        this.categoryService = categoryService;
        this.properties = properties;
    }

    @PostConstruct
    void bootstrap() {
        if (!properties.db().bootstrapEnabledFlag()) {
            log.info("Schema bootstrap disabled (penny.db.bootstrap-enabled=false)");
            return;
        }
        int applied = applySchema(dataSource);
        ShadowCategories shadow = categoryService.ensureShadowCategories();
        log.info("Schema bootstrap completed: {} statements applied, shadow categories {} / {}",
                applied, shadow.expense().id(), shadow.income().id());
    }

    /**
     * Runs every statement of the bundled schema script. All statements are {@code IF NOT EXISTS}.
     *
     * @return number of statements executed
     */
    public static int applySchema(DataSource dataSource) {
        Connection conn = DataSourceUtils.getConnection(dataSource);
        int applied = 0;
        try {
            for (String stmt : splitStatements(loadSchemaSql())) {
                try (Statement s = conn.createStatement()) {
                    s.execute(stmt);
                    applied++;
                } catch (SQLException ex) {
                    log.error("Failed executing schema statement: {}", stmt, ex);
                    throw new IllegalStateException("Schema bootstrap failed: " + ex.getMessage(), ex);
                }
            }
        } finally {
            DataSourceUtils.releaseConnection(conn, dataSource);
        }
        return applied;
    }

    private static String loadSchemaSql() {
        ClassPathResource res = new ClassPathResource(SCHEMA_LOCATION);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines().collect(Collectors.joining("\n"));
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read " + SCHEMA_LOCATION, ex);
        }
    }

    // the schema script holds plain DDL only, so splitting on ';' is safe
    private static List<String> splitStatements(String sql) {
        List<String> statements = new ArrayList<>();
        for (String part : sql.split(";")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                statements.add(trimmed);
            }
        }
        return statements;
    }
}
