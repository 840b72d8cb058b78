package com.penny.ledger.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Early sanity check of the JDBC URL so a misconfigured store path fails at startup
 * instead of surfacing as a generic Hikari message on the first query.
 */
@Component
@Profile("!test")
public class DataSourceDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(DataSourceDiagnostics.class);

    @Value("${spring.datasource.url:}")
    private String jdbcUrl;

    @PostConstruct
    void validate() {
        log.info("DataSource diagnostics: url='{}'", jdbcUrl);
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalStateException("spring.datasource.url is blank (set PENNY_DB_PATH or PENNY_DB_URL)");
        }
        if (!jdbcUrl.startsWith("jdbc:sqlite:")) {
            throw new IllegalStateException("spring.datasource.url must start with 'jdbc:sqlite:' (actual='" + jdbcUrl + "')");
        }
        if (!jdbcUrl.contains("foreign_keys=true")) {
            log.warn("JDBC url has no foreign_keys=true parameter; ON DELETE rules are not enforced");
        }
    }
}
