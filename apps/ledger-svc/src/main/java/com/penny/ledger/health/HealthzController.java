package com.penny.ledger.health;

import com.penny.ledger.store.LedgerStore;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.namedparam.EmptySqlParameterSource;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness check. Touches the store so an unreachable database file surfaces as a 503
 * through the exception handler instead of a green status.
 */
@RestController
public class HealthzController {

    private final LedgerStore store;

    public HealthzController(LedgerStore store) {
        this.store = store;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        store.queryFirst("SELECT 1", EmptySqlParameterSource.INSTANCE, (rs, rowNum) -> rs.getInt(1));
        return Map.of("status", "UP");
    }
}
