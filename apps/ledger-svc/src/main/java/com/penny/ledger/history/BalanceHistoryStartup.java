package com.penny.ledger.history;

import com.penny.ledger.config.PennyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Runs one reconstruction pass when the application is ready.
 */
@Component
public class BalanceHistoryStartup {

    private static final Logger log = LoggerFactory.getLogger(BalanceHistoryStartup.class);

    private final BalanceHistoryService balanceHistoryService;
    private final PennyProperties properties;

    public BalanceHistoryStartup(BalanceHistoryService balanceHistoryService, PennyProperties properties) {
        this.balanceHistoryService = balanceHistoryService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void populateOnStartup() {
        if (!properties.history().populateOnStartupFlag()) {
            log.info("Balance history population on startup disabled (penny.history.populate-on-startup=false)");
            return;
        }
        try {
            PopulationResult result = balanceHistoryService.populateCurrentMonthHistory();
            log.info("Startup balance history pass: outcome={}, snapshots={}", result.outcome(), result.snapshotsWritten());
        } catch (RuntimeException ex) {
            // already logged by the service; the next start retries
            log.warn("Startup balance history pass failed (application continues): {}", ex.getMessage());
        }
    }
}
