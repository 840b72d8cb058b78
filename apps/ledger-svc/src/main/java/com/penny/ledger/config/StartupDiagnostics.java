package com.penny.ledger.config;

import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final PennyProperties props;
    private final Clock clock;

    public StartupDiagnostics(PennyProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    @PostConstruct
    void logConfig() {
        log.info("Startup diagnostics: defaultCurrency='{}', timeZone='{}', today={}, env(PENNY_TIME_ZONE)='{}'",
                props.defaultCurrency(), props.timeZone(), LocalDate.now(clock), System.getenv("PENNY_TIME_ZONE"));
        log.info("History config: populateOnStartup={}, schemaBootstrap={}",
                props.history().populateOnStartupFlag(), props.db().bootstrapEnabledFlag());
    }
}
