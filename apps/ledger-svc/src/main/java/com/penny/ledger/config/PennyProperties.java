package com.penny.ledger.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "penny")
public record PennyProperties(
        String defaultCurrency,
        String timeZone,
        History history,
        Db db,
        Trace trace
) {

    @ConstructorBinding
    public PennyProperties {
        if (defaultCurrency == null || defaultCurrency.isBlank()) {
            defaultCurrency = "USD";
        }
        if (timeZone == null || timeZone.isBlank()) {
            timeZone = "UTC";
        }
        try {
            ZoneId.of(timeZone);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("time-zone must be a valid zone id (actual='" + timeZone + "')", ex);
        }
        if (history == null) {
            history = new History(true);
        }
        if (db == null) {
            db = new Db(true);
        }
        if (trace == null) {
            trace = new Trace(null);
        }
    }

    /**
     * Zone whose calendar date is "today" for snapshots and budget periods.
     */
    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }

    public record History(Boolean populateOnStartup) {
        public boolean populateOnStartupFlag() {
            return populateOnStartup == null || populateOnStartup;
        }
    }

    public record Db(Boolean bootstrapEnabled) {
        public boolean bootstrapEnabledFlag() {
            return bootstrapEnabled == null || bootstrapEnabled;
        }
    }

    /**
     * Request header that carries the trace id in and out.
     */
    public record Trace(String header) {

        public static final String DEFAULT_HEADER = "X-Request-Trace";

        public Trace {
            if (header == null || header.isBlank()) {
                header = DEFAULT_HEADER;
            }
        }
    }
}
