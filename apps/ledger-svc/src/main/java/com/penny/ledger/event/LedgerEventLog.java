package com.penny.ledger.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class LedgerEventLog {

    private static final Logger log = LoggerFactory.getLogger(LedgerEventLog.class);

    @EventListener
    public void onLedgerEvent(LedgerEvent event) {
        log.debug("Ledger event: kind={} subject={}", event.kind(), event.subjectId());
    }
}
