package com.penny.ledger.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
public class LedgerEventNotifier {

    private static final Logger log = LoggerFactory.getLogger(LedgerEventNotifier.class);

    private final ApplicationEventPublisher publisher;

    public LedgerEventNotifier(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public void publish(LedgerEvent.Kind kind, String subjectId) {
        publish(new LedgerEvent(kind, subjectId));
    }

    public void publish(LedgerEvent event) {
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException ex) {
            // listener failures must not undo a committed mutation
            log.warn("Ledger event listener failed for {} ({}): {}", event.kind(), event.subjectId(), ex.getMessage(), ex);
        }
    }
}
