package com.flagship.period_ledger.event;

import lombok.extern.slf4j.Slf4j;

/**
 * Publisher used when Kafka is disabled ({@code events.kafka.enabled=false}).
 * Writes each event to the application log.
 */
@Slf4j
public class LoggingLedgerEventPublisher implements LedgerEventPublisher {

    @Override
    public void publish(LedgerEvent event) {
        log.info("Ledger event: type={}, eventId={}, event={}",
                event.getEventType(), event.getEventId(), event);
    }
}
