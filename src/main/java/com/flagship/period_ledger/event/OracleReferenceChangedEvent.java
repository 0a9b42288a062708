package com.flagship.period_ledger.event;

import lombok.Value;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Value
public class OracleReferenceChangedEvent implements LedgerEvent {
    UUID eventId;
    String reference;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OracleReferenceChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OracleReferenceChangedEvent of(String reference, Clock clock) {
        return new OracleReferenceChangedEvent(UUID.randomUUID(), reference, clock.instant());
    }
}
