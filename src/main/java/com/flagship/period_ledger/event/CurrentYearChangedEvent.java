package com.flagship.period_ledger.event;

import lombok.Value;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Value
public class CurrentYearChangedEvent implements LedgerEvent {
    UUID eventId;
    int year;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CurrentYearChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CurrentYearChangedEvent of(int year, Clock clock) {
        return new CurrentYearChangedEvent(UUID.randomUUID(), year, clock.instant());
    }
}
