package com.flagship.period_ledger.event;

import lombok.Value;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Value
public class CurrentMonthChangedEvent implements LedgerEvent {
    UUID eventId;
    int month;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CurrentMonthChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CurrentMonthChangedEvent of(int month, Clock clock) {
        return new CurrentMonthChangedEvent(UUID.randomUUID(), month, clock.instant());
    }
}
