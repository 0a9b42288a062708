package com.flagship.period_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Value
public class FeeAmountChangedEvent implements LedgerEvent {
    UUID eventId;
    BigDecimal amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FeeAmountChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static FeeAmountChangedEvent of(BigDecimal amount, Clock clock) {
        return new FeeAmountChangedEvent(UUID.randomUUID(), amount, clock.instant());
    }
}
