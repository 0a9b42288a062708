package com.flagship.period_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Value
public class PayoutAmountChangedEvent implements LedgerEvent {
    UUID eventId;
    BigDecimal amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PayoutAmountChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PayoutAmountChangedEvent of(BigDecimal amount, Clock clock) {
        return new PayoutAmountChangedEvent(UUID.randomUUID(), amount, clock.instant());
    }
}
